/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.admission.ddd.authorization;

import java.io.Serializable;

/**
 * Represents whoever sends a message to a bounded context: a candidate preparing a proposition, a
 * promoter or committee member signing it, a manager acting on their behalf.
 *
 * <p>Handlers only ever see this contract, which keeps the decision of how clients are
 * authenticated and stored outside the domain. Each bounded context is free to define richer
 * implementations carrying the person reference it needs to authorize a message.
 */
public interface DomainClient extends Serializable {
  /**
   * @return client's role within the domain, used for authorization decisions and error reporting
   */
  String domainRole();
}
