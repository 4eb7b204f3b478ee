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

package io.github.admission.ddd.async;

import io.github.admission.ddd.cqrs.DomainMessage;
import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Represents a fact about a change within a bounded context, such as a signatory approving a
 * proposition, which other parts of the system react to asynchronously.
 *
 * <p>Notifications are stored in an outbox rather than delivered directly, which is why they must
 * stay {@link Serializable}.
 *
 * @param <I> is the type of this notification identifier
 * @param <T> is the type of the timestamp when this notification was created
 */
// @formatter:off
public interface DomainNotification<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T> {}
// @formatter:on
