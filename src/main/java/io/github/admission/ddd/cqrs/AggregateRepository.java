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

package io.github.admission.ddd.cqrs;

import java.io.Serializable;

/**
 * Load and save contract of a single aggregate type.
 *
 * <p>Instances are created by a {@link BoundedContext} for each message, bound to the {@code
 * DSLContext} of the running transaction, and must not be shared between messages.
 *
 * @param <ID> is the type of the aggregate identifier
 * @param <AGGREGATE> is the type of the aggregate root
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public interface AggregateRepository<ID extends Serializable, AGGREGATE> {
  /**
   * @param id of the aggregate
   * @return the aggregate, never {@code null}
   * @throws RuntimeException of the repository's own not-found kind when nothing is stored under
   *     the identifier
   */
  AGGREGATE load(final ID id);

  /**
   * Persists the aggregate, detecting concurrent modifications made since it was loaded.
   *
   * @param aggregate to persist
   */
  void save(final AGGREGATE aggregate);
}
