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

package io.github.admission.ddd.jooq;

import io.github.admission.ddd.cqrs.DomainMessage;
import java.io.Serializable;
import java.time.temporal.Temporal;
import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Selects the {@link DSLContext} a message is processed with.
 *
 * <p>Most deployments use a single database through {@link #dslContextIdentity(DSLContext)}, a
 * read replica can be plugged in for queries by providing a different instance to the bounded
 * context.
 */
@FunctionalInterface
// @formatter:off
public interface DslContextProvider extends Function<
  DomainMessage<
      ? extends Serializable,
      ? extends Temporal
    >,
  DSLContext
> {
// @formatter:on

  /**
   * Similar to {@link Function#identity()}.
   *
   * @param dslContext to create {@link DslContextProvider} with
   * @return a new instance of {@link DslContextProvider} which always returns provided {@link
   *     DSLContext}
   * @throws IllegalArgumentException if the context is {@code null}
   */
  static DslContextProvider dslContextIdentity(final DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return domainMessage -> dslContext;
  }
}
