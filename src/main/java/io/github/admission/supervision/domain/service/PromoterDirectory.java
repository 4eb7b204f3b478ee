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

package io.github.admission.supervision.domain.service;

import io.github.admission.supervision.domain.model.PromoterIdentity;

/** Port to the person registry, which knows where each promoter works. */
@FunctionalInterface
public interface PromoterDirectory {
  /**
   * @param promoter to look up
   * @return {@code true} when the promoter belongs to another institution
   */
  boolean isExternal(final PromoterIdentity promoter);
}
