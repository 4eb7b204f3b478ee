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

package io.github.admission.supervision.domain.exception;

import io.github.admission.ddd.validation.BusinessException;
import java.io.Serial;

/** Thrown when the identifier belongs to the group but not to a CA member. */
public class CaMemberNotFoundException extends BusinessException {
  @Serial private static final long serialVersionUID = -2875293200062377941L;

  public CaMemberNotFoundException() {
    super("SUPERVISION-3", "CA member not found.");
  }

  @Override
  public int getStatusCode() {
    return 404;
  }
}
