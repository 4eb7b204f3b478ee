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

public class CaMembersNotApprovedException extends BusinessException {
  @Serial private static final long serialVersionUID = -2814409114471009789L;

  public CaMembersNotApprovedException() {
    super("SUPERVISION-16", "All CA members must have approved the proposition.");
  }
}
