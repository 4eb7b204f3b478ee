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

package io.github.admission.supervision.domain.model;

/**
 * State of a single signature.
 *
 * <pre>
 * NOT_INVITED --invite--&gt; INVITED --approve--&gt; APPROVED
 *                           |
 *                           +--refuse--&gt; DECLINED --invite--&gt; INVITED
 * </pre>
 */
public enum SignatureState {
  NOT_INVITED,
  INVITED,
  APPROVED,
  DECLINED;

  /**
   * @return {@code true} when the next invitation round must include the signatory
   */
  public boolean isAwaitingInvitation() {
    return this == NOT_INVITED || this == DECLINED;
  }
}
