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

package io.github.admission.supervision.handler;

import io.github.admission.supervision.command.RemovePromoter;
import io.github.admission.supervision.domain.model.SupervisionGroup;

/** Removes a promoter, the reference one included. */
public final class RemovePromoterHandler extends SupervisionCommandHandler<RemovePromoter> {
  public RemovePromoterHandler() {
    super(RemovePromoter.class);
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(
      final RemovePromoter command, final SupervisionGroup group) {
    group.removePromoter(group.getPromoter(command.promoterId()));
    return group;
  }
}
