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

import io.github.admission.supervision.command.RemoveCaMember;
import io.github.admission.supervision.domain.model.SupervisionGroup;

/** Removes a CA member. */
public final class RemoveCaMemberHandler extends SupervisionCommandHandler<RemoveCaMember> {
  public RemoveCaMemberHandler() {
    super(RemoveCaMember.class);
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(
      final RemoveCaMember command, final SupervisionGroup group) {
    group.removeCaMember(group.getCaMember(command.caMemberId()));
    return group;
  }
}
