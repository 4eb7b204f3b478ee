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

import io.github.admission.supervision.command.EditExternalMember;
import io.github.admission.supervision.domain.model.SupervisionGroup;

/** Corrects the contact details of an external signatory, at any stage of the workflow. */
public final class EditExternalMemberHandler
    extends SupervisionCommandHandler<EditExternalMember> {
  public EditExternalMemberHandler() {
    super(EditExternalMember.class);
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(
      final EditExternalMember command, final SupervisionGroup group) {
    group.editExternalMember(group.getSignatory(command.signatoryId()), command.details());
    return group;
  }
}
