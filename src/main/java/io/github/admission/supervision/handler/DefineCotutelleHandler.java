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

import io.github.admission.supervision.command.DefineCotutelle;
import io.github.admission.supervision.domain.model.SupervisionGroup;

/** Replaces the cotutelle of the group. */
public final class DefineCotutelleHandler extends SupervisionCommandHandler<DefineCotutelle> {
  public DefineCotutelleHandler() {
    super(DefineCotutelle.class);
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(
      final DefineCotutelle command, final SupervisionGroup group) {
    group.defineCotutelle(
        command.motivation(),
        command.partnerConsortiumInstitution(),
        command.institution(),
        command.otherInstitutionName(),
        command.otherInstitutionAddress(),
        command.openingRequestDocuments(),
        command.conventionDocuments(),
        command.otherDocuments());
    return group;
  }
}
