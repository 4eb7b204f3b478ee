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

import io.github.admission.ddd.cqrs.DomainQueryHandler;
import io.github.admission.supervision.query.ListSignatoryGroups;
import io.github.admission.supervision.query.SupervisionGroupView;
import io.github.admission.supervision.repository.SupervisionGroupRepository;
import java.util.List;

public final class ListSignatoryGroupsHandler
    extends DomainQueryHandler.Many<
        ListSignatoryGroups, SupervisionGroupRepository, SupervisionGroupView> {
  public ListSignatoryGroupsHandler() {
    super(ListSignatoryGroups.class);
  }

  /** {@inheritDoc} */
  @Override
  protected List<SupervisionGroupView> run(
      final ListSignatoryGroups query, final SupervisionGroupRepository repository) {
    return repository.findBySignatory(query.personId()).stream()
        .map(SupervisionGroupView::of)
        .toList();
  }
}
