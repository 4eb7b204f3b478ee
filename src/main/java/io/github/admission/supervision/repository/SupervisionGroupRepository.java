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

package io.github.admission.supervision.repository;

import io.github.admission.ddd.cqrs.AggregateRepository;
import io.github.admission.supervision.domain.exception.SupervisionGroupNotFoundException;
import io.github.admission.supervision.domain.model.PropositionIdentity;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.util.List;
import java.util.Optional;

/**
 * Storage of {@link SupervisionGroup}s.
 *
 * <p>{@link #load(java.io.Serializable)} fails with {@link SupervisionGroupNotFoundException} and
 * {@link #save(Object)} with {@link SupervisionGroupConflictException} when the group was changed
 * by someone else since it was loaded.
 */
public interface SupervisionGroupRepository
    extends AggregateRepository<SupervisionGroupIdentity, SupervisionGroup> {
  /**
   * @param propositionId owning the group
   * @return the group of the proposition, if initiated
   */
  Optional<SupervisionGroup> findByPropositionId(final PropositionIdentity propositionId);

  /**
   * @param personId of a promoter or a CA member
   * @return every group the person belongs to, whatever the role
   */
  List<SupervisionGroup> findBySignatory(final String personId);
}
