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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's follow a doctoral proposition waiting for the signatures of its supervisors:
 *
 * <ul>
 *   <li>The candidate, each promoter and each committee member is a {@link
 *       io.github.admission.ddd.authorization.DomainClient} - they act on the proposition from
 *       different sides.
 *   <li>The group of signatories is an aggregate, loaded and saved as a whole through an {@link
 *       io.github.admission.ddd.cqrs.AggregateRepository}:
 *       <ul>
 *         <li>The candidate changes the group via {@link
 *             io.github.admission.ddd.cqrs.DomainCommand}s:
 *             <ul>
 *               <li>The candidate as a {@link io.github.admission.ddd.authorization.DomainClient}
 *                   might send a {@link io.github.admission.ddd.cqrs.DomainCommand} to {@code
 *                   Request Signatures} which invites every pending signatory and locks the group.
 *             </ul>
 *         <li>A promoter inspects the group via {@link io.github.admission.ddd.cqrs.DomainQuery}:
 *             <ul>
 *               <li>The promoter as a {@link io.github.admission.ddd.authorization.DomainClient}
 *                   might send a {@link io.github.admission.ddd.cqrs.DomainQuery} to {@code List
 *                   My Groups} which returns a projection of every group awaiting their
 *                   signature.
 *             </ul>
 *         <li>The group tells the rest of the admission system about decisions via {@link
 *             io.github.admission.ddd.async.DomainNotification}s:
 *             <ul>
 *               <li>Upon a refusal the group stores a {@link
 *                   io.github.admission.ddd.async.DomainNotification}, which when relayed can make
 *                   the proposition editable again.
 *             </ul>
 *       </ul>
 *   <li>The group, combined with the commands and queries it accepts, forms a {@link
 *       io.github.admission.ddd.cqrs.BoundedContext} describing possible interactions.
 * </ul>
 */
package io.github.admission.ddd.cqrs;
