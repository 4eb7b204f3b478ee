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

package io.github.admission.supervision;

import io.github.admission.ddd.async.DomainNotificationProducer;
import io.github.admission.ddd.cqrs.BoundedContext;
import io.github.admission.ddd.jooq.DslContextProvider;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import io.github.admission.supervision.domain.service.PromoterDirectory;
import io.github.admission.supervision.handler.AddCaMemberHandler;
import io.github.admission.supervision.handler.AddPromoterHandler;
import io.github.admission.supervision.handler.ApproveByPdfHandler;
import io.github.admission.supervision.handler.ApproveHandler;
import io.github.admission.supervision.handler.DefineCotutelleHandler;
import io.github.admission.supervision.handler.DesignateReferencePromoterHandler;
import io.github.admission.supervision.handler.EditExternalMemberHandler;
import io.github.admission.supervision.handler.GetSupervisionGroupHandler;
import io.github.admission.supervision.handler.InitiateSupervisionGroupHandler;
import io.github.admission.supervision.handler.InviteToSignHandler;
import io.github.admission.supervision.handler.ListSignatoryGroupsHandler;
import io.github.admission.supervision.handler.LockForSignatureHandler;
import io.github.admission.supervision.handler.RefuseHandler;
import io.github.admission.supervision.handler.RemoveCaMemberHandler;
import io.github.admission.supervision.handler.RemovePromoterHandler;
import io.github.admission.supervision.handler.RequestSignaturesHandler;
import io.github.admission.supervision.handler.ResendInvitationHandler;
import io.github.admission.supervision.handler.VerifySignatureRequestHandler;
import io.github.admission.supervision.repository.JooqSupervisionGroupRepository;
import io.github.admission.supervision.repository.SupervisionGroupRepository;
import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Supervision of doctoral propositions, with every command and query handler registered.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * final var context =
 *     new SupervisionContext(
 *         dslContextIdentity(dsl),
 *         dslContextIdentity(dsl),
 *         new JooqDomainNotificationProducer(),
 *         promoterDirectory,
 *         SupervisionSettings.load());
 *
 * final var group =
 *     context.createModel(InitiateSupervisionGroup.of(candidate, propositionId));
 * context.updateModel(AddPromoter.of(candidate, group.getId(), "promoter-1"));
 * }</pre>
 */
public class SupervisionContext
    extends BoundedContext<SupervisionGroupIdentity, SupervisionGroup, SupervisionGroupRepository> {

  /**
   * Stores groups with {@link JooqSupervisionGroupRepository}.
   *
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public SupervisionContext(
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider,
      final DomainNotificationProducer domainNotificationProducer,
      final PromoterDirectory promoterDirectory,
      final SupervisionSettings settings) {
    this(
        JooqSupervisionGroupRepository::new,
        writeDslContextProvider,
        readDslContextProvider,
        domainNotificationProducer,
        promoterDirectory,
        settings);
  }

  /**
   * @param repositoryFactory binding a repository to a {@link DSLContext}
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public SupervisionContext(
      final Function<DSLContext, SupervisionGroupRepository> repositoryFactory,
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider,
      final DomainNotificationProducer domainNotificationProducer,
      final PromoterDirectory promoterDirectory,
      final SupervisionSettings settings) {
    super(
        repositoryFactory,
        writeDslContextProvider,
        readDslContextProvider,
        domainNotificationProducer);

    if (promoterDirectory == null) {
      throw new IllegalArgumentException("Promoter directory is null");
    }

    if (settings == null) {
      throw new IllegalArgumentException("Supervision settings are null");
    }

    addDomainCommandHandler(new InitiateSupervisionGroupHandler());
    addDomainCommandHandler(new AddPromoterHandler(settings));
    addDomainCommandHandler(new AddCaMemberHandler(settings));
    addDomainCommandHandler(new RemovePromoterHandler());
    addDomainCommandHandler(new RemoveCaMemberHandler());
    addDomainCommandHandler(new DesignateReferencePromoterHandler());
    addDomainCommandHandler(new EditExternalMemberHandler());
    addDomainCommandHandler(new DefineCotutelleHandler());
    addDomainCommandHandler(new InviteToSignHandler());
    addDomainCommandHandler(new LockForSignatureHandler());
    addDomainCommandHandler(new RequestSignaturesHandler(promoterDirectory));
    addDomainCommandHandler(new ResendInvitationHandler());
    addDomainCommandHandler(new ApproveHandler());
    addDomainCommandHandler(new ApproveByPdfHandler());
    addDomainCommandHandler(new RefuseHandler());

    addDomainQueryHandler(new GetSupervisionGroupHandler());
    addDomainQueryHandler(new ListSignatoryGroupsHandler());
    addDomainQueryHandler(new VerifySignatureRequestHandler(promoterDirectory));
  }
}
