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

package io.github.admission.ddd.cqrs;

import io.github.admission.ddd.async.DomainNotification;
import io.github.admission.ddd.async.DomainNotificationProducer;
import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.authorization.UnauthorizedException;
import io.vavr.control.Try;
import java.io.Serializable;
import java.util.function.Function;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Assert that the {@link DomainClient} can invoke the {@link DomainCommand}.
 *   <li>Create or load the aggregate, change it and save it within a single transaction.
 *   <li><b>Optional</b>: store a {@link DomainNotification} in the same transaction if {@link
 *       DomainCommand} succeeded.
 *   <li><b>Optional</b>: store a {@link DomainNotification} in a separate transaction if {@link
 *       DomainCommand} failed.
 * </ul>
 *
 * <p>Because {@link DomainCommand} leverages new Java {@code sealed} feature, for more type safety
 * this class also makes use of the same feature.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever parameters are expected to be provided by consumer
 * must be checked with the help of {@link Suspicious} methods.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <ID> the type of the aggregate identifier
 * @param <AGGREGATE> the type of the aggregate root
 * @param <REPOSITORY> the type of the repository storing the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<?, ?>,
  ID extends Serializable,
  AGGREGATE,
  REPOSITORY extends AggregateRepository<ID, AGGREGATE>
>
extends
        DomainHandler<COMMAND, AGGREGATE>
permits
  DomainCommandHandler.Create,
  DomainCommandHandler.Update
{
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(DomainCommandHandler.class);

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * @return the class type of the command being handled by this {@link DomainCommandHandler}
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Executes the core logic of the command within the transaction opened by {@link
   * #runInContext(DomainCommand, DSLContext, Function, DomainNotificationProducer)}.
   *
   * @param command being executed
   * @param repository bound to the running transaction
   * @return the saved aggregate
   * @throws Exception if any error occurs during the execution of the command
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract AGGREGATE internalRunContract(
      final COMMAND command, final REPOSITORY repository) throws Exception;

  /**
   * Executes the given command within a transactional context.
   *
   * <p>Exceptions raised by the command are captured with {@link Try}, which lets this method
   * store the failure notification before rethrowing the original exception to the caller.
   *
   * <p>This method is package-private as it is intended to be invoked by {@link BoundedContext}
   * only.
   *
   * @param command to be executed
   * @param readWriteDsl to open the transaction with
   * @param repositoryFactory binding a repository to the transactional {@link DSLContext}
   * @param domainNotificationProducer for storing notifications
   * @return the saved aggregate
   * @throws IllegalArgumentException if any command parameter is null
   * @throws IllegalStateException if any internal state is invalid (typically null)
   * @throws UnauthorizedException if the client is not authorized to execute the command
   */
  final AGGREGATE runInContext(
      final COMMAND command,
      final DSLContext readWriteDsl,
      final Function<DSLContext, REPOSITORY> repositoryFactory,
      final DomainNotificationProducer domainNotificationProducer) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullCommand.domainClient(), "Command's client");

    if (!canBeUsedBy(nonNullDomainClient, nonNullCommand)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' command"
              .formatted(nonNullDomainClient.domainRole(), getCommandClass().getSimpleName()));
    }

    final DSLContext nonNullReadWriteDsl = throwIllegalStateIfNull(readWriteDsl, "Read-write DSL");
    final Function<DSLContext, REPOSITORY> nonNullRepositoryFactory =
        throwIllegalStateIfNull(repositoryFactory, "Repository factory");
    final DomainNotificationProducer nonNullDomainNotificationProducer =
        throwIllegalStateIfNull(domainNotificationProducer, "Notification Publisher");

    final Try<AGGREGATE> output =
        Try.of(
            () ->
                nonNullReadWriteDsl.transactionResult(
                    (final Configuration trx) -> {
                      final REPOSITORY repository =
                          throwIllegalStateIfNull(
                              nonNullRepositoryFactory.apply(trx.dsl()), "Repository");
                      final AGGREGATE aggregate =
                          throwIllegalStateIfNull(
                              internalRunContract(nonNullCommand, repository), "Saved aggregate");

                      throwIllegalStateIfNull(
                              onSuccess(nonNullCommand, aggregate),
                              "Command handler Optional successful notification")
                          .ifPresent(
                              notification ->
                                  nonNullDomainNotificationProducer.store(
                                      trx.dsl(), notification));

                      return aggregate;
                    }));

    output.onFailure(
        reason -> {
          LOG.warn(
              "Command '{}' ({}) rejected: {}",
              getCommandClass().getSimpleName(),
              nonNullCommand.messageId(),
              reason.getMessage());

          nonNullReadWriteDsl.transaction(
              (final Configuration trx) ->
                  throwIllegalStateIfNull(
                          onFailure(nonNullCommand, reason),
                          "Command handler Optional failure notification")
                      .ifPresent(
                          notification ->
                              nonNullDomainNotificationProducer.store(trx.dsl(), notification)));
        });

    return output.get();
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <ID> the type of the aggregate identifier
   * @param <AGGREGATE> the type of the aggregate root
   * @param <REPOSITORY> the type of the repository storing the aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<?, ?>,
    ID extends Serializable,
    AGGREGATE,
    REPOSITORY extends AggregateRepository<ID, AGGREGATE>
  > extends DomainCommandHandler<CREATE, ID, AGGREGATE, REPOSITORY> {
  // @formatter:on
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic to build a new aggregate.
     *
     * @param command containing the data required to create the aggregate
     * @param repository bound to the running transaction, to look for conflicting aggregates
     * @return the new aggregate, not yet saved
     * @throws Exception if any error occurs during the execution of the command
     * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
     *     more flexibility</a>
     */
    @SuppressWarnings("squid:S112")
    protected abstract AGGREGATE newAggregate(final CREATE command, final REPOSITORY repository)
        throws Exception;

    /** {@inheritDoc} */
    @Override
    protected final AGGREGATE internalRunContract(
        final CREATE command, final REPOSITORY repository) throws Exception {
      final AGGREGATE aggregate =
          throwIllegalStateIfNull(newAggregate(command, repository), "New aggregate");
      repository.save(aggregate);
      return aggregate;
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}: load, change,
   * save.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <ID> the type of the aggregate identifier
   * @param <AGGREGATE> the type of the aggregate root
   * @param <REPOSITORY> the type of the repository storing the aggregate
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<?, ?, ID>,
    ID extends Serializable,
    AGGREGATE,
    REPOSITORY extends AggregateRepository<ID, AGGREGATE>
  > extends DomainCommandHandler<UPDATE, ID, AGGREGATE, REPOSITORY> {
  // @formatter:on
    protected Update(final Class<UPDATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic to change an existing aggregate based on the provided command.
     *
     * @param command containing the data required to change the aggregate
     * @param aggregate loaded within the running transaction
     * @return the changed aggregate to save, usually the same instance
     * @throws Exception if any error occurs during the execution of the command
     * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
     *     more flexibility</a>
     */
    @SuppressWarnings("squid:S112")
    protected abstract AGGREGATE updateAggregate(final UPDATE command, final AGGREGATE aggregate)
        throws Exception;

    /** {@inheritDoc} */
    @Override
    protected final AGGREGATE internalRunContract(
        final UPDATE command, final REPOSITORY repository) throws Exception {
      final ID aggregateId = throwIllegalArgumentIfNull(command.aggregateId(), "Aggregate ID");
      final AGGREGATE loaded =
          throwIllegalStateIfNull(repository.load(aggregateId), "Loaded aggregate");
      final AGGREGATE updated =
          throwIllegalStateIfNull(updateAggregate(command, loaded), "Updated aggregate");
      repository.save(updated);
      return updated;
    }
  }
}
