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

import io.github.admission.ddd.async.DomainNotificationProducer;
import io.github.admission.ddd.jooq.DslContextProvider;
import java.io.Serializable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a bounded context: keeps the handlers registered for each message class and
 * dispatches incoming commands and queries to them.
 *
 * <p>Handlers can be registered at any time, the registry is guarded by a {@link
 * ReentrantReadWriteLock} so that registration never races with dispatching.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <AGGREGATE> the type of the aggregate root
 * @param <REPOSITORY> the type of the repository storing the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings({"squid:S119", "unchecked"})
// @formatter:off
public abstract non-sealed class BoundedContext<
  ID extends Serializable,
  AGGREGATE,
  REPOSITORY extends AggregateRepository<ID, AGGREGATE>
> extends Suspicious {
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(BoundedContext.class);

  private final Function<DSLContext, REPOSITORY> repositoryFactory;
  private final DslContextProvider writeDslContextProvider;
  private final DslContextProvider readDslContextProvider;
  private final DomainNotificationProducer domainNotificationProducer;

  private final ReentrantReadWriteLock lock;
  private final Map<Class<?>, DomainCommandHandler<?, ID, AGGREGATE, REPOSITORY>> commandHandlers;
  private final Map<Class<?>, DomainQueryHandler<?, REPOSITORY, ?>> queryHandlers;

  /**
   * @param repositoryFactory binding a repository to a {@link DSLContext}
   * @param writeDslContextProvider selecting the {@link DSLContext} for transactions
   * @param readDslContextProvider selecting the {@link DSLContext} for queries
   * @param domainNotificationProducer storing notifications emitted by handlers
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  protected BoundedContext(
      final Function<DSLContext, REPOSITORY> repositoryFactory,
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider,
      final DomainNotificationProducer domainNotificationProducer) {
    this.repositoryFactory = throwIllegalArgumentIfNull(repositoryFactory, "Repository factory");
    this.writeDslContextProvider =
        throwIllegalArgumentIfNull(writeDslContextProvider, "Write DSL context provider");
    this.readDslContextProvider =
        throwIllegalArgumentIfNull(readDslContextProvider, "Read DSL context provider");
    this.domainNotificationProducer =
        throwIllegalArgumentIfNull(domainNotificationProducer, "Notification producer");

    this.lock = new ReentrantReadWriteLock();
    this.commandHandlers = new HashMap<>();
    this.queryHandlers = new HashMap<>();
  }

  /**
   * @param handler to register for its command class
   * @throws IllegalArgumentException if handler is {@code null}
   * @throws IllegalStateException if a handler is already registered for the same command class
   */
  public final void addDomainCommandHandler(
      final DomainCommandHandler<?, ID, AGGREGATE, REPOSITORY> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Command handler");
    register(commandHandlers, nonNullHandler.getCommandClass(), nonNullHandler);
  }

  /**
   * @param handler to register for its query class
   * @throws IllegalArgumentException if handler is {@code null}
   * @throws IllegalStateException if a handler is already registered for the same query class
   */
  public final void addDomainQueryHandler(final DomainQueryHandler<?, REPOSITORY, ?> handler) {
    final var nonNullHandler = throwIllegalArgumentIfNull(handler, "Query handler");
    register(queryHandlers, nonNullHandler.getQueryClass(), nonNullHandler);
  }

  /**
   * @return command classes this context can dispatch
   */
  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    return readLocked(() -> Set.copyOf(commandHandlers.keySet()));
  }

  /**
   * @return query classes this context can dispatch
   */
  public final Set<Class<?>> getSupportedDomainQueryClasses() {
    return readLocked(() -> Set.copyOf(queryHandlers.keySet()));
  }

  /**
   * @param command to create a new aggregate with
   * @return the saved aggregate
   * @param <CREATE> is the type of the command
   * @throws IllegalArgumentException if command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command class
   */
  public final <CREATE extends DomainCommand.Create<?, ?>> AGGREGATE createModel(
      final CREATE command) {
    final CREATE nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final var handler =
        (DomainCommandHandler<CREATE, ID, AGGREGATE, REPOSITORY>)
            findCommandHandler(nonNullCommand);

    return handler.runInContext(
        nonNullCommand,
        writeDslContextProvider.apply(nonNullCommand),
        repositoryFactory,
        domainNotificationProducer);
  }

  /**
   * @param command to change an existing aggregate with
   * @return the saved aggregate
   * @param <UPDATE> is the type of the command
   * @throws IllegalArgumentException if command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command class
   */
  public final <UPDATE extends DomainCommand.Update<?, ?, ID>> AGGREGATE updateModel(
      final UPDATE command) {
    final UPDATE nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final var handler =
        (DomainCommandHandler<UPDATE, ID, AGGREGATE, REPOSITORY>)
            findCommandHandler(nonNullCommand);

    return handler.runInContext(
        nonNullCommand,
        writeDslContextProvider.apply(nonNullCommand),
        repositoryFactory,
        domainNotificationProducer);
  }

  /**
   * @param query to answer
   * @return at most one projection
   * @param <ONE> is the type of the query
   * @param <VIEW> is the type of the projection
   * @throws IllegalArgumentException if query is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the query class
   */
  public final <ONE extends DomainQuery.One<?, ?>, VIEW> Optional<VIEW> queryOneModel(
      final ONE query) {
    final ONE nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainQueryHandler<ONE, REPOSITORY, Optional<VIEW>> handler =
        (DomainQueryHandler<ONE, REPOSITORY, Optional<VIEW>>) findQueryHandler(nonNullQuery);

    return handler.runInContext(
        nonNullQuery,
        writeDslContextProvider.apply(nonNullQuery),
        readDslContextProvider.apply(nonNullQuery),
        repositoryFactory,
        domainNotificationProducer);
  }

  /**
   * @param query to answer
   * @return ordered projections, possibly empty
   * @param <MANY> is the type of the query
   * @param <VIEW> is the type of the projections
   * @throws IllegalArgumentException if query is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the query class
   */
  public final <MANY extends DomainQuery.Many<?, ?>, VIEW> List<VIEW> queryManyModels(
      final MANY query) {
    final MANY nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainQueryHandler<MANY, REPOSITORY, List<VIEW>> handler =
        (DomainQueryHandler<MANY, REPOSITORY, List<VIEW>>) findQueryHandler(nonNullQuery);

    return handler.runInContext(
        nonNullQuery,
        writeDslContextProvider.apply(nonNullQuery),
        readDslContextProvider.apply(nonNullQuery),
        repositoryFactory,
        domainNotificationProducer);
  }

  final boolean isAnyReadLockHeld() {
    return lock.getReadLockCount() > 0;
  }

  final boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  private DomainCommandHandler<?, ID, AGGREGATE, REPOSITORY> findCommandHandler(
      final DomainCommand<?, ?> command) {
    LOG.debug(
        "Dispatching command '{}' ({})", command.getClass().getSimpleName(), command.messageId());
    return throwUnsupportedOperationIfNull(
        readLocked(() -> commandHandlers.get(command.getClass())),
        "Handler for '%s' command".formatted(command.getClass().getSimpleName()));
  }

  private DomainQueryHandler<?, REPOSITORY, ?> findQueryHandler(final DomainQuery<?, ?> query) {
    LOG.debug("Dispatching query '{}' ({})", query.getClass().getSimpleName(), query.messageId());
    return throwUnsupportedOperationIfNull(
        readLocked(() -> queryHandlers.get(query.getClass())),
        "Handler for '%s' query".formatted(query.getClass().getSimpleName()));
  }

  private <H> void register(final Map<Class<?>, H> handlers, final Class<?> key, final H handler) {
    final var writeLock = lock.writeLock();
    writeLock.lock();
    try {
      if (handlers.containsKey(key)) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(key.getSimpleName()));
      }

      handlers.put(key, handler);
    } finally {
      writeLock.unlock();
    }
  }

  private <T> T readLocked(final Supplier<T> supplier) {
    final var readLock = lock.readLock();
    readLock.lock();
    try {
      return supplier.get();
    } finally {
      readLock.unlock();
    }
  }
}
