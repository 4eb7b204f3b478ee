package io.github.admission.test;

import io.github.admission.ddd.async.DomainNotification;
import io.github.admission.ddd.async.DomainNotificationProducer;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jooq.DSLContext;

/** Keeps notifications in memory, or refuses them all to imitate an unavailable outbox. */
public final class RecordingDomainNotificationProducer implements DomainNotificationProducer {
  private final boolean failing;
  private final List<DomainNotification<?, ?>> stored;

  private RecordingDomainNotificationProducer(final boolean failing) {
    this.failing = failing;
    this.stored = new CopyOnWriteArrayList<>();
  }

  public static RecordingDomainNotificationProducer recording() {
    return new RecordingDomainNotificationProducer(false);
  }

  public static RecordingDomainNotificationProducer failing() {
    return new RecordingDomainNotificationProducer(true);
  }

  @Override
  public <E extends DomainNotification<?, ?>> void store(
      final DSLContext readWriteDsl, final E notification) {
    if (failing) {
      throw new IllegalStateException("Outbox is unavailable");
    }

    stored.add(notification);
  }

  public List<DomainNotification<?, ?>> stored() {
    return List.copyOf(stored);
  }

  /**
   * @return labels of the stored {@link EmptyDomainNotification}s, in storing order
   */
  public List<String> labels() {
    return stored.stream()
        .filter(EmptyDomainNotification.class::isInstance)
        .map(notification -> ((EmptyDomainNotification) notification).label())
        .toList();
  }

  public void clear() {
    stored.clear();
  }
}
