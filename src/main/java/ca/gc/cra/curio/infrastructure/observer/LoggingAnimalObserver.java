package ca.gc.cra.curio.infrastructure.observer;

import ca.gc.cra.curio.application.port.AnimalObserver;
import ca.gc.cra.curio.domain.registry.Animal;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits broadcast animals as structured log records.
 *
 * @since 0.1.0
 */
public final class LoggingAnimalObserver implements AnimalObserver {
  private static final Logger log = LoggerFactory.getLogger(LoggingAnimalObserver.class);

  private final String event;

  /**
   * Creates an observer logging under the supplied event name.
   *
   * @param event event label prefixed to each record; falls back to {@code animal.added} when blank
   */
  public LoggingAnimalObserver(String event) {
    this.event = event == null || event.isBlank() ? "animal.added" : event.trim();
  }

  /**
   * Creates an observer logging {@code animal.added} records.
   */
  public LoggingAnimalObserver() {
    this("animal.added");
  }

  @Override
  public void update(Animal animal) {
    Objects.requireNonNull(animal, "animal");
    log.info("{} type={}, name={}", event, animal.type(), animal.name());
  }
}
