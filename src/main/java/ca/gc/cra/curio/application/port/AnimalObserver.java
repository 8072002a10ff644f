package ca.gc.cra.curio.application.port;

import ca.gc.cra.curio.domain.registry.Animal;

/**
 * <strong>What:</strong> Outbound port receiving animals broadcast by {@code AnimalNotifier}.
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent {@link #update(Animal)} calls.</p>
 *
 * @since 0.1.0
 */
public interface AnimalObserver {
  /**
   * Reacts to an animal broadcast by the notifier.
   *
   * @param animal shared animal reference; never {@code null}
   */
  void update(Animal animal);

  /**
   * Observer that ignores every update.
   */
  AnimalObserver NO_OP = animal -> {};
}
