package ca.gc.cra.curio.application.registry;

import ca.gc.cra.curio.application.port.AnimalObserver;
import ca.gc.cra.curio.domain.registry.Animal;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <strong>What:</strong> Broadcasts animals to registered observers.
 * <p><strong>Thread-safety:</strong> Registration and notification may happen from different threads; the observer
 * list is copy-on-write.</p>
 *
 * @since 0.1.0
 */
public final class AnimalNotifier {
  private final CopyOnWriteArrayList<AnimalObserver> observers = new CopyOnWriteArrayList<>();

  /**
   * Registers an observer. The same observer may be registered more than once and is then notified once per
   * registration.
   *
   * @param observer observer to append; must not be {@code null}
   */
  public void addObserver(AnimalObserver observer) {
    observers.add(Objects.requireNonNull(observer, "observer"));
  }

  /**
   * Invokes every observer synchronously in registration order.
   *
   * @param animal animal to broadcast; must not be {@code null}
   */
  public void notifyObservers(Animal animal) {
    Objects.requireNonNull(animal, "animal");
    for (AnimalObserver observer : observers) {
      observer.update(animal);
    }
  }

  /**
   * Returns the registered observers in registration order.
   *
   * @return immutable snapshot
   */
  public List<AnimalObserver> observers() {
    return List.copyOf(observers);
  }
}
