package ca.gc.cra.curio.application.registry;

import ca.gc.cra.curio.domain.registry.Animal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-memory registry of shared animal references.
 * <p><strong>Role:</strong> Aggregate owned by the zoo CLI; animals stored here are also handed to
 * {@link AnimalNotifier}.</p>
 * <p><strong>Thread-safety:</strong> Mutations must stay on one thread. Read-only display from a worker thread is
 * safe only while the owner is blocked waiting for that worker.</p>
 * <p><strong>Observability:</strong> {@link #instanceCount()} reports how many registries are open; it is a
 * diagnostic and never drives behaviour.</p>
 *
 * @since 0.1.0
 */
public final class AnimalRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AnimalRegistry.class);
  private static final AtomicInteger LIVE_INSTANCES = new AtomicInteger();

  private final List<Animal> animals = new ArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates an empty registry and counts it as live.
   */
  public AnimalRegistry() {
    int live = LIVE_INSTANCES.incrementAndGet();
    log.debug("registry.opened live={}", live);
  }

  /**
   * Returns the number of registries constructed and not yet closed in this JVM.
   *
   * @return live registry count
   */
  public static int instanceCount() {
    return LIVE_INSTANCES.get();
  }

  /**
   * Appends an animal.
   *
   * @param animal shared animal reference; must not be {@code null}
   */
  public void add(Animal animal) {
    animals.add(Objects.requireNonNull(animal, "animal"));
  }

  /**
   * Renders one display line per animal in current order.
   *
   * @return immutable list of display lines
   */
  public List<String> displayAll() {
    return animals.stream().map(Animal::display).toList();
  }

  /**
   * Removes every animal whose type tag equals {@code tag}.
   *
   * @param tag exact variant tag such as {@code "Dog"}
   * @return number of animals removed; zero when none matched
   */
  public int removeByType(String tag) {
    int before = animals.size();
    animals.removeIf(animal -> animal.type().equals(tag));
    int removed = before - animals.size();
    log.debug("registry.removed type={} count={}", tag, removed);
    return removed;
  }

  /**
   * Renders an info line for every animal whose type tag equals {@code tag}, in current order.
   *
   * @param tag exact variant tag such as {@code "Cat"}
   * @return immutable list of info lines; empty when none matched
   */
  public List<String> displayInfoByType(String tag) {
    return animals.stream()
        .filter(animal -> animal.type().equals(tag))
        .map(Animal::info)
        .toList();
  }

  /**
   * Sorts animals ascending by type tag. The sort is stable, so animals sharing a tag keep their relative order.
   */
  public void sortByType() {
    animals.sort(Comparator.comparing(Animal::type));
  }

  /**
   * Returns the animals in current order.
   *
   * @return immutable snapshot of the shared references
   */
  public List<Animal> snapshot() {
    return List.copyOf(animals);
  }

  public int size() {
    return animals.size();
  }

  /**
   * Marks the registry closed and removes it from the live count. Repeated calls have no further effect.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      int live = LIVE_INSTANCES.decrementAndGet();
      log.debug("registry.closed live={}", live);
    }
  }
}
