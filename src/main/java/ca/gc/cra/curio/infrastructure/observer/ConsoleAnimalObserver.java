package ca.gc.cra.curio.infrastructure.observer;

import ca.gc.cra.curio.application.port.AnimalObserver;
import ca.gc.cra.curio.domain.registry.Animal;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Prints each broadcast animal as one console line.
 *
 * <p>Writes are serialized under a lock so lines from concurrent updates never interleave.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleAnimalObserver implements AnimalObserver {
  private final PrintWriter out;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Creates an observer writing to {@code out}.
   *
   * @param out destination writer; flushed after every line
   */
  public ConsoleAnimalObserver(PrintWriter out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void update(Animal animal) {
    Objects.requireNonNull(animal, "animal");
    lock.lock();
    try {
      out.println("Observer: " + animal.display());
      out.flush();
    } finally {
      lock.unlock();
    }
  }
}
