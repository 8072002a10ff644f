package ca.gc.cra.curio.application.registry;

import ca.gc.cra.curio.domain.registry.Animal;

/**
 * Abstract factory producing one fixed animal variant.
 *
 * <p>Alternative to the tag-dispatching {@link AnimalFactory}; callers pick the creator once and reuse it.</p>
 *
 * @since 0.1.0
 */
public interface AnimalCreator {
  /**
   * Creates an animal of this creator's variant.
   *
   * @param name animal name; must not be {@code null}
   * @return new animal
   */
  Animal create(String name);
}
