package ca.gc.cra.curio.application.registry;

import ca.gc.cra.curio.domain.registry.Dog;

/**
 * Creates {@link Dog} instances.
 *
 * @since 0.1.0
 */
public final class DogFactory implements AnimalCreator {
  @Override
  public Dog create(String name) {
    return new Dog(name);
  }
}
