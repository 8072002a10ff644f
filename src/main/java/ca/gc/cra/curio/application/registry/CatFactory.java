package ca.gc.cra.curio.application.registry;

import ca.gc.cra.curio.domain.registry.Cat;

/**
 * Creates {@link Cat} instances.
 *
 * @since 0.1.0
 */
public final class CatFactory implements AnimalCreator {
  @Override
  public Cat create(String name) {
    return new Cat(name);
  }
}
