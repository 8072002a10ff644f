package ca.gc.cra.curio.application.registry;

import ca.gc.cra.curio.domain.registry.Animal;
import ca.gc.cra.curio.domain.registry.Cat;
import ca.gc.cra.curio.domain.registry.Dog;
import java.util.Locale;

/**
 * <strong>What:</strong> Static factory dispatching on an animal type tag.
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * <p>Tags match case-insensitively, so {@code "dog"} and {@code "Dog"} both select {@link Dog}.</p>
 *
 * @since 0.1.0
 * @see AnimalCreator
 */
public final class AnimalFactory {
  private static final AnimalCreator DOGS = new DogFactory();
  private static final AnimalCreator CATS = new CatFactory();

  private AnimalFactory() {}

  /**
   * Creates the animal variant selected by {@code type}.
   *
   * @param type {@code "Dog"} or {@code "Cat"}, any case
   * @param name animal name; must not be {@code null}
   * @return new animal
   * @throws UnknownAnimalTypeException if the tag selects no variant
   */
  public static Animal createAnimal(String type, String name) {
    return creatorFor(type).create(name);
  }

  /**
   * Resolves the abstract factory for a type tag.
   *
   * @param type {@code "Dog"} or {@code "Cat"}, any case
   * @return matching creator
   * @throws UnknownAnimalTypeException if the tag selects no variant
   */
  public static AnimalCreator creatorFor(String type) {
    String normalized = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "dog" -> DOGS;
      case "cat" -> CATS;
      default -> throw new UnknownAnimalTypeException(type);
    };
  }
}
