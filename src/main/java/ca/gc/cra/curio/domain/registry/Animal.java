package ca.gc.cra.curio.domain.registry;

/**
 * <strong>What:</strong> Animal tracked by the zoo registry.
 * <p><strong>Role:</strong> Domain value shared by reference between {@code AnimalRegistry} and
 * {@code AnimalNotifier}.</p>
 * <p><strong>Thread-safety:</strong> Permitted variants are immutable records and may be read from any thread.</p>
 *
 * @since 0.1.0
 */
public sealed interface Animal permits Dog, Cat {

  /**
   * Returns the variant tag fixed at construction.
   *
   * @return {@code "Dog"} or {@code "Cat"}
   */
  String type();

  /**
   * Returns the animal's name.
   *
   * @return name; never {@code null}
   */
  String name();

  /**
   * Produces an independent copy with the same variant and name.
   *
   * @return new instance equal to, but not identical with, this animal
   */
  Animal copy();

  /**
   * Renders the line used when listing the registry.
   *
   * @return display line such as {@code "Dog: Rex"}
   */
  default String display() {
    return type() + ": " + name();
  }

  /**
   * Renders the descriptive line used by type-filtered queries.
   *
   * @return info line such as {@code "Rex is a Dog"}
   */
  default String info() {
    return name() + " is a " + type();
  }
}
