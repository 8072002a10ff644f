package ca.gc.cra.curio.domain.registry;

import java.util.Objects;

/**
 * Dog registered with the zoo.
 *
 * @param name dog name; never {@code null}
 * @since 0.1.0
 */
public record Dog(String name) implements Animal {
  /** Variant tag reported by {@link #type()}. */
  public static final String TYPE = "Dog";

  public Dog {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Dog copy() {
    return new Dog(name);
  }
}
