package ca.gc.cra.curio.domain.registry;

import java.util.Objects;

/**
 * Cat registered with the zoo.
 *
 * @param name cat name; never {@code null}
 * @since 0.1.0
 */
public record Cat(String name) implements Animal {
  /** Variant tag reported by {@link #type()}. */
  public static final String TYPE = "Cat";

  public Cat {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Cat copy() {
    return new Cat(name);
  }
}
