package ca.gc.cra.curio.domain.catalog;

import java.util.Objects;

/**
 * <strong>What:</strong> Library member stored by value in the catalog.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p>Names carry no uniqueness constraint. Natural ordering compares names lexicographically so members can be
 * sorted by {@link ca.gc.cra.curio.domain.util.SortedContainer}.</p>
 *
 * @param name member name; never {@code null}
 * @since 0.1.0
 */
public record Member(String name) implements Comparable<Member> {

  public Member {
    Objects.requireNonNull(name, "name");
  }

  /**
   * Renders a single display line for the member.
   *
   * @return display line such as {@code "Member: Ada"}
   */
  public String display() {
    return "Member: " + name;
  }

  @Override
  public int compareTo(Member other) {
    return name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return display();
  }
}
