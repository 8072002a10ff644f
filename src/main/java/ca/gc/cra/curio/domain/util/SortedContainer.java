package ca.gc.cra.curio.domain.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Insertion-ordered container that can be sorted by the elements' natural ordering.
 *
 * <p>Sorting is stable: elements that compare equal keep their relative order.</p>
 *
 * @param <T> element type
 * @since 0.1.0
 */
public final class SortedContainer<T extends Comparable<? super T>> {
  private final List<T> items = new ArrayList<>();

  /**
   * Appends an element.
   *
   * @param item element to append; must not be {@code null}
   */
  public void add(T item) {
    items.add(Objects.requireNonNull(item, "item"));
  }

  /**
   * Sorts the elements ascending by natural order.
   */
  public void sort() {
    items.sort(null);
  }

  /**
   * Renders one line per element using {@link Object#toString()}, in current order.
   *
   * @return immutable list of display lines
   */
  public List<String> display() {
    return items.stream().map(Object::toString).toList();
  }

  /**
   * Returns a snapshot of the elements in current order.
   *
   * @return immutable copy
   */
  public List<T> items() {
    return List.copyOf(items);
  }

  public int size() {
    return items.size();
  }
}
