package ca.gc.cra.curio.application.catalog;

import ca.gc.cra.curio.domain.catalog.CatalogItem;
import ca.gc.cra.curio.domain.catalog.Member;
import ca.gc.cra.curio.domain.util.SortedContainer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-memory library catalog holding items and members in insertion order.
 * <p><strong>Role:</strong> Aggregate created once by the library CLI and passed to whatever drives the menu.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine to the control thread.</p>
 *
 * <p>The catalog deliberately offers no removal or lookup operations.</p>
 *
 * @since 0.1.0
 */
public final class Catalog {
  private static final Logger log = LoggerFactory.getLogger(Catalog.class);

  private final List<CatalogItem> items = new ArrayList<>();
  private final List<Member> members = new ArrayList<>();

  /**
   * Appends an item to the catalog.
   *
   * @param item item to store; must not be {@code null}
   */
  public void addItem(CatalogItem item) {
    items.add(Objects.requireNonNull(item, "item"));
    log.debug("catalog.item.added type={} title={}", item.type(), item.title());
  }

  /**
   * Appends a member to the catalog.
   *
   * @param member member to store; must not be {@code null}
   */
  public void addMember(Member member) {
    members.add(Objects.requireNonNull(member, "member"));
    log.debug("catalog.member.added name={}", member.name());
  }

  /**
   * Returns a lazy sequence of item display lines in insertion order.
   *
   * @return stream evaluated against the current items when consumed
   */
  public Stream<String> displayItems() {
    return items.stream().map(CatalogItem::display);
  }

  /**
   * Returns a lazy sequence of member display lines in insertion order.
   *
   * @return stream evaluated against the current members when consumed
   */
  public Stream<String> displayMembers() {
    return members.stream().map(Member::display);
  }

  /**
   * Returns member display lines ordered by name; members with equal names keep insertion order.
   *
   * @return immutable list of display lines
   */
  public List<String> displayMembersSorted() {
    SortedContainer<Member> container = new SortedContainer<>();
    members.forEach(container::add);
    container.sort();
    return container.display();
  }

  public int itemCount() {
    return items.size();
  }

  public int memberCount() {
    return members.size();
  }
}
