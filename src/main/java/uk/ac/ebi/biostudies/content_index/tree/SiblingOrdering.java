package uk.ac.ebi.biostudies.content_index.tree;

import java.util.Comparator;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.SortBy;
import uk.ac.ebi.biostudies.content_index.model.SortOrder;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;

/** Orderings applied to the children of a taxonomy. Every ordering ends on the slug. */
final class SiblingOrdering {

  /** Nested taxonomies: position ascending with unpositioned last, then title, then slug. */
  static final Comparator<TaxonomyNode> TAXONOMIES =
      Comparator.comparing(
              TaxonomyNode::getPosition, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
          .thenComparing(
              TaxonomyNode::getTitle, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
          .thenComparing(TaxonomyNode::getSlug);

  private SiblingOrdering() {
    throw new UnsupportedOperationException("Utility class should not be instantiated");
  }

  /**
   * Ordering of the content items of a taxonomy. The direction applies to the sort key only; the
   * slug tie-break is always ascending.
   */
  static Comparator<ContentItem> contentItems(SortBy sortBy, SortOrder sortOrder) {
    Comparator<ContentItem> byKey =
        switch (sortBy) {
          case TITLE -> Comparator.comparing(
              ContentItem::getTitle, Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER));
          case DATE -> Comparator.comparing(
              ContentItem::getDate, Comparator.nullsFirst(Comparator.naturalOrder()));
          case SLUG -> Comparator.comparing(ContentItem::getSlug);
        };
    if (sortOrder == SortOrder.DESC) {
      byKey = byKey.reversed();
    }
    return byKey.thenComparing(ContentItem::getSlug);
  }
}
