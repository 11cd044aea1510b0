package uk.ac.ebi.biostudies.content_index.model;

/**
 * Lightweight reference to a navigation neighbour. Carries only what is needed to render a link.
 *
 * @param slug slug of the referenced content item
 * @param title its display title
 */
public record LinkRef(String slug, String title) {

  public static LinkRef of(ContentItem item) {
    return item == null ? null : new LinkRef(item.getSlug(), item.getTitle());
  }
}
