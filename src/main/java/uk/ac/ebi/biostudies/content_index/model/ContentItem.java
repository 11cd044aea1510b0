package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import uk.ac.ebi.biostudies.content_index.Constants;

/**
 * A piece of content (post, page or taxonomy index) derived from one markdown file.
 *
 * <p>Instances are immutable; updates go through {@link #toBuilder()}. The only field changed after
 * creation is {@link #getLink() link}, which the content tree build resolves and writes back.
 *
 * <p>Prefer {@link uk.ac.ebi.biostudies.content_index.index.ContentItemFactory} to create instances from parsed fields: it derives the slug
 * and taxonomy chain from the file path and validates required fields.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ContentItem implements Entity {

  String slug;

  @Builder.Default ContentType type = ContentType.POST;

  String title;
  String summary;

  /** Rendered body. Null in copies embedded into taxonomies. */
  String body;

  String filePath;
  OffsetDateTime date;
  boolean published;

  /** Ordering hint. Only meaningful for index items, whose position their taxonomy inherits. */
  Integer position;

  @Builder.Default Map<String, Object> metadata = Map.of();

  /** Taxonomy chain the item belongs to, root-first; the last entry is its innermost taxonomy. */
  @Builder.Default List<TaxonomyNode> taxonomies = List.of();

  /** Resolved tree position and navigation; null until the first content tree build. */
  ContentLink link;

  @Override
  @JsonProperty("kind")
  public EntityKind kind() {
    return EntityKind.CONTENT_ITEM;
  }

  /** Copy of this item without its body, as embedded into taxonomy children lists. */
  public ContentItem withoutBody() {
    return body == null ? this : toBuilder().body(null).build();
  }

  /** Slug of the taxonomy that directly owns this item, or the root slug if it declares none. */
  public String innermostTaxonomySlug() {
    return taxonomies.isEmpty()
        ? Constants.ROOT_SLUG
        : taxonomies.get(taxonomies.size() - 1).getSlug();
  }

  /** Innermost taxonomy as declared by the item, or null if it declares none. */
  public TaxonomyNode innermostTaxonomy() {
    return taxonomies.isEmpty() ? null : taxonomies.get(taxonomies.size() - 1);
  }
}
