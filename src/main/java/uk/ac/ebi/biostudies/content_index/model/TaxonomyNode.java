package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import uk.ac.ebi.biostudies.content_index.Constants;
import uk.ac.ebi.biostudies.content_index.util.PathResolver;

/**
 * A category of the content hierarchy.
 *
 * <p>As stored in the entity store, {@link #getChildren() children} holds the content items filed
 * under this taxonomy or any of its descendants, with bodies stripped. In a built tree, children
 * additionally holds nested taxonomy nodes.
 *
 * <p>Invariants: {@code level == parents.size() + 1}; every non-root node lists the root slug
 * {@code "/"} first among its parents; the root has level 1 and no parents. An index item is kept
 * in {@link #getIndex() index} and never in children.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaxonomyNode implements Entity {

  String slug;
  String title;

  @Builder.Default TaxonomyType type = TaxonomyType.TAXONOMY;

  String customType;

  @Builder.Default int level = 1;

  @Builder.Default List<String> parents = List.of();

  @Builder.Default List<Entity> children = List.of();

  /** The taxonomy's own descriptive item, distinct from its children. */
  ContentItem index;

  @Builder.Default SortBy sortBy = SortBy.DATE;

  @Builder.Default SortOrder sortOrder = SortOrder.DESC;

  /** Ordering hint among sibling taxonomies, inherited from the index item when present. */
  Integer position;

  /** The synthetic root taxonomy: slug "/", empty title, level 1, no parents. */
  public static TaxonomyNode root() {
    return TaxonomyNode.builder().slug(Constants.ROOT_SLUG).title("").build();
  }

  @Override
  @JsonProperty("kind")
  public EntityKind kind() {
    return EntityKind.TAXONOMY;
  }

  /** True for the root taxonomy. */
  public boolean rootNode() {
    return Constants.ROOT_SLUG.equals(slug);
  }

  /** Slug of the direct parent, or null for the root. */
  public String parentSlug() {
    return parents.isEmpty() ? null : parents.get(parents.size() - 1);
  }

  /** True when the node holds neither children nor an index item. */
  public boolean holdsNothing() {
    return children.isEmpty() && index == null;
  }

  /**
   * Returns a copy holding {@code child}: an existing child with the same slug is replaced in
   * place, otherwise the child is appended.
   */
  public TaxonomyNode withChild(ContentItem child) {
    List<Entity> updated = new ArrayList<>(children.size() + 1);
    boolean replaced = false;
    for (Entity existing : children) {
      if (!replaced && existing.getSlug().equals(child.getSlug())) {
        updated.add(child);
        replaced = true;
      } else {
        updated.add(existing);
      }
    }
    if (!replaced) {
      updated.add(child);
    }
    return toBuilder().children(List.copyOf(updated)).build();
  }

  /** Returns a copy without the child of the given slug; {@code this} if there is no such child. */
  public TaxonomyNode withoutChild(String childSlug) {
    List<Entity> updated =
        children.stream().filter(child -> !child.getSlug().equals(childSlug)).toList();
    return updated.size() == children.size() ? this : toBuilder().children(updated).build();
  }

  /**
   * Merges an index item into this taxonomy: replaces {@code index}, {@code position} and {@code
   * title}. Sorting and custom type start from their defaults and take the item's metadata on top,
   * so a setting removed from the index file is reset. Children are left untouched.
   */
  public TaxonomyNode withIndex(ContentItem indexItem) {
    Map<String, Object> metadata = indexItem.getMetadata();
    TaxonomyNodeBuilder builder =
        withDefaultSettings()
            .index(indexItem)
            .position(indexItem.getPosition())
            .title(indexItem.getTitle());
    SortBy.fromValue(metadata.get(Constants.SORT_BY_METADATA)).ifPresent(builder::sortBy);
    SortOrder.fromValue(metadata.get(Constants.SORT_ORDER_METADATA)).ifPresent(builder::sortOrder);
    Object customTypeValue = metadata.get(Constants.CUSTOM_TYPE_METADATA);
    if (customTypeValue != null) {
      builder.customType(customTypeValue.toString());
    }
    return builder.build();
  }

  /**
   * Returns a copy with everything the index item set cleared: position, sorting and custom type go
   * back to their defaults and the title is derived from the slug again.
   */
  public TaxonomyNode withoutIndex() {
    String derivedTitle =
        rootNode() ? "" : PathResolver.deriveTaxonomyName(StringUtils.substringAfterLast(slug, "/"));
    return withDefaultSettings().index(null).position(null).title(derivedTitle).build();
  }

  private TaxonomyNodeBuilder withDefaultSettings() {
    return toBuilder().sortBy(SortBy.DATE).sortOrder(SortOrder.DESC).customType(null);
  }
}
