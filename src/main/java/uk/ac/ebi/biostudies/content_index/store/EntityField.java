package uk.ac.ebi.biostudies.content_index.store;

import java.util.EnumSet;
import java.util.Set;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.ContentLink;
import uk.ac.ebi.biostudies.content_index.model.Entity;
import uk.ac.ebi.biostudies.content_index.model.EntityKind;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;

/**
 * Single fields of a stored entity that can be rewritten in place with {@link
 * EntityStore#updateField(String, EntityField, Object)}.
 */
public enum EntityField {
  TITLE("title", String.class, EnumSet.allOf(EntityKind.class)),
  SUMMARY("summary", String.class, EnumSet.of(EntityKind.CONTENT_ITEM)),
  PUBLISHED("is_published", Boolean.class, EnumSet.of(EntityKind.CONTENT_ITEM)),
  POSITION("position", Integer.class, EnumSet.allOf(EntityKind.class)),
  LINK("link", ContentLink.class, EnumSet.of(EntityKind.CONTENT_ITEM)),
  ;

  private final String fieldName;
  private final Class<?> valueType;
  private final Set<EntityKind> applicableKinds;

  EntityField(String fieldName, Class<?> valueType, Set<EntityKind> applicableKinds) {
    this.fieldName = fieldName;
    this.valueType = valueType;
    this.applicableKinds = applicableKinds;
  }

  /** True if entities of the given kind carry this field. */
  public boolean appliesTo(EntityKind kind) {
    return applicableKinds.contains(kind);
  }

  /**
   * Returns a copy of {@code entity} with this field set to {@code value}. Null clears the field,
   * except for {@link #PUBLISHED}, which is a flag.
   *
   * @throws IllegalArgumentException if the field does not apply to the entity kind or the value
   *     has the wrong type
   */
  public Entity apply(Entity entity, Object value) {
    if (!appliesTo(entity.kind())) {
      throw new IllegalArgumentException(
          "Field " + fieldName + " does not apply to " + entity.kind().getValue() + " "
              + entity.getSlug());
    }
    if (value == null ? this == PUBLISHED : !valueType.isInstance(value)) {
      throw new IllegalArgumentException(
          "Field " + fieldName + " expects " + valueType.getSimpleName() + " but got "
              + (value == null ? "null" : value.getClass().getSimpleName()));
    }
    if (entity instanceof ContentItem item) {
      return applyToItem(item, value);
    }
    return applyToTaxonomy((TaxonomyNode) entity, value);
  }

  private ContentItem applyToItem(ContentItem item, Object value) {
    ContentItem.ContentItemBuilder builder = item.toBuilder();
    switch (this) {
      case TITLE -> builder.title((String) value);
      case SUMMARY -> builder.summary((String) value);
      case PUBLISHED -> builder.published((Boolean) value);
      case POSITION -> builder.position((Integer) value);
      case LINK -> builder.link((ContentLink) value);
      default -> throw new IllegalStateException("Unhandled field " + this);
    }
    return builder.build();
  }

  private TaxonomyNode applyToTaxonomy(TaxonomyNode node, Object value) {
    TaxonomyNode.TaxonomyNodeBuilder builder = node.toBuilder();
    switch (this) {
      case TITLE -> builder.title((String) value);
      case POSITION -> builder.position((Integer) value);
      default -> throw new IllegalStateException("Unhandled field " + this);
    }
    return builder.build();
  }
}
