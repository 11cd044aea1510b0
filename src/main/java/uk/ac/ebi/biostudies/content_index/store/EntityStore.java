package uk.ac.ebi.biostudies.content_index.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.ContentType;
import uk.ac.ebi.biostudies.content_index.model.Entity;
import uk.ac.ebi.biostudies.content_index.model.EntityKind;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;

/**
 * In-memory store of content items and taxonomy nodes keyed by slug.
 *
 * <p>Both kinds share one keyspace. Every write is an atomic transaction on a single key, so
 * concurrent saves filing items under the same taxonomy never lose a child. Writes spanning several
 * keys (an item and its taxonomies) are not atomic as a whole: readers may briefly see a taxonomy
 * listing a child whose flat record is not yet visible, or the reverse.
 *
 * <p>The store never invalidates derived trees; callers do that once their writes are done.
 */
@Slf4j
public class EntityStore {

  private final String name;
  private final ConcurrentMap<String, Entity> entities = new ConcurrentHashMap<>();

  public EntityStore(String name) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
  }

  public String getName() {
    return name;
  }

  public Optional<Entity> get(String slug) {
    return slug == null ? Optional.empty() : Optional.ofNullable(entities.get(slug));
  }

  public Optional<ContentItem> getContentItem(String slug) {
    return get(slug).filter(ContentItem.class::isInstance).map(ContentItem.class::cast);
  }

  public Optional<TaxonomyNode> getTaxonomy(String slug) {
    return get(slug).filter(TaxonomyNode.class::isInstance).map(TaxonomyNode.class::cast);
  }

  /**
   * Upserts a content item and files a body-less copy of it under every taxonomy it declares,
   * creating taxonomies on first use. Saving the same item again replaces the filed copies in place.
   * Index items are routed to {@link #saveIndexItem(ContentItem)}.
   *
   * @param item the item to save
   * @return the saved item
   * @throws IllegalStateException if the slug of the item or of one of its taxonomies is taken by an
   *     entity of the other kind
   */
  public ContentItem saveContentItem(ContentItem item) {
    Objects.requireNonNull(item, "item cannot be null");
    if (item.getType() == ContentType.INDEX) {
      return saveIndexItem(item);
    }
    // Reject collisions before the first write so a failed save leaves nothing behind
    ensureKind(entities.get(item.getSlug()), EntityKind.CONTENT_ITEM, item.getSlug());
    for (TaxonomyNode taxonomy : item.getTaxonomies()) {
      ensureKind(entities.get(taxonomy.getSlug()), EntityKind.TAXONOMY, taxonomy.getSlug());
    }

    AtomicReference<Entity> previous = new AtomicReference<>();
    entities.compute(
        item.getSlug(),
        (slug, existing) -> {
          ensureKind(existing, EntityKind.CONTENT_ITEM, slug);
          previous.set(existing);
          return item;
        });

    ContentItem embedded = item.withoutBody();
    List<TaxonomyNode> filed = new ArrayList<>();
    try {
      for (TaxonomyNode taxonomy : item.getTaxonomies()) {
        entities.compute(
            taxonomy.getSlug(),
            (slug, existing) -> {
              ensureKind(existing, EntityKind.TAXONOMY, slug);
              TaxonomyNode node = existing == null ? taxonomy : (TaxonomyNode) existing;
              return node.withChild(embedded);
            });
        filed.add(taxonomy);
      }
    } catch (IllegalStateException e) {
      rollBack(item, previous.get(), filed);
      throw e;
    }
    log.debug(
        "Saved content item {} under {} taxonomies in {}",
        item.getSlug(),
        item.getTaxonomies().size(),
        name);
    return item;
  }

  /**
   * Merges an index item into the innermost taxonomy of its chain, creating the taxonomy if needed.
   * Title and position of the taxonomy are taken from the item; its children are not touched.
   *
   * @param item an item describing a taxonomy
   * @return the saved item
   * @throws IllegalStateException if the taxonomy slug is taken by a content item
   */
  public ContentItem saveIndexItem(ContentItem item) {
    Objects.requireNonNull(item, "item cannot be null");
    TaxonomyNode declared =
        item.innermostTaxonomy() == null ? TaxonomyNode.root() : item.innermostTaxonomy();
    entities.compute(
        declared.getSlug(),
        (slug, existing) -> {
          ensureKind(existing, EntityKind.TAXONOMY, slug);
          TaxonomyNode node = existing == null ? declared : (TaxonomyNode) existing;
          return node.withIndex(item);
        });
    log.debug("Merged index item {} into taxonomy {} in {}", item.getSlug(), declared.getSlug(), name);
    return item;
  }

  /**
   * Atomically replaces the entity stored under {@code slug} with the result of {@code updater}.
   *
   * @return the updated entity, or empty if nothing is stored under the slug
   * @throws IllegalStateException if the updater changes the slug or the kind of the entity
   */
  public Optional<Entity> update(String slug, UnaryOperator<Entity> updater) {
    Objects.requireNonNull(updater, "updater cannot be null");
    if (slug == null) {
      return Optional.empty();
    }
    Entity updated =
        entities.computeIfPresent(
            slug,
            (key, existing) -> {
              Entity result = Objects.requireNonNull(updater.apply(existing), "updated entity");
              if (!key.equals(result.getSlug()) || result.kind() != existing.kind()) {
                throw new IllegalStateException(
                    "An update cannot change slug or kind of " + existing.kind().getValue() + " "
                        + key);
              }
              return result;
            });
    return Optional.ofNullable(updated);
  }

  /**
   * Rewrites a single field of a stored entity.
   *
   * @return the updated entity, or empty if nothing is stored under the slug
   * @throws IllegalArgumentException if the field does not apply to the stored entity or the value
   *     has the wrong type
   */
  public Optional<Entity> updateField(String slug, EntityField field, Object value) {
    Objects.requireNonNull(field, "field cannot be null");
    return update(slug, entity -> field.apply(entity, value));
  }

  /**
   * Removes the entity stored under {@code slug}. A content item is also removed from every taxonomy
   * it declares, and taxonomies left without children or index are dropped. A slug naming the index
   * item of a taxonomy clears that taxonomy's index and the settings it carried.
   *
   * @return the removed entity, or empty if the slug is unknown
   */
  public Optional<Entity> delete(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    Entity removed = entities.remove(slug);
    if (removed instanceof ContentItem item) {
      for (TaxonomyNode taxonomy : item.getTaxonomies()) {
        detachChild(taxonomy.getSlug(), slug);
      }
      log.debug("Deleted content item {} from {}", slug, name);
      return Optional.of(item);
    }
    if (removed != null) {
      log.debug("Deleted taxonomy {} from {}", slug, name);
      return Optional.of(removed);
    }
    return detachIndex(slug);
  }

  /** Snapshot of every stored entity, in no particular order. */
  public List<Entity> enumerate() {
    return List.copyOf(entities.values());
  }

  /** Snapshot of the stored entities of one kind, in no particular order. */
  public List<Entity> enumerate(EntityKind kind) {
    return entities.values().stream().filter(entity -> entity.kind() == kind).toList();
  }

  public int size() {
    return entities.size();
  }

  public void clear() {
    entities.clear();
    log.info("Cleared entity store {}", name);
  }

  private void detachChild(String taxonomySlug, String childSlug) {
    entities.computeIfPresent(
        taxonomySlug,
        (slug, existing) -> {
          if (!(existing instanceof TaxonomyNode node)) {
            return existing;
          }
          TaxonomyNode updated = node.withoutChild(childSlug);
          if (updated.holdsNothing()) {
            log.debug("Dropping emptied taxonomy {} from {}", slug, name);
            return null;
          }
          return updated;
        });
  }

  /** Undoes a save that failed after its flat record was written. */
  private void rollBack(ContentItem item, Entity previous, List<TaxonomyNode> filed) {
    log.warn("Rolling back save of content item {} in {}", item.getSlug(), name);
    if (previous == null) {
      entities.remove(item.getSlug(), item);
    } else {
      entities.replace(item.getSlug(), item, previous);
    }
    for (TaxonomyNode taxonomy : filed) {
      if (previous instanceof ContentItem earlier && declares(earlier, taxonomy.getSlug())) {
        ContentItem restored = earlier.withoutBody();
        entities.computeIfPresent(
            taxonomy.getSlug(),
            (slug, existing) ->
                existing instanceof TaxonomyNode node ? node.withChild(restored) : existing);
      } else {
        detachChild(taxonomy.getSlug(), item.getSlug());
      }
    }
  }

  private static boolean declares(ContentItem item, String taxonomySlug) {
    return item.getTaxonomies().stream().anyMatch(node -> node.getSlug().equals(taxonomySlug));
  }

  private Optional<Entity> detachIndex(String indexSlug) {
    AtomicReference<Entity> detached = new AtomicReference<>();
    for (Entity entity : entities.values()) {
      if (entity instanceof TaxonomyNode node
          && node.getIndex() != null
          && indexSlug.equals(node.getIndex().getSlug())) {
        entities.computeIfPresent(
            node.getSlug(),
            (slug, existing) -> {
              if (!(existing instanceof TaxonomyNode current)
                  || current.getIndex() == null
                  || !indexSlug.equals(current.getIndex().getSlug())) {
                return existing;
              }
              detached.set(current.getIndex());
              TaxonomyNode updated = current.withoutIndex();
              return updated.holdsNothing() ? null : updated;
            });
      }
    }
    if (detached.get() != null) {
      log.debug("Cleared index item {} from {}", indexSlug, name);
    }
    return Optional.ofNullable(detached.get());
  }

  private static void ensureKind(Entity existing, EntityKind expected, String slug) {
    if (existing != null && existing.kind() != expected) {
      throw new IllegalStateException(
          "Slug "
              + slug
              + " is already taken by a "
              + existing.kind().getValue()
              + ", cannot store a "
              + expected.getValue());
    }
  }
}
