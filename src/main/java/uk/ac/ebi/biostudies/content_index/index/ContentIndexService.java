package uk.ac.ebi.biostudies.content_index.index;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.content_index.Constants;
import uk.ac.ebi.biostudies.content_index.cache.DerivedCache;
import uk.ac.ebi.biostudies.content_index.cache.TreeKind;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.ContentType;
import uk.ac.ebi.biostudies.content_index.model.Entity;
import uk.ac.ebi.biostudies.content_index.model.EntityKind;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyType;
import uk.ac.ebi.biostudies.content_index.store.EntityStore;
import uk.ac.ebi.biostudies.content_index.tree.TreeBuilder;

/**
 * Entry point of the content index.
 *
 * <p>Writers (file and repository watchers) push parsed items through the save and delete
 * operations. Single saves and deletes do not touch the derived trees; a writer either calls {@link
 * #rebuildTrees()} when its batch is done or hands the whole batch to {@link #ingest(Collection)}.
 * Readers get entities by slug and the two trees, which are rebuilt lazily.
 */
@Slf4j
@Service
public class ContentIndexService {

  private static final Comparator<Entity> BY_SLUG = Comparator.comparing(Entity::getSlug);

  private static final Comparator<ContentItem> NEWEST_FIRST =
      Comparator.comparing(
              ContentItem::getDate, Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder()))
          .thenComparing(ContentItem::getSlug);

  private final EntityStore entityStore;
  private final DerivedCache derivedCache;
  private final TreeBuilder treeBuilder;

  public ContentIndexService(
      EntityStore entityStore, DerivedCache derivedCache, TreeBuilder treeBuilder) {
    this.entityStore = entityStore;
    this.derivedCache = derivedCache;
    this.treeBuilder = treeBuilder;
  }

  /** Saves a content item and files it under its taxonomies. Safe to repeat for one file state. */
  public ContentItem saveContentItem(ContentItem item) {
    return entityStore.saveContentItem(item);
  }

  /** Merges a taxonomy's descriptive item into that taxonomy. Safe to repeat for one file state. */
  public ContentItem saveIndexItem(ContentItem item) {
    return entityStore.saveIndexItem(item);
  }

  /** Removes the entity of the given slug; a no-op for unknown slugs. */
  public Optional<Entity> deleteBySlug(String slug) {
    Optional<Entity> deleted = entityStore.delete(slug);
    if (deleted.isEmpty()) {
      log.debug("Nothing to delete for slug {}", slug);
    }
    return deleted;
  }

  public Optional<Entity> getBySlug(String slug) {
    return entityStore.get(slug);
  }

  public TaxonomyNode getTaxonomyTree() {
    return derivedCache.getOrBuild(TreeKind.TAXONOMY_TREE);
  }

  /** The whole content tree. */
  public TaxonomyNode getContentTree() {
    return derivedCache.getOrBuild(TreeKind.CONTENT_TREE);
  }

  /**
   * The part of the content tree rooted at the given taxonomy.
   *
   * @param rootSlug slug of a taxonomy, {@code "/"} for the whole tree
   * @return the subtree, or empty if no taxonomy has that slug
   */
  public Optional<TaxonomyNode> getContentTree(String rootSlug) {
    String slug = rootSlug == null || rootSlug.isBlank() ? Constants.ROOT_SLUG : rootSlug;
    return treeBuilder.findSubtree(getContentTree(), slug);
  }

  /**
   * Lists stored entities ordered by slug.
   *
   * @param kind the kind to list, or null for every kind
   */
  public List<Entity> listAll(EntityKind kind) {
    List<Entity> entities = kind == null ? entityStore.enumerate() : entityStore.enumerate(kind);
    return entities.stream().sorted(BY_SLUG).toList();
  }

  /** Content items of one type, newest first. */
  public List<ContentItem> listContentItems(ContentType type) {
    return entityStore.enumerate(EntityKind.CONTENT_ITEM).stream()
        .map(ContentItem.class::cast)
        .filter(item -> item.getType() == type)
        .sorted(NEWEST_FIRST)
        .toList();
  }

  /** Stored taxonomies of one type, ordered by slug. */
  public List<TaxonomyNode> listTaxonomies(TaxonomyType type) {
    return entityStore.enumerate(EntityKind.TAXONOMY).stream()
        .map(TaxonomyNode.class::cast)
        .filter(node -> node.getType() == type)
        .sorted(BY_SLUG)
        .toList();
  }

  /**
   * Saves a batch of items, index items included, then drops both trees so the next read rebuilds
   * them from the complete batch.
   *
   * @return the number of items saved
   */
  public int ingest(Collection<ContentItem> items) {
    for (ContentItem item : items) {
      entityStore.saveContentItem(item);
    }
    derivedCache.invalidateAll();
    log.info("Ingested {} content items into {}", items.size(), entityStore.getName());
    return items.size();
  }

  /** Drops both trees and builds them again from the current store content. */
  public void rebuildTrees() {
    derivedCache.invalidateAll();
    derivedCache.getOrBuild(TreeKind.TAXONOMY_TREE);
    derivedCache.getOrBuild(TreeKind.CONTENT_TREE);
    log.info("Rebuilt trees of {}", entityStore.getName());
  }

  /** Empties the store and drops both trees. */
  public void deleteAll() {
    entityStore.clear();
    derivedCache.invalidateAll();
  }
}
