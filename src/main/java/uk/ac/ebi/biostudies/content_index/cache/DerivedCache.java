package uk.ac.ebi.biostudies.content_index.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.Entity;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;
import uk.ac.ebi.biostudies.content_index.store.EntityField;
import uk.ac.ebi.biostudies.content_index.store.EntityStore;
import uk.ac.ebi.biostudies.content_index.tree.TreeBuilder;

/**
 * Memoizes the trees derived from an {@link EntityStore}. A slot is built from a full snapshot of
 * the store on the first read after it was invalidated.
 *
 * <p>Builds are not serialized: readers racing on an empty slot may each build the tree. Builds of
 * the same snapshot are identical, so whichever lands last wins. Store writes never invalidate a
 * slot; callers invalidate once a batch of writes is complete.
 */
@Slf4j
public class DerivedCache {

  private final String name;
  private final EntityStore entityStore;
  private final TreeBuilder treeBuilder;
  private final Cache<TreeKind, TaxonomyNode> trees;

  public DerivedCache(String name, EntityStore entityStore, TreeBuilder treeBuilder) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.entityStore = Objects.requireNonNull(entityStore, "entityStore cannot be null");
    this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder cannot be null");
    this.trees = CacheBuilder.newBuilder().build();
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the cached tree of the given kind, building it if the slot is empty. Building the
   * content tree also writes each item's resolved link back into the store.
   */
  public TaxonomyNode getOrBuild(TreeKind kind) {
    TaxonomyNode cached = trees.getIfPresent(kind);
    if (cached != null) {
      return cached;
    }
    TaxonomyNode built = build(kind);
    trees.put(kind, built);
    return built;
  }

  /** True if the slot of the given kind holds a tree. */
  public boolean isCached(TreeKind kind) {
    return trees.getIfPresent(kind) != null;
  }

  public void invalidate(TreeKind kind) {
    trees.invalidate(kind);
    log.debug("Invalidated {} in {}", kind, name);
  }

  public void invalidateAll() {
    trees.invalidateAll();
    log.debug("Invalidated all trees in {}", name);
  }

  private TaxonomyNode build(TreeKind kind) {
    long start = System.currentTimeMillis();
    List<Entity> snapshot = entityStore.enumerate();
    TaxonomyNode tree =
        switch (kind) {
          case TAXONOMY_TREE -> treeBuilder.buildTaxonomyTree(snapshot);
          case CONTENT_TREE -> buildContentTree(snapshot);
        };
    log.info(
        "Built {} from {} entities in {} ms",
        kind,
        snapshot.size(),
        System.currentTimeMillis() - start);
    return tree;
  }

  private TaxonomyNode buildContentTree(List<Entity> snapshot) {
    TaxonomyNode tree = treeBuilder.buildContentTree(snapshot);
    writeBackLinks(tree);
    return tree;
  }

  private void writeBackLinks(TaxonomyNode contentTree) {
    int missing = 0;
    for (ContentItem item : treeBuilder.flattenContentItems(contentTree)) {
      if (entityStore.updateField(item.getSlug(), EntityField.LINK, item.getLink()).isEmpty()) {
        missing++;
      }
    }
    if (missing > 0) {
      log.debug("{} linked items had no flat record in {}", missing, entityStore.getName());
    }
  }
}
