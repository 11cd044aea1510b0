package uk.ac.ebi.biostudies.content_index.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.content_index.Constants;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.ContentLink;
import uk.ac.ebi.biostudies.content_index.model.ContentType;
import uk.ac.ebi.biostudies.content_index.model.Entity;
import uk.ac.ebi.biostudies.content_index.model.LinkRef;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;
import uk.ac.ebi.biostudies.content_index.util.PathResolver;

/**
 * Builds the taxonomy tree and the content tree from a snapshot of stored entities.
 *
 * <p>Both trees are rooted at the root taxonomy {@code "/"} and nest taxonomies by their {@code
 * parents}. Ancestors missing from the snapshot are synthesized, so every node of the snapshot
 * ends up in the tree. The builder is stateless: the same snapshot always yields the same tree.
 */
@Slf4j
@Component
public class TreeBuilder {

  /**
   * Builds the taxonomy-only hierarchy. Content items are left out and index items lose their body.
   *
   * @param entities snapshot of the entity store
   * @return the root taxonomy
   */
  public TaxonomyNode buildTaxonomyTree(Collection<? extends Entity> entities) {
    Map<String, TaxonomyNode> taxonomies = collectTaxonomies(entities, false);
    return assemble(
        taxonomies.get(Constants.ROOT_SLUG), groupByParent(taxonomies), node -> List.of(), true);
  }

  /**
   * Builds the full content hierarchy. Each taxonomy lists the content items it directly owns,
   * resolved against their flat records, followed by its nested taxonomies. Every item carries its
   * resolved {@link ContentLink}.
   *
   * @param entities snapshot of the entity store
   * @return the root taxonomy
   */
  public TaxonomyNode buildContentTree(Collection<? extends Entity> entities) {
    Map<String, TaxonomyNode> taxonomies = collectTaxonomies(entities, true);
    Map<String, List<ContentItem>> itemsByTaxonomy = directItems(entities, taxonomies);
    TaxonomyNode tree =
        assemble(
            taxonomies.get(Constants.ROOT_SLUG),
            groupByParent(taxonomies),
            node -> itemsByTaxonomy.getOrDefault(node.getSlug(), List.of()),
            false);

    Map<String, ContentItem> linked = new HashMap<>();
    for (ContentItem item : navigationPass(flattenContentItems(tree))) {
      linked.put(item.getSlug(), item);
    }
    return relink(tree, linked);
  }

  /**
   * Assigns every item a link to its neighbours in the given sequence. The first item has no
   * previous and the last item no next.
   *
   * @param itemsInTreeOrder content items in depth-first, sibling-ordered sequence
   * @return copies of the items with {@code link} set, in the same order
   */
  public List<ContentItem> navigationPass(List<ContentItem> itemsInTreeOrder) {
    List<ContentItem> linked = new ArrayList<>(itemsInTreeOrder.size());
    for (int i = 0; i < itemsInTreeOrder.size(); i++) {
      ContentItem item = itemsInTreeOrder.get(i);
      ContentItem previous = i > 0 ? itemsInTreeOrder.get(i - 1) : null;
      ContentItem next = i < itemsInTreeOrder.size() - 1 ? itemsInTreeOrder.get(i + 1) : null;
      linked.add(item.toBuilder().link(linkOf(item, previous, next)).build());
    }
    return List.copyOf(linked);
  }

  /** Content items of a tree in depth-first, sibling-ordered sequence. Index items are excluded. */
  public List<ContentItem> flattenContentItems(TaxonomyNode tree) {
    List<ContentItem> items = new ArrayList<>();
    collectItems(tree, items);
    return items;
  }

  /** Finds the taxonomy of the given slug within a tree. */
  public Optional<TaxonomyNode> findSubtree(TaxonomyNode tree, String slug) {
    if (tree.getSlug().equals(slug)) {
      return Optional.of(tree);
    }
    for (Entity child : tree.getChildren()) {
      if (child instanceof TaxonomyNode node) {
        Optional<TaxonomyNode> found = findSubtree(node, slug);
        if (found.isPresent()) {
          return found;
        }
      }
    }
    return Optional.empty();
  }

  private Map<String, TaxonomyNode> collectTaxonomies(
      Collection<? extends Entity> entities, boolean includeDeclared) {
    Map<String, TaxonomyNode> taxonomies = new LinkedHashMap<>();
    for (Entity entity : entities) {
      if (entity instanceof TaxonomyNode node) {
        taxonomies.put(node.getSlug(), node);
      }
    }
    if (includeDeclared) {
      // Taxonomies declared by items but not stored yet
      for (Entity entity : entities) {
        if (entity instanceof ContentItem item && item.getType() != ContentType.INDEX) {
          for (TaxonomyNode declared : item.getTaxonomies()) {
            taxonomies.putIfAbsent(
                declared.getSlug(), declared.toBuilder().children(List.of()).build());
          }
        }
      }
    }
    taxonomies.putIfAbsent(Constants.ROOT_SLUG, TaxonomyNode.root());
    for (TaxonomyNode node : List.copyOf(taxonomies.values())) {
      List<String> parents = node.getParents();
      for (int depth = 0; depth < parents.size(); depth++) {
        String ancestor = parents.get(depth);
        if (!taxonomies.containsKey(ancestor)) {
          log.debug("Synthesizing missing taxonomy {} above {}", ancestor, node.getSlug());
          taxonomies.put(ancestor, synthesize(ancestor, parents.subList(0, depth)));
        }
      }
    }
    return taxonomies;
  }

  private TaxonomyNode synthesize(String slug, List<String> parents) {
    return TaxonomyNode.builder()
        .slug(slug)
        .title(PathResolver.deriveTaxonomyName(StringUtils.substringAfterLast(slug, "/")))
        .level(parents.size() + 1)
        .parents(List.copyOf(parents))
        .build();
  }

  private Map<String, List<TaxonomyNode>> groupByParent(Map<String, TaxonomyNode> taxonomies) {
    Map<String, List<TaxonomyNode>> nested = new HashMap<>();
    for (TaxonomyNode node : taxonomies.values()) {
      String parent = node.parentSlug();
      if (parent != null && !parent.equals(node.getSlug())) {
        nested.computeIfAbsent(parent, key -> new ArrayList<>()).add(node);
      }
    }
    return nested;
  }

  /**
   * Groups the content items of the snapshot by the taxonomy that directly owns them. Flat records
   * win; a copy embedded in its taxonomy is used only while the flat record is not visible yet.
   */
  private Map<String, List<ContentItem>> directItems(
      Collection<? extends Entity> entities, Map<String, TaxonomyNode> taxonomies) {
    Map<String, ContentItem> items = new LinkedHashMap<>();
    for (Entity entity : entities) {
      if (entity instanceof ContentItem item && item.getType() != ContentType.INDEX) {
        items.put(item.getSlug(), item);
      }
    }
    for (TaxonomyNode node : taxonomies.values()) {
      for (Entity child : node.getChildren()) {
        if (child instanceof ContentItem embedded
            && node.getSlug().equals(embedded.innermostTaxonomySlug())
            && !items.containsKey(embedded.getSlug())) {
          log.debug(
              "Content item {} listed by {} has no flat record, using embedded copy",
              embedded.getSlug(),
              node.getSlug());
          items.put(embedded.getSlug(), embedded);
        }
      }
    }
    Map<String, List<ContentItem>> grouped = new HashMap<>();
    for (ContentItem item : items.values()) {
      grouped.computeIfAbsent(item.innermostTaxonomySlug(), key -> new ArrayList<>()).add(item);
    }
    return grouped;
  }

  private TaxonomyNode assemble(
      TaxonomyNode node,
      Map<String, List<TaxonomyNode>> nested,
      Function<TaxonomyNode, List<ContentItem>> itemsOf,
      boolean stripIndexBody) {
    List<Entity> children = new ArrayList<>();
    itemsOf.apply(node).stream()
        .sorted(SiblingOrdering.contentItems(node.getSortBy(), node.getSortOrder()))
        .forEach(children::add);
    nested.getOrDefault(node.getSlug(), List.of()).stream()
        .sorted(SiblingOrdering.TAXONOMIES)
        .map(child -> assemble(child, nested, itemsOf, stripIndexBody))
        .forEach(children::add);

    TaxonomyNode.TaxonomyNodeBuilder builder = node.toBuilder().children(List.copyOf(children));
    if (stripIndexBody && node.getIndex() != null) {
      builder.index(node.getIndex().withoutBody());
    }
    return builder.build();
  }

  private ContentLink linkOf(ContentItem item, ContentItem previous, ContentItem next) {
    TaxonomyNode owner = item.innermostTaxonomy();
    List<String> parents = new ArrayList<>();
    if (owner == null) {
      parents.add(Constants.ROOT_SLUG);
    } else {
      parents.addAll(owner.getParents());
      parents.add(owner.getSlug());
    }
    return ContentLink.builder()
        .slug(item.getSlug())
        .title(item.getTitle())
        .level(parents.size() + 1)
        .parents(List.copyOf(parents))
        .previous(LinkRef.of(previous))
        .next(LinkRef.of(next))
        .build();
  }

  private void collectItems(TaxonomyNode node, List<ContentItem> items) {
    for (Entity child : node.getChildren()) {
      if (child instanceof ContentItem item) {
        items.add(item);
      } else if (child instanceof TaxonomyNode nested) {
        collectItems(nested, items);
      }
    }
  }

  private TaxonomyNode relink(TaxonomyNode node, Map<String, ContentItem> linked) {
    List<Entity> children = new ArrayList<>(node.getChildren().size());
    for (Entity child : node.getChildren()) {
      if (child instanceof ContentItem item) {
        children.add(linked.getOrDefault(item.getSlug(), item));
      } else if (child instanceof TaxonomyNode nested) {
        children.add(relink(nested, linked));
      }
    }
    return node.toBuilder().children(List.copyOf(children)).build();
  }
}
