package uk.ac.ebi.biostudies.content_index.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static uk.ac.ebi.biostudies.content_index.ContentFixtures.date;
import static uk.ac.ebi.biostudies.content_index.ContentFixtures.post;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.ac.ebi.biostudies.content_index.model.ContentItem;
import uk.ac.ebi.biostudies.content_index.model.Entity;
import uk.ac.ebi.biostudies.content_index.model.TaxonomyNode;
import uk.ac.ebi.biostudies.content_index.store.EntityStore;
import uk.ac.ebi.biostudies.content_index.tree.TreeBuilder;

@DisplayName("DerivedCache Tests")
class DerivedCacheTest {

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  private EntityStore store;
  private TreeBuilder treeBuilder;
  private DerivedCache cache;

  @BeforeEach
  void setUp() {
    store = new EntityStore("cache_test");
    treeBuilder = spy(new TreeBuilder());
    cache = new DerivedCache("cache_test_index", store, treeBuilder);
  }

  @Test
  @DisplayName("Should build once and serve the memoized tree")
  void shouldMemoizeTrees() {
    store.saveContentItem(post("/blog/a.md", date(2023, 1, 1)));

    TaxonomyNode first = cache.getOrBuild(TreeKind.TAXONOMY_TREE);
    TaxonomyNode second = cache.getOrBuild(TreeKind.TAXONOMY_TREE);

    assertThat(second).isSameAs(first);
    assertThat(cache.isCached(TreeKind.TAXONOMY_TREE)).isTrue();
    assertThat(cache.isCached(TreeKind.CONTENT_TREE)).isFalse();
    verify(treeBuilder, times(1)).buildTaxonomyTree(anyCollection());
  }

  @Test
  @DisplayName("Writes should not invalidate the cached tree")
  void writesShouldNotInvalidate() {
    store.saveContentItem(post("/blog/a.md", date(2023, 1, 1)));
    TaxonomyNode before = cache.getOrBuild(TreeKind.TAXONOMY_TREE);

    store.saveContentItem(post("/docs/b.md", date(2023, 1, 1)));

    assertThat(cache.getOrBuild(TreeKind.TAXONOMY_TREE)).isSameAs(before);
  }

  @Test
  @DisplayName("Invalidation should rebuild only the dropped slot")
  void invalidateShouldDropOneSlot() {
    store.saveContentItem(post("/blog/a.md", date(2023, 1, 1)));
    TaxonomyNode taxonomyTree = cache.getOrBuild(TreeKind.TAXONOMY_TREE);
    TaxonomyNode contentTree = cache.getOrBuild(TreeKind.CONTENT_TREE);
    store.saveContentItem(post("/docs/b.md", date(2023, 1, 1)));

    cache.invalidate(TreeKind.CONTENT_TREE);

    assertThat(cache.getOrBuild(TreeKind.TAXONOMY_TREE)).isSameAs(taxonomyTree);
    TaxonomyNode rebuilt = cache.getOrBuild(TreeKind.CONTENT_TREE);
    assertThat(rebuilt).isNotSameAs(contentTree);
    assertThat(rebuilt.getChildren()).extracting(Entity::getSlug).containsExactly("/blog", "/docs");
  }

  @Test
  @DisplayName("Building the content tree should write links back into the store")
  void contentBuildShouldWriteLinksBack() {
    store.saveContentItem(post("/blog/a.md", date(2023, 1, 1)));
    store.saveContentItem(post("/blog/b.md", date(2023, 2, 1)));

    cache.getOrBuild(TreeKind.CONTENT_TREE);

    ContentItem newest = store.getContentItem("/blog/b").orElseThrow();
    ContentItem oldest = store.getContentItem("/blog/a").orElseThrow();
    assertThat(newest.getLink()).isNotNull();
    assertThat(newest.getLink().getNext().slug()).isEqualTo("/blog/a");
    assertThat(oldest.getLink().getPrevious().slug()).isEqualTo("/blog/b");
    assertThat(newest.getBody()).isNotNull();
  }

  @Test
  @DisplayName("A rebuilt tree should match a fresh single-threaded build")
  void rebuiltTreeShouldBeDeterministic() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Callable<ContentItem>> saves = new ArrayList<>();
      for (int i = 0; i < 12; i++) {
        String folder = i % 3 == 0 ? "/blog" : i % 3 == 1 ? "/blog/art" : "/docs";
        ContentItem item = post(folder + "/item-" + i + ".md", date(2023, 1 + i % 12, 1));
        saves.add(() -> store.saveContentItem(item));
      }
      for (Future<ContentItem> future : executor.invokeAll(saves)) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    store.delete("/docs/item-2");
    cache.invalidateAll();

    String cached = objectMapper.writeValueAsString(cache.getOrBuild(TreeKind.CONTENT_TREE));
    String fresh = objectMapper.writeValueAsString(new TreeBuilder().buildContentTree(store.enumerate()));

    assertThat(cached).isEqualTo(fresh);
    assertThat(cached).doesNotContain("/docs/item-2\"");
  }

  @Test
  @DisplayName("Concurrent cold reads should all get an equal tree")
  void concurrentColdReadsShouldAgree() throws Exception {
    store.saveContentItem(post("/blog/a.md", date(2023, 1, 1)));
    store.saveContentItem(post("/docs/b.md", date(2023, 1, 1)));
    ExecutorService executor = Executors.newFixedThreadPool(4);
    List<String> trees = new ArrayList<>();
    try {
      List<Callable<TaxonomyNode>> reads = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        reads.add(() -> cache.getOrBuild(TreeKind.TAXONOMY_TREE));
      }
      for (Future<TaxonomyNode> future : executor.invokeAll(reads)) {
        trees.add(objectMapper.writeValueAsString(future.get(10, TimeUnit.SECONDS)));
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(trees).containsOnly(trees.get(0));
  }
}
