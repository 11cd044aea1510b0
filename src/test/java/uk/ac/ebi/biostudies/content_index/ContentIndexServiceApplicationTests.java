package uk.ac.ebi.biostudies.content_index;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import uk.ac.ebi.biostudies.content_index.cache.DerivedCache;
import uk.ac.ebi.biostudies.content_index.store.EntityStore;

@SpringBootTest
@ActiveProfiles("test")
class ContentIndexServiceApplicationTests {

  @Autowired private EntityStore entityStore;
  @Autowired private DerivedCache derivedCache;

  @Test
  void contextLoads() {
    assertEquals("test_content_cache", entityStore.getName());
    assertEquals("test_content_index_cache", derivedCache.getName());
  }
}
