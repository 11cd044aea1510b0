package uk.ac.ebi.biostudies.content_index.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.ac.ebi.biostudies.content_index.cache.DerivedCache;
import uk.ac.ebi.biostudies.content_index.store.EntityStore;
import uk.ac.ebi.biostudies.content_index.tree.TreeBuilder;

/**
 * Wires the entity store and the derived tree cache under the identifiers of the validated
 * configuration. Invalid configuration fails bean creation, so the context never starts serving.
 */
@Slf4j
@Configuration
public class ContentCacheConfig {

  @Bean
  public StartupConfig startupConfig(ContentConfig contentConfig, ContentConfigValidator validator) {
    return validator.validateAndGetStartupConfig(contentConfig);
  }

  @Bean
  public EntityStore entityStore(StartupConfig startupConfig) {
    log.info("Creating entity store {}", startupConfig.cacheName());
    return new EntityStore(startupConfig.cacheName());
  }

  @Bean
  public DerivedCache derivedCache(
      StartupConfig startupConfig, EntityStore entityStore, TreeBuilder treeBuilder) {
    log.info("Creating derived tree cache {}", startupConfig.indexCacheName());
    return new DerivedCache(startupConfig.indexCacheName(), entityStore, treeBuilder);
  }
}
