package uk.ac.ebi.biostudies.content_index.config;

/**
 * Validated configuration values handed to the stores at construction, so that several
 * independent instances can coexist (e.g. in tests).
 *
 * @param cacheName identifier of the entity cache
 * @param indexCacheName identifier of the derived tree cache
 * @param remoteRepositoryUrl remote repository URL, or null when remote sync is disabled
 */
public record StartupConfig(String cacheName, String indexCacheName, String remoteRepositoryUrl) {

  public boolean remoteSyncEnabled() {
    return remoteRepositoryUrl != null && !remoteRepositoryUrl.isBlank();
  }
}
