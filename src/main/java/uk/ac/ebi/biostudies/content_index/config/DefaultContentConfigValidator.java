package uk.ac.ebi.biostudies.content_index.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class DefaultContentConfigValidator implements ContentConfigValidator {

  @Override
  public StartupConfig validateAndGetStartupConfig(ContentConfig config) {
    if (config == null) {
      throw new IllegalStateException("ContentConfig must not be null");
    }

    validateCacheNames(config);

    int fileInterval =
        ensureIsInterval(
            config.getRecheckPendingFileEventsInterval(), "recheckPendingFileEventsInterval");

    String repositoryUrl = StringUtils.trimToNull(config.getRemoteRepositoryUrl());
    if (repositoryUrl != null) {
      int remoteInterval =
          ensureIsInterval(
              config.getRecheckPendingRemoteEventsInterval(),
              "recheckPendingRemoteEventsInterval");
      ensureFileIntervalFirst(fileInterval, remoteInterval);
      log.info(
          "Remote sync enabled for {} (file interval {}ms, remote interval {}ms)",
          repositoryUrl,
          fileInterval,
          remoteInterval);
    }

    return new StartupConfig(config.getCacheName(), config.getIndexCacheName(), repositoryUrl);
  }

  private void validateCacheNames(ContentConfig config) {
    if (StringUtils.isBlank(config.getCacheName())) {
      throw new IllegalStateException("Config cacheName must not be blank");
    }
    if (StringUtils.isBlank(config.getIndexCacheName())) {
      throw new IllegalStateException("Config indexCacheName must not be blank");
    }
    if (config.getCacheName().equals(config.getIndexCacheName())) {
      throw new IllegalStateException(
          "Config cacheName and indexCacheName must differ, both are '"
              + config.getCacheName()
              + "'");
    }
  }

  private int ensureIsInterval(Integer value, String name) {
    if (value == null || value <= 0) {
      throw new IllegalStateException(
          "Config " + name + " is not a valid interval number: " + value);
    }
    return value;
  }

  private void ensureFileIntervalFirst(int fileInterval, int remoteInterval) {
    if (fileInterval >= remoteInterval) {
      throw new IllegalStateException(
          "Since remoteRepositoryUrl has been provided, recheckPendingFileEventsInterval ("
              + fileInterval
              + ") must be smaller than recheckPendingRemoteEventsInterval ("
              + remoteInterval
              + ")");
    }
  }
}
