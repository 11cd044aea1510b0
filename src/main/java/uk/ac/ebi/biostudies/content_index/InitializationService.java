package uk.ac.ebi.biostudies.content_index;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.content_index.config.StartupConfig;
import uk.ac.ebi.biostudies.content_index.index.ContentIndexService;

/**
 * Builds the derived trees once the application context is ready, so the first readers do not pay
 * for the initial build.
 */
@Slf4j
@Service
public class InitializationService {

  private final StartupConfig startupConfig;
  private final ContentIndexService contentIndexService;

  public InitializationService(
      StartupConfig startupConfig, ContentIndexService contentIndexService) {
    this.startupConfig = startupConfig;
    this.contentIndexService = contentIndexService;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    log.debug("Application initialization started");
    try {
      if (startupConfig.remoteSyncEnabled()) {
        log.info("Content is synchronized with {}", startupConfig.remoteRepositoryUrl());
      } else {
        log.info("Remote repository sync disabled, serving local content only");
      }
      contentIndexService.rebuildTrees();
      log.info("Application initialization completed successfully");
    } catch (Exception e) {
      log.error("Application initialization failed", e);
      throw new IllegalStateException("Failed to initialize application components", e);
    }
  }
}
