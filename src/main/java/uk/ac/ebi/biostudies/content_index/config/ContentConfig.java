package uk.ac.ebi.biostudies.content_index.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the content root, cache identifiers and the recheck intervals of
 * the file and remote repository watchers.
 *
 * <p>Values are loaded from {@code application.yml} (prefix {@code content.*}) and checked at
 * startup by {@link ContentConfigValidator}.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "content")
@Validated
public class ContentConfig {

  /** Absolute path of the folder holding the markdown content. */
  @NotBlank private String rootPath;

  /** Name of the folder, under the root path, holding static assets (images, downloads). */
  @NotBlank private String staticAssetsFolderName = "static";

  /** Identifier of the entity cache (slug to content item or taxonomy). */
  private String cacheName = "content_cache";

  /** Identifier of the derived cache holding the built trees. */
  private String indexCacheName = "content_index_cache";

  /** Optional URL of a remote repository kept in sync with the content root. */
  private String remoteRepositoryUrl;

  /** Interval, in milliseconds, between rechecks of pending local file events. */
  private Integer recheckPendingFileEventsInterval;

  /**
   * Interval, in milliseconds, between rechecks of the remote repository. Required when {@link
   * #remoteRepositoryUrl} is set, and must then be larger than the file events interval.
   */
  private Integer recheckPendingRemoteEventsInterval;
}
