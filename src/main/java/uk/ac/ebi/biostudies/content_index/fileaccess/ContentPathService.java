package uk.ac.ebi.biostudies.content_index.fileaccess;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.content_index.Constants;
import uk.ac.ebi.biostudies.content_index.config.ContentConfig;

/**
 * Resolves content file locations against the configured content root.
 *
 * <p>Watchers report absolute file paths; slugs and category chains are derived from paths
 * relative to the root, so every path passes through {@link #toContentPath(String)} first.
 */
@Slf4j
@Service
public class ContentPathService {

  private final ContentConfig contentConfig;

  public ContentPathService(ContentConfig contentConfig) {
    this.contentConfig = contentConfig;
  }

  /** The configured content root, without trailing separator. */
  public String rootPath() {
    String root = contentConfig.getRootPath();
    if (StringUtils.isBlank(root)) {
      throw new IllegalStateException("Config rootPath is not set");
    }
    return StringUtils.removeEnd(Paths.get(root).normalize().toString(), Constants.PATH_SEPARATOR);
  }

  /** Absolute path of the static assets folder. */
  public String staticAssetsPath() {
    return Path.of(rootPath(), contentConfig.getStaticAssetsFolderName()).toString();
  }

  /**
   * Checks whether a file belongs to the static assets folder. Such files are served as-is and
   * never become content items.
   */
  public boolean isPathFromStaticAssets(String path) {
    String assets = staticAssetsPath();
    return path.equals(assets) || path.startsWith(assets + Constants.PATH_SEPARATOR);
  }

  /**
   * Strips the content root from an absolute file path.
   *
   * @param path absolute path under the content root
   * @return slash-rooted path relative to the content root
   * @throws IllegalArgumentException if the path is not under the content root
   */
  public String toContentPath(String path) {
    String root = rootPath();
    String normalized = Paths.get(path).normalize().toString();
    if (!normalized.startsWith(root + Constants.PATH_SEPARATOR)) {
      throw new IllegalArgumentException("Path " + path + " is not under content root " + root);
    }
    String relative = normalized.substring(root.length());
    log.debug("Resolved content path {} -> {}", path, relative);
    return relative;
  }
}
