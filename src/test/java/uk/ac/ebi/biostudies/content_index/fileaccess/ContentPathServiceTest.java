package uk.ac.ebi.biostudies.content_index.fileaccess;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.ac.ebi.biostudies.content_index.config.ContentConfig;

@DisplayName("ContentPathService Tests")
class ContentPathServiceTest {

  private ContentConfig config;
  private ContentPathService service;

  @BeforeEach
  void setUp() {
    config = new ContentConfig();
    config.setRootPath("/srv/content/");
    config.setStaticAssetsFolderName("assets");
    service = new ContentPathService(config);
  }

  @Test
  @DisplayName("Should normalize the root path")
  void shouldNormalizeRootPath() {
    assertThat(service.rootPath()).isEqualTo("/srv/content");
    assertThat(service.staticAssetsPath()).isEqualTo("/srv/content/assets");
  }

  @Test
  @DisplayName("Should recognize static assets")
  void shouldRecognizeStaticAssets() {
    assertThat(service.isPathFromStaticAssets("/srv/content/assets/img/logo.png")).isTrue();
    assertThat(service.isPathFromStaticAssets("/srv/content/assets")).isTrue();
    assertThat(service.isPathFromStaticAssets("/srv/content/assets-old/post.md")).isFalse();
    assertThat(service.isPathFromStaticAssets("/srv/content/blog/post.md")).isFalse();
  }

  @Test
  @DisplayName("Should strip the root from content paths")
  void shouldStripRoot() {
    assertThat(service.toContentPath("/srv/content/blog/post.md")).isEqualTo("/blog/post.md");
    assertThat(service.toContentPath("/srv/content/blog/../about.md")).isEqualTo("/about.md");
  }

  @Test
  @DisplayName("Should reject paths outside the root")
  void shouldRejectPathsOutsideRoot() {
    assertThatThrownBy(() -> service.toContentPath("/srv/contents/post.md"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should fail when the root is not configured")
  void shouldFailWithoutRoot() {
    config.setRootPath(null);

    assertThatThrownBy(() -> service.rootPath()).isInstanceOf(IllegalStateException.class);
  }
}
