package uk.ac.ebi.biostudies.content_index.config;

public interface ContentConfigValidator {
  /**
   * Validates the startup configuration and extracts the values the stores are built from.
   *
   * @param config the bound configuration (not null)
   * @return the validated startup values
   * @throws IllegalStateException if any validation error is found; the error is fatal
   */
  StartupConfig validateAndGetStartupConfig(ContentConfig config);
}
