package uk.ac.ebi.biostudies.content_index;

/**
 * A utility class holding application-wide constant values used across the content index service.
 * This class is non-instantiable.
 */
public final class Constants {

  /** Slug of the root taxonomy. Every non-root taxonomy lists it first among its parents. */
  public static final String ROOT_SLUG = "/";

  /** Path and slug separator. */
  public static final String PATH_SEPARATOR = "/";

  /**
   * File name (without extension) of a taxonomy's own descriptive item. A file with this name
   * describes the folder it lives in instead of being listed inside it.
   */
  public static final String INDEX_FILE_NAME = "_index";

  // Metadata keys an index item may use to configure its taxonomy
  public static final String SORT_BY_METADATA = "sort_by";
  public static final String SORT_ORDER_METADATA = "sort_order";
  public static final String CUSTOM_TYPE_METADATA = "custom_type";

  // Field names accepted by the content item factory
  public static final String TITLE_FIELD = "title";
  public static final String SUMMARY_FIELD = "summary";
  public static final String CONTENT_FIELD = "content";
  public static final String TYPE_FIELD = "type";
  public static final String DATE_FIELD = "date";
  public static final String PUBLISHED_FIELD = "is_published";
  public static final String POSITION_FIELD = "position";
  public static final String METADATA_FIELD = "metadata";

  // Private constructor to prevent instantiation
  private Constants() {
    throw new UnsupportedOperationException("Constants class cannot be instantiated");
  }
}
