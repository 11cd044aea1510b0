package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A taxonomy node is normally a category ({@link #TAXONOMY}); it is a {@link #POST} when it acts
 * as a content reference, e.g. a category's own descriptive page.
 */
public enum TaxonomyType {
  TAXONOMY("taxonomy"),
  POST("post"),
  ;

  private final String value;

  TaxonomyType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
