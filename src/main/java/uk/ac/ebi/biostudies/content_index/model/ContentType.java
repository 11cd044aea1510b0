package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Type of a content item. {@link #INDEX} items describe their taxonomy instead of being listed. */
public enum ContentType {
  POST("post"),
  PAGE("page"),
  INDEX("index"),
  ;

  private final String value;

  ContentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public static ContentType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown content type: " + value));
  }
}
