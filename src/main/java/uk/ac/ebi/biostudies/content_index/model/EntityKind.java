package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Kinds of entity held by the entity store. Content items and taxonomy nodes share one slug
 * keyspace, so the kind is what tells them apart.
 */
public enum EntityKind {
  CONTENT_ITEM("content_item"),
  TAXONOMY("taxonomy"),
  ;

  private final String value;

  EntityKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Resolves a kind from its wire value or constant name, ignoring case.
   *
   * @param value the kind name, e.g. "taxonomy" or "CONTENT_ITEM"
   * @return the matching kind
   * @throws IllegalArgumentException if no kind matches
   */
  public static EntityKind fromValue(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown entity kind: " + value));
  }
}
