package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Direction applied on top of {@link SortBy}. */
public enum SortOrder {
  ASC("asc"),
  DESC("desc"),
  ;

  private final String value;

  SortOrder(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Lenient lookup used for user-provided metadata; unknown values yield empty. */
  public static Optional<SortOrder> fromValue(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return Arrays.stream(values()).filter(s -> s.value.equalsIgnoreCase(text)).findFirst();
  }
}
