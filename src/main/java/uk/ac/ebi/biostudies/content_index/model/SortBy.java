package uk.ac.ebi.biostudies.content_index.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Field used to order the content items of a taxonomy. */
public enum SortBy {
  TITLE("title"),
  DATE("date"),
  SLUG("slug"),
  ;

  private final String value;

  SortBy(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Lenient lookup used for user-provided metadata; unknown values yield empty. */
  public static Optional<SortBy> fromValue(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return Arrays.stream(values()).filter(s -> s.value.equalsIgnoreCase(text)).findFirst();
  }
}
