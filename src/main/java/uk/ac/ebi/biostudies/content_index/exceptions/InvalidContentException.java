package uk.ac.ebi.biostudies.content_index.exceptions;

/**
 * Umbrella exception for content records that cannot be constructed from their parsed fields.
 *
 * <p>Raised when a required field (title, file path, date) is missing or a field holds a value of
 * the wrong shape. Callers feeding parsed files can catch this single type and skip the file.
 */
public class InvalidContentException extends RuntimeException {

  private final String field;

  public InvalidContentException(String field, String message) {
    super(message);
    this.field = field;
  }

  public InvalidContentException(String field, String message, Throwable cause) {
    super(message, cause);
    this.field = field;
  }

  /** Name of the offending field, or null when the whole record is at fault. */
  public String getField() {
    return field;
  }
}
