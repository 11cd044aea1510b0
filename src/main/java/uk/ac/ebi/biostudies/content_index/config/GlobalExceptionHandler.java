package uk.ac.ebi.biostudies.content_index.config;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import uk.ac.ebi.biostudies.content_index.exceptions.InvalidContentException;
import uk.ac.ebi.biostudies.content_index.rest.ApiError;
import uk.ac.ebi.biostudies.content_index.rest.RestResponse;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(InvalidContentException.class)
  public ResponseEntity<RestResponse<Void>> handleInvalidContent(InvalidContentException ex) {
    log.warn("Invalid content: {}", ex.getMessage());
    ApiError error = ApiError.badRequest(ex.getField(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(RestResponse.error("Invalid content", List.of(error)));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<RestResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    ApiError error = ApiError.badRequest(null, ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(RestResponse.error("Invalid request", List.of(error)));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<RestResponse<Void>> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    ApiError error = ApiError.badRequest(ex.getParameterName(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(RestResponse.error("Invalid request", List.of(error)));
  }

  // Catch-all for other exceptions
  @ExceptionHandler(Exception.class)
  public ResponseEntity<RestResponse<Void>> handleGeneric(Exception ex) {
    log.error("Unexpected error", ex);
    ApiError error = new ApiError("INTERNAL_ERROR", null, "Internal server error", 500);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(RestResponse.error("Operation failed", List.of(error)));
  }
}
