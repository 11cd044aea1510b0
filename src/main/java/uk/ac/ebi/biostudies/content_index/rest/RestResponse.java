package uk.ac.ebi.biostudies.content_index.rest;

import java.util.List;

public record RestResponse<T>(boolean success, String message, T data, List<ApiError> errors) {

  public static <T> RestResponse<T> success(String msg, T data) {
    return new RestResponse<>(true, msg, data, List.of());
  }

  public static <T> RestResponse<T> error(String msg, List<ApiError> errors) {
    return new RestResponse<>(false, msg, null, errors);
  }

  public static <T> RestResponse<T> notFound(String field, String message) {
    return error("Not found", List.of(ApiError.notFound(field, message)));
  }
}
