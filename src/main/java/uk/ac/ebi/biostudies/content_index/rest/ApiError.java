package uk.ac.ebi.biostudies.content_index.rest;

public record ApiError(String code, String field, String message, Integer httpStatus) {

  public static ApiError notFound(String field, String message) {
    return new ApiError("NOT_FOUND", field, message, 404);
  }

  public static ApiError badRequest(String field, String message) {
    return new ApiError("BAD_REQUEST", field, message, 400);
  }
}
