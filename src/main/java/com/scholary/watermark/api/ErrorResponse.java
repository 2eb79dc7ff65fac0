package com.scholary.watermark.api;

/** Error body. {@code parameter} and {@code reason} are set for parameter validation errors. */
public record ErrorResponse(String parameter, String reason, String message) {

  public static ErrorResponse of(String message) {
    return new ErrorResponse(null, null, message);
  }
}
