package com.scholary.watermark.api;

import com.scholary.watermark.batch.BatchSetupException;
import com.scholary.watermark.parameter.ParameterValidationException;
import com.scholary.watermark.processor.AssetLoadException;
import com.scholary.watermark.processor.UnknownVariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps batch errors to HTTP responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ParameterValidationException.class)
  public ResponseEntity<ErrorResponse> handleValidation(ParameterValidationException e) {
    LOGGER.warn(
        "Rejected batch parameters: parameter={}, reason={}", e.getParameter(), e.getFailure());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse(e.getParameter(), e.getFailure().name(), e.getMessage()));
  }

  @ExceptionHandler(UnknownVariantException.class)
  public ResponseEntity<ErrorResponse> handleUnknownVariant(UnknownVariantException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(BatchSetupException.class)
  public ResponseEntity<ErrorResponse> handleSetup(BatchSetupException e) {
    LOGGER.warn("Batch setup failed: {}", e.getMessage());
    return ResponseEntity.unprocessableEntity().body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(AssetLoadException.class)
  public ResponseEntity<ErrorResponse> handleAsset(AssetLoadException e) {
    LOGGER.error("Overlay asset unavailable", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of(e.getMessage()));
  }
}
