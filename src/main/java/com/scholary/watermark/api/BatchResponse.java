package com.scholary.watermark.api;

import com.scholary.watermark.batch.BatchResult;
import java.util.List;

/** Summary of a finished batch. */
public record BatchResponse(
    String variant, int successCount, int failureCount, List<String> outputs) {

  public static BatchResponse from(String variant, BatchResult result) {
    return new BatchResponse(
        variant,
        result.successCount(),
        result.failureCount(),
        result.successPaths().stream().map(String::valueOf).toList());
  }
}
