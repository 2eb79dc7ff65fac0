package com.scholary.watermark.parameter;

/** Why a parameter was rejected. */
public enum ValidationFailure {
  MISSING_PARAMETER,
  TYPE_MISMATCH,
  INVALID_OPTION,
  OUT_OF_RANGE
}
