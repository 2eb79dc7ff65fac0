package com.scholary.watermark.processor;

/** Thrown when a variant tag is not registered or has no configuration. */
public class UnknownVariantException extends RuntimeException {

  private final String variant;

  public UnknownVariantException(String variant) {
    super("Unknown watermark variant: " + variant);
    this.variant = variant;
  }

  public String getVariant() {
    return variant;
  }
}
