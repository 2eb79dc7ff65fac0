package com.scholary.watermark.processor;

/**
 * Thrown when an overlay asset cannot be loaded.
 *
 * <p>Fatal to processor construction: no batch runs without its overlay.
 */
public class AssetLoadException extends RuntimeException {

  public AssetLoadException(String message) {
    super(message);
  }

  public AssetLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
