package com.scholary.watermark.processor;

import java.util.Locale;

/** The configured watermark styles. */
public enum WatermarkVariant {
  NORMAL,
  FOGGY;

  /** Lower-case tag used in configuration keys and request paths. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Look up a variant by its tag, ignoring case.
   *
   * @throws UnknownVariantException if no variant has this tag
   */
  public static WatermarkVariant fromTag(String tag) {
    if (tag != null) {
      for (WatermarkVariant variant : values()) {
        if (variant.tag().equalsIgnoreCase(tag.trim())) {
          return variant;
        }
      }
    }
    throw new UnknownVariantException(tag);
  }
}
