package com.scholary.watermark.processor;

/** Loads overlay images by location. */
public interface OverlayAssetLoader {

  /**
   * Load and decode an overlay.
   *
   * @param location resource location, e.g. {@code classpath:overlays/normal.png} or a file path
   * @return the decoded overlay
   * @throws AssetLoadException if the resource is missing or not a decodable image
   */
  OverlayAsset load(String location);
}
