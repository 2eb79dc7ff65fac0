package com.scholary.watermark.processor;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads overlays through Spring's {@link ResourceLoader}, so {@code classpath:}, {@code file:}
 * and plain paths all work.
 */
@Component
public class ResourceOverlayAssetLoader implements OverlayAssetLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceOverlayAssetLoader.class);

  private final ResourceLoader resourceLoader;

  public ResourceOverlayAssetLoader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
  }

  @Override
  public OverlayAsset load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new AssetLoadException("Overlay asset not found: " + location);
    }

    BufferedImage image;
    try (InputStream in = resource.getInputStream()) {
      image = ImageIO.read(in);
    } catch (IOException e) {
      throw new AssetLoadException("Failed to read overlay asset: " + location, e);
    }
    if (image == null) {
      throw new AssetLoadException("Overlay asset is not a supported image: " + location);
    }

    LOGGER.info(
        "Loaded overlay asset: location={}, size={}x{}",
        location,
        image.getWidth(),
        image.getHeight());
    return new OverlayAsset(location, image);
  }
}
