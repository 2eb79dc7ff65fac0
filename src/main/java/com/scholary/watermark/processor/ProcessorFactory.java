package com.scholary.watermark.processor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.watermark.config.VariantProperties;
import com.scholary.watermark.config.WatermarkProperties;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates processors by variant.
 *
 * <p>Construction loads the variant's overlay, so each processor is built once and cached. A
 * failed load is not cached; the next request tries again.
 */
@Component
public class ProcessorFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessorFactory.class);

  private final Map<WatermarkVariant, Function<OverlayAsset, WatermarkProcessor<?>>> constructors =
      new EnumMap<>(WatermarkVariant.class);

  private final WatermarkProperties properties;
  private final OverlayAssetLoader assetLoader;
  private final Cache<WatermarkVariant, WatermarkProcessor<?>> processors;

  public ProcessorFactory(WatermarkProperties properties, OverlayAssetLoader assetLoader) {
    this.properties = properties;
    this.assetLoader = assetLoader;
    this.processors =
        Caffeine.newBuilder().maximumSize(WatermarkVariant.values().length).build();

    constructors.put(WatermarkVariant.NORMAL, NormalWatermarkProcessor::new);
    constructors.put(WatermarkVariant.FOGGY, FoggyWatermarkProcessor::new);
  }

  /**
   * Get the processor for a variant, creating it on first use.
   *
   * @throws UnknownVariantException if the variant has no constructor or no configuration
   * @throws AssetLoadException if the variant's overlay cannot be loaded
   */
  public WatermarkProcessor<?> get(WatermarkVariant variant) {
    return processors.get(variant, this::create);
  }

  private WatermarkProcessor<?> create(WatermarkVariant variant) {
    Function<OverlayAsset, WatermarkProcessor<?>> constructor = constructors.get(variant);
    VariantProperties config =
        properties
            .variant(variant)
            .orElseThrow(() -> new UnknownVariantException(variant.tag()));
    if (constructor == null) {
      throw new UnknownVariantException(variant.tag());
    }

    OverlayAsset overlay = assetLoader.load(config.overlayAsset());
    WatermarkProcessor<?> processor = constructor.apply(overlay);
    LOGGER.info(
        "Created processor: variant={}, overlay={}", variant.tag(), overlay.location());
    return processor;
  }
}
