package com.scholary.watermark.processor;

import com.scholary.watermark.batch.BatchTelemetry;
import com.scholary.watermark.compositing.BlendMode;
import com.scholary.watermark.compositing.Compositor;
import com.scholary.watermark.parameter.ParameterValidationException;
import com.scholary.watermark.parameter.ResolvedParameters;
import com.scholary.watermark.scan.Task;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Foggy watermark.
 *
 * <p>The image is scaled and then compressed at a low quality before the overlay goes on, so the
 * overlay stays crisp over a deliberately degraded picture. The result is written at full quality
 * to avoid compressing twice.
 *
 * <p>With {@code enhancement} on, the overlay is brightened against the image
 * ({@link BlendMode#LUMINANCE_BOOST}); otherwise it is blended at the configured opacity.
 */
public class FoggyWatermarkProcessor extends WatermarkProcessor<FoggyParams> {

  public static final String BOOST_RATIO = "boost_ratio";
  public static final double DEFAULT_BOOST_RATIO = 1.2;
  public static final int OUTPUT_QUALITY = 100;

  public FoggyWatermarkProcessor(OverlayAsset overlay) {
    super(overlay);
  }

  @Override
  public WatermarkVariant variant() {
    return WatermarkVariant.FOGGY;
  }

  @Override
  public FoggyParams validate(ResolvedParameters parameters) {
    double boostRatio = parameters.extraDouble(BOOST_RATIO, DEFAULT_BOOST_RATIO);
    if (Double.isNaN(boostRatio) || boostRatio <= 0.0) {
      throw ParameterValidationException.outOfRange(BOOST_RATIO, boostRatio, 0, null);
    }
    return new FoggyParams(
        parameters.opacity(),
        parameters.outputHeight(),
        parameters.quality(),
        BlendMode.forEnhancement(parameters.enhancement()),
        boostRatio);
  }

  @Override
  public void process(Task task, FoggyParams parameters, BatchTelemetry telemetry)
      throws IOException {
    BufferedImage source = decode(task, telemetry);
    BufferedImage degraded =
        telemetry.time(
            OPERATION_REENCODE,
            () ->
                Compositor.resizeAndReencode(
                    source, parameters.outputHeight(), parameters.quality()));
    BufferedImage watermarked =
        telemetry.time(OPERATION_COMPOSITE, () -> composite(degraded, parameters));
    encode(task, watermarked, OUTPUT_QUALITY, telemetry);
  }

  private BufferedImage composite(BufferedImage base, FoggyParams parameters) {
    return switch (parameters.blendMode()) {
      case LUMINANCE_BOOST ->
          Compositor.enhanceBrightness(
              base, overlay.image(), parameters.boostRatio(), parameters.opacity());
      case ALPHA_OVERLAY -> Compositor.overlayAndCrop(base, overlay.image(), parameters.opacity());
    };
  }
}
