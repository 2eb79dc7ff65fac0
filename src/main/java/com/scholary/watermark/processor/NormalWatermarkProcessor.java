package com.scholary.watermark.processor;

import com.scholary.watermark.batch.BatchTelemetry;
import com.scholary.watermark.compositing.Compositor;
import com.scholary.watermark.parameter.ResolvedParameters;
import com.scholary.watermark.scan.Task;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Plain watermark: scale the image to the output height, lay the overlay over the top-left corner
 * at the configured opacity and save at the configured quality.
 */
public class NormalWatermarkProcessor extends WatermarkProcessor<NormalParams> {

  public NormalWatermarkProcessor(OverlayAsset overlay) {
    super(overlay);
  }

  @Override
  public WatermarkVariant variant() {
    return WatermarkVariant.NORMAL;
  }

  @Override
  public NormalParams validate(ResolvedParameters parameters) {
    return new NormalParams(
        parameters.opacity(), parameters.outputHeight(), parameters.quality());
  }

  @Override
  public void process(Task task, NormalParams parameters, BatchTelemetry telemetry)
      throws IOException {
    BufferedImage source = decode(task, telemetry);
    BufferedImage resized =
        telemetry.time(
            OPERATION_RESIZE, () -> Compositor.resize(source, parameters.outputHeight()));
    BufferedImage watermarked =
        telemetry.time(
            OPERATION_COMPOSITE,
            () -> Compositor.overlayAndCrop(resized, overlay.image(), parameters.opacity()));
    encode(task, watermarked, parameters.quality(), telemetry);
  }
}
