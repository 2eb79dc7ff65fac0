package com.scholary.watermark.processor;

import com.scholary.watermark.batch.BatchTelemetry;
import com.scholary.watermark.batch.TaskHandler;
import com.scholary.watermark.compositing.ImageCodec;
import com.scholary.watermark.parameter.ResolvedParameters;
import com.scholary.watermark.scan.Task;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Base class for variant processors.
 *
 * <p>A processor owns one overlay asset and turns resolved batch parameters into its own typed
 * parameter object {@code P}. The executor never sees {@code P}: {@link #bind} validates once and
 * returns a {@link TaskHandler} closed over the typed parameters.
 *
 * @param <P> the variant's parameter type
 */
public abstract class WatermarkProcessor<P> {

  public static final String OPERATION_DECODE = "decode";
  public static final String OPERATION_RESIZE = "resize";
  public static final String OPERATION_REENCODE = "reencode";
  public static final String OPERATION_COMPOSITE = "composite";
  public static final String OPERATION_ENCODE = "encode";

  protected final OverlayAsset overlay;

  protected WatermarkProcessor(OverlayAsset overlay) {
    this.overlay = overlay;
  }

  public abstract WatermarkVariant variant();

  /**
   * Convert resolved parameters into this variant's parameter type.
   *
   * @throws com.scholary.watermark.parameter.ParameterValidationException if a value is unusable
   *     for this variant
   */
  public abstract P validate(ResolvedParameters parameters);

  /** Watermark one image and write it to the task's destination. */
  public abstract void process(Task task, P parameters, BatchTelemetry telemetry)
      throws IOException;

  /** Validate once, then hand out a handler that reuses the typed parameters for every task. */
  public TaskHandler bind(ResolvedParameters parameters) {
    P typed = validate(parameters);
    return (task, telemetry) -> process(task, typed, telemetry);
  }

  public OverlayAsset overlay() {
    return overlay;
  }

  protected BufferedImage decode(Task task, BatchTelemetry telemetry) throws IOException {
    return telemetry.time(OPERATION_DECODE, () -> ImageCodec.read(task.sourcePath()));
  }

  protected void encode(Task task, BufferedImage image, int quality, BatchTelemetry telemetry)
      throws IOException {
    telemetry.time(
        OPERATION_ENCODE,
        () -> {
          ImageCodec.write(image, task.destinationPath(), quality);
          return null;
        });
  }
}
