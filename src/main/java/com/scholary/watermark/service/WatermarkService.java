package com.scholary.watermark.service;

import com.scholary.watermark.batch.BatchExecutor;
import com.scholary.watermark.batch.BatchResult;
import com.scholary.watermark.batch.TaskHandler;
import com.scholary.watermark.config.VariantProperties;
import com.scholary.watermark.config.WatermarkProperties;
import com.scholary.watermark.logging.AsyncLogSink;
import com.scholary.watermark.logging.SinkHandle;
import com.scholary.watermark.logging.StructuredLogger;
import com.scholary.watermark.parameter.ParameterResolver;
import com.scholary.watermark.parameter.ResolvedParameters;
import com.scholary.watermark.processor.ProcessorFactory;
import com.scholary.watermark.processor.UnknownVariantException;
import com.scholary.watermark.processor.WatermarkProcessor;
import com.scholary.watermark.processor.WatermarkVariant;
import com.scholary.watermark.scan.ScanSummary;
import com.scholary.watermark.scan.TaskScanner;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for batch watermarking.
 *
 * <p>A batch runs in four steps:
 *
 * <ol>
 *   <li>Resolve and validate parameters against the variant's schema
 *   <li>Get the variant's processor and bind the parameters to it
 *   <li>Scan the input directory for eligible images
 *   <li>Run every image through the processor on the worker pool
 * </ol>
 *
 * <p>Steps 1 and 2 fail before anything is written. From step 4 on, a failing image only affects
 * its own outcome.
 */
@Service
public class WatermarkService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WatermarkService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final WatermarkProperties properties;
  private final ParameterResolver parameterResolver;
  private final ProcessorFactory processorFactory;
  private final TaskScanner taskScanner;
  private final BatchExecutor batchExecutor;
  private final AsyncLogSink asyncLogSink;

  public WatermarkService(
      WatermarkProperties properties,
      ParameterResolver parameterResolver,
      ProcessorFactory processorFactory,
      TaskScanner taskScanner,
      BatchExecutor batchExecutor,
      AsyncLogSink asyncLogSink) {
    this.properties = properties;
    this.parameterResolver = parameterResolver;
    this.processorFactory = processorFactory;
    this.taskScanner = taskScanner;
    this.batchExecutor = batchExecutor;
    this.asyncLogSink = asyncLogSink;
  }

  /**
   * Watermark every eligible image in {@code inputDir}.
   *
   * @param variant variant tag, e.g. {@code normal}
   * @param inputDir directory to read images from (not recursive)
   * @param outputDir directory to write results to; created if missing
   * @param overrides caller supplied parameter values
   * @return destination paths of the images that were written, in completion order
   * @throws com.scholary.watermark.parameter.ParameterValidationException if a parameter is
   *     missing or invalid
   * @throws com.scholary.watermark.batch.BatchSetupException if the directories or worker pool
   *     cannot be set up
   */
  public List<Path> processBatch(
      String variant, Path inputDir, Path outputDir, Map<String, ?> overrides) {
    return runBatch(WatermarkVariant.fromTag(variant), inputDir, outputDir, overrides)
        .successPaths();
  }

  /** Same as {@link #processBatch} but returns every outcome and the batch telemetry. */
  public BatchResult runBatch(
      WatermarkVariant variant, Path inputDir, Path outputDir, Map<String, ?> overrides) {
    String batchId = UUID.randomUUID().toString();
    StructuredLogger.setBatchContext(batchId, variant.tag());
    try {
      LOGGER.info(
          "Starting batch: variant={}, inputDir={}, outputDir={}",
          variant.tag(),
          inputDir,
          outputDir);

      VariantProperties config = variantConfig(variant);
      ResolvedParameters parameters =
          parameterResolver.resolve(config, overrides == null ? Map.of() : overrides);

      WatermarkProcessor<?> processor = processorFactory.get(variant);
      TaskHandler handler = processor.bind(parameters);

      ScanSummary scan = taskScanner.scan(inputDir, outputDir).collect();
      SinkHandle sink = asyncLogSink.handle();
      scan.skipped().forEach(entry -> structuredLogger.logFileSkipped(sink, entry));
      LOGGER.info("Scanned input: tasks={}, skipped={}", scan.tasks().size(), scan.skippedCount());

      return batchExecutor.run(scan.tasks(), handler);
    } finally {
      StructuredLogger.clearBatchContext();
    }
  }

  /** Defaults and parameter schema of every configured variant. */
  public List<VariantDescriptor> describeVariants() {
    return Arrays.stream(WatermarkVariant.values())
        .filter(variant -> properties.variants().containsKey(variant))
        .map(variant -> describe(variant, properties.variants().get(variant)))
        .toList();
  }

  private VariantProperties variantConfig(WatermarkVariant variant) {
    return properties
        .variant(variant)
        .orElseThrow(() -> new UnknownVariantException(variant.tag()));
  }

  private static VariantDescriptor describe(WatermarkVariant variant, VariantProperties config) {
    return new VariantDescriptor(
        variant.tag(),
        config.description(),
        config.outputHeight(),
        config.quality(),
        config.opacity(),
        config.enhancement(),
        config.params());
  }
}
