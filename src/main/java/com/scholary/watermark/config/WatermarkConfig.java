package com.scholary.watermark.config;

import com.scholary.watermark.batch.BatchExecutor;
import com.scholary.watermark.logging.AsyncLogSink;
import com.scholary.watermark.scan.TaskScanner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for batch processing beans.
 *
 * <p>The executor builds its worker pool per batch, so only its bounds are fixed here.
 */
@Configuration
@EnableConfigurationProperties(WatermarkProperties.class)
public class WatermarkConfig {

  @Bean
  public TaskScanner taskScanner(WatermarkProperties properties) {
    return new TaskScanner(properties.batch().supportedExtensions());
  }

  @Bean
  public BatchExecutor batchExecutor(AsyncLogSink asyncLogSink, WatermarkProperties properties) {
    WatermarkProperties.BatchProperties batch = properties.batch();
    return new BatchExecutor(asyncLogSink, batch.maxParallelism(), batch.flushTimeout());
  }
}
