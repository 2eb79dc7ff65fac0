package com.scholary.watermark.config;

import com.scholary.watermark.logging.AsyncLogSink;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the process-wide batch log channel.
 *
 * <p>The sink is built once at startup and injected into every component that emits batch events.
 * It is shut down explicitly when the context closes.
 */
@Configuration
@EnableConfigurationProperties(LogSinkProperties.class)
public class LoggingConfig {

  @Bean(destroyMethod = "shutdown")
  public AsyncLogSink asyncLogSink(LogSinkProperties properties) {
    return new AsyncLogSink(properties).start();
  }
}
