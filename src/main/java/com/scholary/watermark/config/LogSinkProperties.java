package com.scholary.watermark.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the durable batch log.
 *
 * <p>{@code channel} is the logger name the sink attaches its appenders to. It is not additive, so
 * batch events only reach the file and console configured here.
 */
@ConfigurationProperties(prefix = "watermark.log")
@Validated
public record LogSinkProperties(
    @NotBlank String file,
    @NotBlank String pattern,
    @Positive int queueSize,
    boolean console,
    @NotBlank String channel,
    @NotBlank String level) {}
