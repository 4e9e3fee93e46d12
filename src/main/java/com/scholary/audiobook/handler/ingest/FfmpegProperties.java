package com.scholary.audiobook.handler.ingest;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>Segments are concatenated with stream copy, so the only knobs are which binary to run and how
 * long a single concatenation may take before it is killed.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(@NotBlank String binary, @NotNull Duration concatTimeout) {}
