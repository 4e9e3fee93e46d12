package com.scholary.audiobook.handler.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for playback sessions.
 *
 * <p>These map to the "playback.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "playback")
@Validated
public record PlaybackProperties(
    @NotBlank String positionFile,
    @NotNull Duration saveInterval,
    @NotNull Duration errorSkipDelay,
    @NotNull Duration skipInterval) {}
