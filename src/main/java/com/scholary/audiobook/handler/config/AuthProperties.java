package com.scholary.audiobook.handler.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the bearer token sent with segment requests.
 *
 * <p>With no {@code token} set, requests carry no Authorization header. Failed token fetches back
 * off from {@code initialBackoff}, doubling up to {@code maxBackoff}.
 */
@ConfigurationProperties(prefix = "auth")
@Validated
public record AuthProperties(
    String token,
    @NotNull Duration tokenLifetime,
    @NotNull Duration refreshSkew,
    @NotNull Duration initialBackoff,
    @NotNull Duration maxBackoff) {}
