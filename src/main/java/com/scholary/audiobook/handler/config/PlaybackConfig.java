package com.scholary.audiobook.handler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.handler.auth.CachingTokenProvider;
import com.scholary.audiobook.handler.auth.ConfiguredTokenSource;
import com.scholary.audiobook.handler.auth.TokenProvider;
import com.scholary.audiobook.handler.playback.JsonFilePositionStore;
import com.scholary.audiobook.handler.playback.PositionStore;
import java.nio.file.Paths;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for playback: where the position is kept and, when a token is configured, how it
 * is handed out.
 */
@Configuration
@EnableConfigurationProperties({PlaybackProperties.class, AuthProperties.class})
public class PlaybackConfig {

  @Bean
  public PositionStore positionStore(PlaybackProperties properties, ObjectMapper objectMapper) {
    return new JsonFilePositionStore(Paths.get(properties.positionFile()), objectMapper);
  }

  @Bean
  @ConditionalOnProperty(prefix = "auth", name = "token")
  public TokenProvider tokenProvider(AuthProperties properties, Clock clock) {
    return new CachingTokenProvider(
        new ConfiguredTokenSource(properties.token(), properties.tokenLifetime(), clock),
        clock,
        properties.refreshSkew(),
        properties.initialBackoff(),
        properties.maxBackoff());
  }
}
