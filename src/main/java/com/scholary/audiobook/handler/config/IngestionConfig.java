package com.scholary.audiobook.handler.config;

import com.scholary.audiobook.handler.ingest.FfmpegProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for ingestion-related beans.
 *
 * <p>Enables the IngestionProperties and FfmpegProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({IngestionProperties.class, FfmpegProperties.class})
public class IngestionConfig {}
