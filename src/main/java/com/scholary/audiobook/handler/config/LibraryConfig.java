package com.scholary.audiobook.handler.config;

import com.scholary.audiobook.handler.auth.TokenProvider;
import com.scholary.audiobook.handler.catalog.CatalogClient;
import com.scholary.audiobook.handler.catalog.LibraryService;
import com.scholary.audiobook.handler.retry.RetryScheduler;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the library side: the refresh service and the scheduler its retries run on.
 */
@Configuration
@EnableConfigurationProperties(LibraryProperties.class)
public class LibraryConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "libraryExecutor", destroyMethod = "shutdownNow")
  public ScheduledExecutorService libraryExecutor(LibraryProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newScheduledThreadPool(
        properties.executorThreads(),
        runnable -> {
          Thread thread = new Thread(runnable, "library-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  public RetryScheduler retryScheduler(
      @Qualifier("libraryExecutor") ScheduledExecutorService libraryExecutor) {
    return new RetryScheduler(libraryExecutor);
  }

  @Bean
  public LibraryService libraryService(
      CatalogClient catalogClient,
      ObjectProvider<TokenProvider> tokenProvider,
      RetryScheduler retryScheduler,
      LibraryProperties properties,
      Clock clock) {
    return new LibraryService(
        catalogClient,
        tokenProvider.getIfAvailable(),
        retryScheduler,
        properties.refresh().toPolicy(),
        clock);
  }
}
