package com.scholary.audiobook.handler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AudiobookHandlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudiobookHandlerApplication.class, args);
  }
}
