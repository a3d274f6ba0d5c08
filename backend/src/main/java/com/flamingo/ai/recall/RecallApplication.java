package com.flamingo.ai.recall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Entry point for the long-term memory engine. */
@SpringBootApplication
@EnableScheduling
public class RecallApplication {

  public static void main(String[] args) {
    SpringApplication.run(RecallApplication.class, args);
  }
}
