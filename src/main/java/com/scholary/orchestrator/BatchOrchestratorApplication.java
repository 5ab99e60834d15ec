package com.scholary.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the batch orchestrator service.
 *
 * <p>Runs batches of slow, rate-limited remote calls with bounded concurrency, retries and
 * persisted results. Jobs are submitted and polled over REST.
 */
@SpringBootApplication
public class BatchOrchestratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(BatchOrchestratorApplication.class, args);
  }
}
