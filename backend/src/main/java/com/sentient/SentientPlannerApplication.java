package com.sentient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Sentient Planner backend.
 *
 * Hosts both pipeline stages in one process: the reflection stream consumer
 * that turns raw records into persisted plans, and the artifact worker that
 * back-fills each plan with its emotion canvas. Either stage can be switched
 * off through {@code app.stream.enabled} and {@code app.worker.enabled} so the
 * same artifact can be deployed as a dedicated worker.
 */
@SpringBootApplication
public class SentientPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentientPlannerApplication.class, args);
    }
}
