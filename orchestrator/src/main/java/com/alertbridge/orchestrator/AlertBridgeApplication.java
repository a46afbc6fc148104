package com.alertbridge.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * To run against the in-memory tracker with heuristic extraction:
 *   mvn -pl orchestrator spring-boot:run
 *
 * To run against real services:
 *   ANTHROPIC_API_KEY=sk-ant-... JIRA_API_TOKEN=... \
 *     mvn -pl orchestrator spring-boot:run -Dspring-boot.run.profiles=live
 */
@SpringBootApplication
public class AlertBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertBridgeApplication.class, args);
    }
}
