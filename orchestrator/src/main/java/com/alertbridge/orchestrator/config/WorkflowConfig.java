package com.alertbridge.orchestrator.config;

import com.alertbridge.orchestrator.extraction.ClaudeClient;
import com.alertbridge.orchestrator.extraction.ClaudeExtractionService;
import com.alertbridge.orchestrator.extraction.ExtractionPrompts;
import com.alertbridge.orchestrator.extraction.ExtractionService;
import com.alertbridge.orchestrator.extraction.HeuristicExtractionService;
import com.alertbridge.orchestrator.ticket.InMemoryTicketSystemClient;
import com.alertbridge.orchestrator.ticket.JiraRestClient;
import com.alertbridge.orchestrator.ticket.TicketSystemClient;
import com.alertbridge.orchestrator.workflow.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the two integrations by {@code alertbridge.extraction.provider} and
 * {@code alertbridge.ticket-system.provider}. Everything else in the workflow
 * is a component configured from {@link AlertBridgeProperties}.
 */
@Configuration
@EnableConfigurationProperties(AlertBridgeProperties.class)
public class WorkflowConfig {

    // ------------------------------------------------------------------
    // Integrations
    // ------------------------------------------------------------------

    @Bean
    @ConditionalOnProperty(name = "alertbridge.extraction.provider", havingValue = "claude")
    ExtractionService claudeExtractionService(AlertBridgeProperties props, ObjectMapper objectMapper) {
        AlertBridgeProperties.Extraction cfg = props.extraction();
        if (cfg.apiKey().isBlank()) {
            throw new IllegalStateException(
                    "alertbridge.extraction.api-key is required when the claude provider is selected");
        }
        ClaudeClient claude = new ClaudeClient(cfg.apiUrl(), cfg.apiKey(), cfg.timeout(), objectMapper);
        return new ClaudeExtractionService(claude,
                new ExtractionPrompts(props.completeness().requiredLabels()), objectMapper, cfg.model());
    }

    @Bean
    @ConditionalOnProperty(name = "alertbridge.extraction.provider", havingValue = "heuristic", matchIfMissing = true)
    ExtractionService heuristicExtractionService(AlertBridgeProperties props) {
        return new HeuristicExtractionService(props.extraction().defaultLabels());
    }

    @Bean
    @ConditionalOnProperty(name = "alertbridge.ticket-system.provider", havingValue = "jira")
    TicketSystemClient jiraTicketSystemClient(AlertBridgeProperties props, ObjectMapper objectMapper) {
        AlertBridgeProperties.TicketSystem cfg = props.ticketSystem();
        return new JiraRestClient(cfg.baseUrl(), cfg.username(), cfg.apiToken(),
                props.creation().projectKey(), props.creation().issueType(), cfg.timeout(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "alertbridge.ticket-system.provider", havingValue = "in-memory", matchIfMissing = true)
    TicketSystemClient inMemoryTicketSystemClient(AlertBridgeProperties props) {
        AlertBridgeProperties.TicketSystem cfg = props.ticketSystem();
        return new InMemoryTicketSystemClient(props.creation().projectKey(), cfg.baseUrl(), cfg.failureRate());
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
