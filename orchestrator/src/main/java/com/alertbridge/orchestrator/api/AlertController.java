package com.alertbridge.orchestrator.api;

import com.alertbridge.orchestrator.api.dto.RunResponse;
import com.alertbridge.orchestrator.api.dto.SubmitAlertRequest;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.TicketingOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST entry point for inbound alerts.
 *
 * POST /alerts   run the workflow for one message and return its outcome
 *
 * The call is synchronous: the response is sent once the run has reached
 * END, including any backoff waits. Rejections and failed runs are still
 * HTTP 200; the body says what happened.
 */
@RestController
@RequestMapping("/alerts")
public class AlertController {

    private final TicketingOrchestrator orchestrator;

    public AlertController(TicketingOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/alerts \
     *     -H "Content-Type: application/json" \
     *     -d '{"message":"Triggered: High number of errors in RUM ...","channel":"servicecore-mobile-errors"}'
     */
    @PostMapping
    public RunResponse submit(@RequestBody SubmitAlertRequest req) {
        if (req.message() == null || req.message().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        if (req.channel() == null || req.channel().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "channel is required");
        }
        WorkflowState state = orchestrator.run(req.message(), req.channel());
        return RunResponse.from(state);
    }
}
