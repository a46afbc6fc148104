package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.config.AlertBridgeProperties;
import com.alertbridge.orchestrator.model.AlertSource;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Gatekeeper: only Datadog alerts posted to the monitoring channel get through.
 *
 * Source detection looks at the message alone (any configured marker,
 * case-insensitive); the channel check is applied on top of it.
 */
@Component
public class SourceValidator implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(SourceValidator.class);

    private final String       expectedChannel;
    private final List<String> markers;

    @Autowired
    public SourceValidator(AlertBridgeProperties props) {
        this(props.source().channel(), props.source().markers());
    }

    public SourceValidator(String expectedChannel, List<String> markers) {
        this.expectedChannel = expectedChannel;
        this.markers = markers.stream()
                .map(m -> m.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.VALIDATING;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        AlertSource source = detectSource(state.getRawMessage());
        boolean valid = source == AlertSource.DATADOG && expectedChannel.equals(state.getChannel());
        state.recordSourceValidation(source, valid);

        if (!valid) {
            log.info("Rejecting message: source={} channel='{}' (expected '{}')",
                    source.label(), state.getChannel(), expectedChannel);
            return StepOutcome.REJECTED;
        }
        return StepOutcome.SUCCESS;
    }

    public AlertSource detectSource(String rawMessage) {
        String haystack = rawMessage == null ? "" : rawMessage.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (haystack.contains(marker)) {
                return AlertSource.DATADOG;
            }
        }
        return AlertSource.UNKNOWN;
    }

    public String expectedChannel() {
        return expectedChannel;
    }
}
