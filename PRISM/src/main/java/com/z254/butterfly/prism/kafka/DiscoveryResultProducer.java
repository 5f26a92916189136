package com.z254.butterfly.prism.kafka;

import com.z254.butterfly.prism.causal.CausalEdge;
import com.z254.butterfly.prism.causal.RootCauseCandidate;
import com.z254.butterfly.prism.config.PrismProperties;
import com.z254.butterfly.prism.rca.DiscoveryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Publishes discovery results to the root-cause topic, keyed by outcome variable.
 */
@Slf4j
@Component
public class DiscoveryResultProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final PrismProperties prismProperties;

    public DiscoveryResultProducer(KafkaTemplate<String, Object> kafkaTemplate,
                                   PrismProperties prismProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.prismProperties = prismProperties;
    }

    public void publish(DiscoveryResult result) {
        String topic = prismProperties.getKafka().getTopics().getRootCauses();
        DiscoveryResultMessage message = toMessage(result);

        kafkaTemplate.send(topic, result.getOutcomeVariable(), message)
                .whenComplete((sendResult, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish discovery result {} for {}: {}",
                                result.getPassId(), result.getOutcomeVariable(), ex.getMessage());
                    } else {
                        log.debug("Published discovery result {} to {}", result.getPassId(), topic);
                    }
                });
    }

    static DiscoveryResultMessage toMessage(DiscoveryResult result) {
        List<DiscoveryResultMessage.Edge> edges = new ArrayList<>();
        for (CausalEdge edge : result.getGraph().getEdges()) {
            edges.add(DiscoveryResultMessage.Edge.builder()
                    .from(edge.isDirected() ? edge.source() : edge.first())
                    .to(edge.isDirected() ? edge.target() : edge.second())
                    .directed(edge.isDirected())
                    .build());
        }

        List<DiscoveryResultMessage.RootCause> rootCauses = new ArrayList<>();
        int rank = 1;
        for (RootCauseCandidate candidate : result.getCandidates()) {
            rootCauses.add(DiscoveryResultMessage.RootCause.builder()
                    .rank(rank++)
                    .variable(candidate.getVariable())
                    .estimatedEffect(candidate.getEstimatedEffect())
                    .confidence(candidate.getConfidence())
                    .pathToOutcome(candidate.getPathToOutcome())
                    .build());
        }

        return DiscoveryResultMessage.builder()
                .passId(result.getPassId())
                .outcomeVariable(result.getOutcomeVariable())
                .snapshotVersion(result.getSnapshotVersion())
                .sampleSize(result.getSampleSize())
                .edges(edges)
                .rootCauses(rootCauses)
                .completedAt(result.getCompletedAt())
                .build();
    }
}
