package com.merlt.orchestrator.feedback;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
public class EventPublishingRolloutController implements RolloutController {
    private static final Logger log = LoggerFactory.getLogger(EventPublishingRolloutController.class);

    private final ApplicationEventPublisher publisher;
    @Value("${merlt.feedback.rollout-threshold:50}")
    private int threshold = 50;

    public EventPublishingRolloutController(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void candidateReady(String weightSetId) {
        log.info("Weight set '{}' is ready for candidate rollout", weightSetId);
        this.publisher.publishEvent(new WeightSetCandidateReadyEvent(weightSetId, this.threshold, Instant.now()));
    }
}
