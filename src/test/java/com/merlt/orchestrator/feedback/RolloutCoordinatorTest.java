package com.merlt.orchestrator.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

class RolloutCoordinatorTest {

    @Test
    @DisplayName("Signals once per threshold and restarts the count")
    void signalsAtThreshold() {
        RolloutController controller = mock(RolloutController.class);
        RolloutCoordinator coordinator = new RolloutCoordinator(controller, 3);

        assertThat(coordinator.recordUpdate("gating")).isFalse();
        assertThat(coordinator.recordUpdate("gating")).isFalse();
        assertThat(coordinator.recordUpdate("gating")).isTrue();
        assertThat(coordinator.pendingUpdates("gating")).isZero();
        coordinator.recordUpdate("gating");

        verify(controller, times(1)).candidateReady("gating");
        assertThat(coordinator.pendingUpdates("gating")).isEqualTo(1);
    }

    @Test
    @DisplayName("Weight sets are counted independently")
    void independentSets() {
        RolloutController controller = mock(RolloutController.class);
        RolloutCoordinator coordinator = new RolloutCoordinator(controller, 2);
        coordinator.recordUpdate("gating");
        coordinator.recordUpdate("traversal.literal");
        verifyNoInteractions(controller);
    }

    @Test
    @DisplayName("Concurrent updates produce exactly one signal per threshold crossed")
    void concurrentUpdates() throws Exception {
        RolloutController controller = mock(RolloutController.class);
        RolloutCoordinator coordinator = new RolloutCoordinator(controller, 10);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                futures.add(pool.submit(() -> coordinator.recordUpdate("gating")));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        }
        finally {
            pool.shutdownNow();
        }
        verify(controller, times(10)).candidateReady("gating");
    }

    @Test
    @DisplayName("The event-publishing controller announces the candidate")
    void publishesEvent() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        new EventPublishingRolloutController(publisher).candidateReady("traversal.precedent");
        verify(publisher).publishEvent(any(WeightSetCandidateReadyEvent.class));
    }
}
