package com.fixforge.core.metrics;

import com.fixforge.core.model.FixState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task and fix execution.
 */
@Service
public class FixforgeMetrics {

    private final MeterRegistry registry;

    public FixforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskCreated() {
        Counter.builder("fixforge.tasks.created")
                .register(registry)
                .increment();
    }

    public void recordCloneResult(boolean success) {
        Counter.builder("fixforge.clone.total")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordReviewResult(boolean success) {
        Counter.builder("fixforge.review.total")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records the state a fix attempt stopped in and how long it ran.
     *
     * @param finalState the attempt's state when it returned (DIFF_READY for a checkpoint stop)
     * @param ms         wall-clock duration
     */
    public void recordFixResult(FixState finalState, long ms) {
        Counter.builder("fixforge.fix.total")
                .tag("state", finalState.value())
                .register(registry)
                .increment();
        Timer.builder("fixforge.fix.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDroppedEvent() {
        Counter.builder("fixforge.events.dropped")
                .description("Events discarded because a subscriber buffer was full")
                .register(registry)
                .increment();
    }
}
