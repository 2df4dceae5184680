package com.fixforge.core.events;

import com.fixforge.core.metrics.FixforgeMetrics;
import com.fixforge.core.model.FixState;
import com.fixforge.core.model.TaskState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(Runnable::run, 16, null);
    }

    // -- FixforgeEvent record tests -------------------------------------------

    @Nested
    @DisplayName("FixforgeEvent")
    class FixforgeEventTests {

        @Test
        @DisplayName("task status carries state and message")
        void taskStatusPayload() {
            var event = FixforgeEvent.taskStatus("1", TaskState.CLONING, "Cloning repo");

            assertEquals(FixforgeEvent.TASK_STATUS, event.eventType());
            assertEquals("1", event.channel());
            assertEquals("cloning", event.payload().get("state"));
            assertEquals("Cloning repo", event.payload().get("message"));
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("standalone fix events route by workflow id")
        void standaloneChannel() {
            var event = FixforgeEvent.fixStatus(null, "fix-9", FixState.BRANCHING, "branch");

            assertEquals("fix-9", event.channel());
            assertEquals("branching", event.payload().get("state"));
        }

        @Test
        @DisplayName("payload is copied on construction")
        void payloadCopied() {
            var payload = new java.util.HashMap<String, Object>();
            payload.put("line", "a");
            var event = new FixforgeEvent(FixforgeEvent.TASK_OUTPUT, "1", null, payload, Instant.now());
            payload.put("line", "b");

            assertEquals("a", event.payload().get("line"));
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversToTaskSubscriber() {
            List<FixforgeEvent> received = new ArrayList<>();
            eventBus.subscribe("1", received::add);

            eventBus.publish(FixforgeEvent.taskOutput("1", "hello"));

            assertEquals(1, received.size());
            assertEquals("hello", received.get(0).payload().get("line"));
        }

        @Test
        @DisplayName("does not deliver other tasks' events")
        void ignoresOtherTasks() {
            List<FixforgeEvent> received = new ArrayList<>();
            eventBus.subscribe("1", received::add);

            eventBus.publish(FixforgeEvent.taskOutput("2", "hello"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives every task's events")
        void globalSubscriber() {
            List<FixforgeEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(FixforgeEvent.taskOutput("1", "a"));
            eventBus.publish(FixforgeEvent.taskOutput("2", "b"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("preserves publication order per subscriber")
        void preservesOrder() {
            List<String> lines = new ArrayList<>();
            eventBus.subscribe("1", e -> lines.add((String) e.payload().get("line")));

            for (int i = 0; i < 5; i++) {
                eventBus.publish(FixforgeEvent.taskOutput("1", "line-" + i));
            }

            assertEquals(List.of("line-0", "line-1", "line-2", "line-3", "line-4"), lines);
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<FixforgeEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("1", received::add);

            subscription.unsubscribe();
            eventBus.publish(FixforgeEvent.taskOutput("1", "late"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("throwing subscriber does not affect others")
        void throwingSubscriber() {
            List<FixforgeEvent> received = new ArrayList<>();
            eventBus.subscribe("1", e -> { throw new RuntimeException("boom"); });
            eventBus.subscribe("1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(FixforgeEvent.taskOutput("1", "x")));
            assertEquals(1, received.size());
        }
    }

    // -- Bounded buffer tests -------------------------------------------------

    @Nested
    @DisplayName("bounded buffers")
    class BoundedBufferTests {

        @Test
        @DisplayName("full buffer drops the oldest pending events")
        void dropsOldest() {
            List<Runnable> deferred = new ArrayList<>();
            var registry = new SimpleMeterRegistry();
            var bus = new EventBus(deferred::add, 2, new FixforgeMetrics(registry));
            List<String> lines = new ArrayList<>();
            bus.subscribe("1", e -> lines.add((String) e.payload().get("line")));

            for (int i = 0; i < 5; i++) {
                bus.publish(FixforgeEvent.taskOutput("1", "line-" + i));
            }
            assertEquals(1, deferred.size());
            deferred.get(0).run();

            assertEquals(List.of("line-3", "line-4"), lines);
            assertEquals(3.0, registry.find("fixforge.events.dropped").counter().count());
        }

        @Test
        @DisplayName("publish does not wait for a blocked subscriber")
        void publishNeverBlocks() throws Exception {
            ExecutorService executor = Executors.newCachedThreadPool();
            try {
                var bus = new EventBus(executor, 4, null);
                var release = new CountDownLatch(1);
                var firstSeen = new CountDownLatch(1);
                bus.subscribe("1", e -> {
                    firstSeen.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                });

                long start = System.nanoTime();
                for (int i = 0; i < 100; i++) {
                    bus.publish(FixforgeEvent.taskOutput("1", "line-" + i));
                }
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

                assertTrue(firstSeen.await(5, TimeUnit.SECONDS));
                assertTrue(elapsedMs < 2000, "publish took " + elapsedMs + " ms");
                release.countDown();
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("events published before subscribing are not replayed")
        void noReplay() {
            eventBus.publish(FixforgeEvent.taskOutput("1", "early"));
            List<FixforgeEvent> received = new ArrayList<>();
            eventBus.subscribe("1", received::add);

            assertTrue(received.isEmpty());
        }
    }
}
