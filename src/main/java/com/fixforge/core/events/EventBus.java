package com.fixforge.core.events;

import com.fixforge.core.config.FixforgeProperties;
import com.fixforge.core.metrics.FixforgeMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for task and fix progress events.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive all events.
 * Every subscriber owns a bounded buffer drained on the delivery executor, so
 * {@link #publish} never waits on a consumer. When a buffer is full the oldest
 * pending event is dropped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-task subscribers keyed by task id (or workflow id for standalone attempts). */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Mailbox>> taskSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all tasks. */
    private final CopyOnWriteArrayList<Mailbox> globalSubscribers = new CopyOnWriteArrayList<>();

    private final Executor deliveryExecutor;
    private final ExecutorService ownedExecutor;
    private final int bufferSize;
    private final FixforgeMetrics metrics;

    @Autowired
    public EventBus(FixforgeProperties properties,
                    @Autowired(required = false) FixforgeMetrics metrics) {
        this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
        this.deliveryExecutor = ownedExecutor;
        this.bufferSize = Math.max(1, properties.getEvents().getBufferSize());
        this.metrics = metrics;
    }

    /**
     * Package-private constructor for testing; {@code Runnable::run} delivers on the publishing thread.
     */
    EventBus(Executor deliveryExecutor, int bufferSize, FixforgeMetrics metrics) {
        this.ownedExecutor = null;
        this.deliveryExecutor = deliveryExecutor;
        this.bufferSize = Math.max(1, bufferSize);
        this.metrics = metrics;
    }

    /**
     * Publish an event to all matching subscribers (task-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(FixforgeEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.channel());

        String channel = event.channel();
        if (channel != null) {
            var subs = taskSubscribers.get(channel);
            if (subs != null) {
                for (Mailbox mailbox : subs) {
                    mailbox.offer(event);
                }
            }
        }

        for (Mailbox mailbox : globalSubscribers) {
            mailbox.offer(event);
        }
    }

    /**
     * Subscribe to events for a specific task.
     *
     * @param taskId   the task (or standalone workflow) to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<FixforgeEvent> consumer) {
        var mailbox = new Mailbox(consumer);
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(mailbox);
        log.debug("Subscribed to task {}", taskId);
        return () -> {
            CopyOnWriteArrayList<Mailbox> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(mailbox);
            }
        };
    }

    /**
     * Subscribe to events from all tasks (global subscription).
     *
     * @param consumer callback invoked for each event regardless of task
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<FixforgeEvent> consumer) {
        var mailbox = new Mailbox(consumer);
        globalSubscribers.add(mailbox);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(mailbox);
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private final class Mailbox {

        private final Consumer<FixforgeEvent> subscriber;
        private final ArrayBlockingQueue<FixforgeEvent> pending = new ArrayBlockingQueue<>(bufferSize);
        private final AtomicBoolean draining = new AtomicBoolean();

        private Mailbox(Consumer<FixforgeEvent> subscriber) {
            this.subscriber = subscriber;
        }

        void offer(FixforgeEvent event) {
            while (!pending.offer(event)) {
                FixforgeEvent dropped = pending.poll();
                if (dropped != null) {
                    log.debug("Subscriber buffer full, dropping {} for task {}",
                            dropped.eventType(), dropped.channel());
                    if (metrics != null) {
                        metrics.recordDroppedEvent();
                    }
                }
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.warn("Event delivery rejected, {} events left pending: {}", pending.size(), e.getMessage());
            }
        }

        private void drain() {
            try {
                FixforgeEvent event;
                while ((event = pending.poll()) != null) {
                    deliverSafely(subscriber, event);
                }
            } finally {
                draining.set(false);
            }
            if (!pending.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    private void deliverSafely(Consumer<FixforgeEvent> subscriber, FixforgeEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }

    private static ThreadFactory daemonThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "event-delivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
