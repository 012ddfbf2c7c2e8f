package com.williamcallahan.skillcatalog.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * In-process work queue with explicit settlement and delayed redelivery.
 *
 * <p>A retried message is re-offered after an exponential backoff computed from its attempt
 * number. After {@code maxAttempts} deliveries it is dead-lettered: logged at error level and
 * dropped. Messages pending at shutdown are lost.</p>
 *
 * @param <T> message type
 */
public class InMemoryWorkQueue<T> implements WorkQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkQueue.class);

    private final String name;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final TaskScheduler taskScheduler;
    private final BlockingQueue<Envelope<T>> ready = new LinkedBlockingQueue<>();
    private final AtomicLong deadLettered = new AtomicLong();

    public InMemoryWorkQueue(
            String name, int maxAttempts, Duration initialBackoff, Duration maxBackoff, TaskScheduler taskScheduler) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
    }

    public String name() {
        return name;
    }

    @Override
    public void enqueue(T message) {
        ready.add(new Envelope<>(Objects.requireNonNull(message, "message"), 1));
    }

    /**
     * Waits up to {@code timeout} for the next ready message.
     *
     * @throws InterruptedException when the waiting worker is interrupted
     */
    public Optional<QueueMessage<T>> poll(Duration timeout) throws InterruptedException {
        Envelope<T> envelope = ready.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return Optional.ofNullable(envelope).map(Delivery::new);
    }

    /**
     * Number of messages ready for delivery, excluding those waiting out a backoff.
     */
    public int readyCount() {
        return ready.size();
    }

    public long deadLetterCount() {
        return deadLettered.get();
    }

    Duration backoffFor(int attempt) {
        long multiplier = 1L << Math.min(attempt - 1, 20);
        long delayMillis = initialBackoff.toMillis() * multiplier;
        return Duration.ofMillis(Math.min(delayMillis, maxBackoff.toMillis()));
    }

    private record Envelope<T>(T payload, int attempt) {
    }

    private final class Delivery implements QueueMessage<T> {
        private final Envelope<T> envelope;
        private final AtomicBoolean settled = new AtomicBoolean();

        private Delivery(Envelope<T> envelope) {
            this.envelope = envelope;
        }

        @Override
        public T payload() {
            return envelope.payload();
        }

        @Override
        public int attempt() {
            return envelope.attempt();
        }

        @Override
        public void ack() {
            settle();
        }

        @Override
        public void retry(Throwable cause) {
            settle();
            int attempt = envelope.attempt();
            if (attempt >= maxAttempts) {
                deadLettered.incrementAndGet();
                log.error("[{}] Dead-lettering message after {} attempts: {}", name, attempt, envelope.payload(), cause);
                return;
            }
            Duration backoff = backoffFor(attempt);
            Envelope<T> redelivery = new Envelope<>(envelope.payload(), attempt + 1);
            log.warn("[{}] Attempt {}/{} failed, redelivering in {}ms: {}",
                    name, attempt, maxAttempts, backoff.toMillis(), cause == null ? "unknown" : cause.getMessage());
            taskScheduler.schedule(() -> ready.add(redelivery), Instant.now().plus(backoff));
        }

        private void settle() {
            if (!settled.compareAndSet(false, true)) {
                throw new IllegalStateException("Message already settled");
            }
        }
    }
}
