package com.williamcallahan.skillcatalog.queue;

/**
 * A delivered message that must be settled exactly once with {@link #ack()} or {@link #retry(Throwable)}.
 *
 * @param <T> payload type
 */
public interface QueueMessage<T> {

    T payload();

    /**
     * Delivery attempt, starting at 1.
     */
    int attempt();

    void ack();

    /**
     * Schedules redelivery after the queue's backoff, or dead-letters the message when its
     * attempts are exhausted.
     */
    void retry(Throwable cause);
}
