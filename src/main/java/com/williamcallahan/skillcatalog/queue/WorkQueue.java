package com.williamcallahan.skillcatalog.queue;

/**
 * Producer side of a work queue.
 *
 * @param <T> message type
 */
public interface WorkQueue<T> {

    void enqueue(T message);
}
