package com.williamcallahan.skillcatalog.queue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Drains a queue into a pipeline job with a fixed pool of worker threads.
 *
 * <p>A message is acknowledged when the job returns and retried when it throws; the job never
 * sleeps or re-enqueues on its own.</p>
 *
 * @param <T> message type
 */
public class QueueJobBinding<T> implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(QueueJobBinding.class);

    private final InMemoryWorkQueue<T> queue;
    private final PipelineJob<T> job;
    private final int workers;
    private final Duration pollTimeout;
    private volatile boolean running;
    private ExecutorService executor;

    public QueueJobBinding(InMemoryWorkQueue<T> queue, PipelineJob<T> job, int workers, Duration pollTimeout) {
        this.queue = queue;
        this.job = job;
        this.workers = workers;
        this.pollTimeout = pollTimeout;
    }

    /**
     * Processes at most one message.
     *
     * @return true when a message was delivered
     * @throws InterruptedException when interrupted while waiting for a message
     */
    public boolean processNext(Duration timeout) throws InterruptedException {
        Optional<QueueMessage<T>> delivered = queue.poll(timeout);
        if (delivered.isEmpty()) {
            return false;
        }
        QueueMessage<T> message = delivered.get();
        try {
            job.execute(message.payload());
            message.ack();
        } catch (RuntimeException failure) {
            log.warn("{} failed on attempt {}: {}", job.jobName(), message.attempt(), failure.getMessage());
            message.retry(failure);
        }
        return true;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, queue.name() + "-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int worker = 0; worker < workers; worker++) {
            executor.submit(this::workLoop);
        }
        log.info("Started {} worker(s) for queue {}", workers, queue.name());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(pollTimeout.toMillis() * 2, TimeUnit.MILLISECONDS)) {
                log.warn("Workers of queue {} did not stop in time", queue.name());
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void workLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                processNext(pollTimeout);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException unexpected) {
                log.error("Worker of queue {} hit an unexpected error", queue.name(), unexpected);
            }
        }
    }
}
