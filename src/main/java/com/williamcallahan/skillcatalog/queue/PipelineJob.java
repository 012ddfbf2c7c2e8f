package com.williamcallahan.skillcatalog.queue;

/**
 * One pipeline stage invocation, triggered either by a queue delivery or by a schedule.
 *
 * <p>Implementations throw to signal a failure of the whole unit of work; queue-bound jobs are
 * then redelivered by the queue. Expected no-op outcomes return normally.</p>
 *
 * @param <I> input of one invocation: a queue message, or the trigger time for scheduled jobs
 */
public interface PipelineJob<I> {

    /**
     * Short stable name used in logs and metrics.
     */
    String jobName();

    void execute(I input);
}
