package com.williamcallahan.skillcatalog.logging;

import com.williamcallahan.skillcatalog.queue.PipelineJob;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs start, completion and duration of every pipeline stage run to the PIPELINE logger.
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    @Around("execution(* com.williamcallahan.skillcatalog.queue.PipelineJob+.execute(..))")
    public Object logStageRun(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = "RUN-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId();
        String stage = stageName(joinPoint.getTarget());
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] {} - Starting", runId, stage);
        Object[] args = joinPoint.getArgs();
        if (args.length > 0) {
            PIPELINE_LOG.debug("[{}] {} input: {}", runId, stage, args[0]);
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms", runId, stage, duration);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} - Failed after {}ms: {}",
                runId, stage, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        }
    }

    private static String stageName(Object target) {
        if (target instanceof PipelineJob) {
            return ((PipelineJob<?>) target).jobName().toUpperCase();
        }
        return target.getClass().getSimpleName();
    }
}
