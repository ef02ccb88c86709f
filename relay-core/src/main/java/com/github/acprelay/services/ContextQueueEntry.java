package com.github.acprelay.services;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * A background-job result waiting to be shown to the agent.
 */
public record ContextQueueEntry(String id, String timestamp, String source, String content) {

    public static final String SOURCE_ASYNC_JOB = "async_job";

    @NotNull
    public static ContextQueueEntry asyncJob(@NotNull String jobId, @NotNull String content) {
        return new ContextQueueEntry(jobId, Instant.now().toString(), SOURCE_ASYNC_JOB, content);
    }
}
