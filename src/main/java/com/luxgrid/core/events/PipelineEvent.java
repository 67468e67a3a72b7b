package com.luxgrid.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a pipeline run executes, used for CLI progress output.
 *
 * @param eventType event type (e.g. "phase.started", "job.progress", "group.completed")
 * @param runId     the run this event belongs to
 * @param jobId     the job or view group this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String jobId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent of(String eventType, String runId, String jobId, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, jobId, payload, Instant.now());
    }
}
