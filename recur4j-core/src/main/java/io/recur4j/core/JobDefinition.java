package io.recur4j.core;

import java.util.Map;

/**
 * Immutable job definition produced by {@link io.recur4j.JobBuilder#build()}.
 * This is a pure data object with no persistence logic; {@code null} fields take the
 * configured defaults when the job is created.
 */
public record JobDefinition(

        // identity
        String name,
        String description,
        JobType jobType,

        // recurrence (exactly one)
        String cronExpression,
        Long intervalSeconds,

        // execution policy
        Integer maxRetries,
        Integer timeoutSeconds,
        Integer priority,

        // ownership / state
        String createdBy,
        Boolean active,

        // payload
        Map<String, Object> payload
) {
}
