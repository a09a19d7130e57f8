package io.recur4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobBuilder;
import io.recur4j.core.Job;
import io.recur4j.core.JobDefinition;
import io.recur4j.core.JobType;
import io.recur4j.core.Priority;
import io.recur4j.exception.InvalidRecurrenceException;
import io.recur4j.utils.TriggerCalculator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation. Field rules are enforced when the definition is
 * saved, not while building.
 */
public class SimpleJobBuilder implements JobBuilder {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final ObjectMapper objectMapper;
    private final Function<JobDefinition, Job> persister;

    private String description;
    private JobType type = JobType.CUSTOM;

    private String cronExpression;
    private Long intervalSeconds;

    private Map<String, Object> payload;
    private Integer priority;
    private Integer maxRetries;
    private Integer timeoutSeconds;
    private String createdBy;
    private boolean paused;

    public SimpleJobBuilder(String name, ObjectMapper objectMapper, Function<JobDefinition, Job> persister) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder description(String description) {
        this.description = description;
        return this;
    }

    @Override
    public JobBuilder type(JobType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        return this;
    }

    @Override
    public JobBuilder cron(String cronExpression) {
        Objects.requireNonNull(cronExpression, "cronExpression must not be null");
        this.cronExpression = cronExpression;
        this.intervalSeconds = null;
        return this;
    }

    @Override
    public JobBuilder every(long seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("interval must be a positive number of seconds");
        }
        this.intervalSeconds = seconds;
        this.cronExpression = null;
        return this;
    }

    @Override
    public JobBuilder every(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        long seconds;
        try {
            seconds = TriggerCalculator.parseHumanDuration(interval).getSeconds();
        } catch (IllegalArgumentException ex) {
            throw new InvalidRecurrenceException("intervalSeconds", ex.getMessage());
        }
        JobValidator.interval(seconds);
        return every(seconds);
    }

    @Override
    public JobBuilder payload(Map<String, Object> payload) {
        this.payload = payload == null ? null : new LinkedHashMap<>(payload);
        return this;
    }

    @Override
    public JobBuilder payload(Object payload) {
        if (payload == null) {
            this.payload = null;
            return this;
        }
        try {
            this.payload = objectMapper.convertValue(payload, MAP_TYPE);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("payload must convert to a JSON object: " + ex.getMessage(), ex);
        }
        return this;
    }

    @Override
    public JobBuilder priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    @Override
    public JobBuilder priority(int priority) {
        this.priority = priority;
        return this;
    }

    @Override
    public JobBuilder maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    @Override
    public JobBuilder timeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
        return this;
    }

    @Override
    public JobBuilder createdBy(String createdBy) {
        this.createdBy = createdBy;
        return this;
    }

    @Override
    public JobBuilder paused() {
        this.paused = true;
        return this;
    }

    @Override
    public JobDefinition build() {
        return new JobDefinition(
                name,
                description,
                type,
                cronExpression,
                intervalSeconds,
                maxRetries,
                timeoutSeconds,
                priority,
                createdBy,
                !paused,
                payload
        );
    }

    @Override
    public Job save() {
        return persister.apply(build());
    }
}
