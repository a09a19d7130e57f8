package io.recur4j.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a job. Only the whitelisted fields below can change; a {@code null}
 * field means "leave as is".
 *
 * <p>Cron and interval are mutually exclusive, so setting one clears the other.
 */
public final class JobUpdate {

    private final String name;
    private final String description;
    private final boolean recurrenceChanged;
    private final String cronExpression;
    private final Long intervalSeconds;
    private final Map<String, Object> payload;
    private final Integer maxRetries;
    private final Integer timeoutSeconds;
    private final Integer priority;
    private final Boolean active;

    private JobUpdate(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.recurrenceChanged = b.recurrenceChanged;
        this.cronExpression = b.cronExpression;
        this.intervalSeconds = b.intervalSeconds;
        this.payload = b.payload == null ? null : new LinkedHashMap<>(b.payload);
        this.maxRetries = b.maxRetries;
        this.timeoutSeconds = b.timeoutSeconds;
        this.priority = b.priority;
        this.active = b.active;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public boolean recurrenceChanged() {
        return recurrenceChanged;
    }

    public String cronExpression() {
        return cronExpression;
    }

    public Long intervalSeconds() {
        return intervalSeconds;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Integer maxRetries() {
        return maxRetries;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public Integer priority() {
        return priority;
    }

    public Boolean active() {
        return active;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private boolean recurrenceChanged;
        private String cronExpression;
        private Long intervalSeconds;
        private Map<String, Object> payload;
        private Integer maxRetries;
        private Integer timeoutSeconds;
        private Integer priority;
        private Boolean active;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder cron(String cronExpression) {
            this.recurrenceChanged = true;
            this.cronExpression = cronExpression;
            this.intervalSeconds = null;
            return this;
        }

        public Builder interval(long seconds) {
            this.recurrenceChanged = true;
            this.cronExpression = null;
            this.intervalSeconds = seconds;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority.value();
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(this);
        }
    }
}
