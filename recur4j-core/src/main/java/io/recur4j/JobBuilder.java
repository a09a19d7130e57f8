package io.recur4j;

import io.recur4j.core.Job;
import io.recur4j.core.JobDefinition;
import io.recur4j.core.JobType;
import io.recur4j.core.Priority;

import java.util.Map;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an unvalidated job definition</li>
 *   <li>save(): build() + {@link JobService#createJob(JobDefinition)}</li>
 * </ul>
 */
public interface JobBuilder {

    JobBuilder description(String description);

    JobBuilder type(JobType type);

    /**
     * Run on a 5-field cron expression. Clears any interval set before.
     */
    JobBuilder cron(String cronExpression);

    /**
     * Run every {@code seconds}. Clears any cron expression set before.
     */
    JobBuilder every(long seconds);

    /**
     * Run every human-readable interval (e.g. "5 minutes", "2h", "1 day 3 hours").
     *
     * @throws io.recur4j.exception.InvalidRecurrenceException if the text is not an interval
     *         or lies outside 1 minute to 7 days
     */
    JobBuilder every(String interval);

    JobBuilder payload(Map<String, Object> payload);

    /**
     * Set the payload from any object Jackson can convert to a map.
     */
    JobBuilder payload(Object payload);

    JobBuilder priority(Priority priority);

    JobBuilder priority(int priority);

    JobBuilder maxRetries(int maxRetries);

    JobBuilder timeoutSeconds(int timeoutSeconds);

    JobBuilder createdBy(String createdBy);

    /**
     * Create the job inactive; it is not armed until resumed.
     */
    JobBuilder paused();

    JobDefinition build();

    Job save();
}
