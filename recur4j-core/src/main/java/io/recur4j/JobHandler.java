package io.recur4j;

import io.recur4j.core.JobType;

/**
 * Executes the body of every job of one {@link JobType}.
 *
 * <p>The job's payload map is converted to {@link #payloadClass()} with Jackson before
 * {@link #execute(Object)} is called. The returned string is recorded as the execution result.
 * Any exception thrown is recorded as a failed execution and drives the retry policy.
 *
 * <p>Handlers run on a dedicated thread and are interrupted when the job's timeout elapses.
 */
public interface JobHandler<T> {
    JobType type();

    Class<T> payloadClass();

    String execute(T payload) throws Exception;
}
