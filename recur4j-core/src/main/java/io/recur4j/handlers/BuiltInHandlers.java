package io.recur4j.handlers;

import io.recur4j.JobHandler;

import java.util.List;

/**
 * The stock handler for every {@link io.recur4j.core.JobType}.
 */
public final class BuiltInHandlers {

    private BuiltInHandlers() {
    }

    public static List<JobHandler<?>> all() {
        return List.of(
                new EmailNotificationHandler(),
                new DataProcessingHandler(),
                new ReportGenerationHandler(),
                new CleanupTaskHandler(),
                new BackupTaskHandler(),
                new CustomJobHandler()
        );
    }
}
