package io.recur4j.store;

import io.recur4j.core.Job;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobQuery;
import io.recur4j.core.JobStatus;
import io.recur4j.core.JobType;
import io.recur4j.core.Page;
import io.recur4j.exception.JobStoreException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryJobRepository repository = new InMemoryJobRepository();

    @Test
    void loadedJobsShouldBeDetachedCopies() {
        Job job = newJob("detached", 5, T0);
        repository.saveJob(job);

        job.setName("changed-after-save");
        Job loaded = repository.findJob(job.getId()).orElseThrow();
        loaded.setPriority(1);

        Job reloaded = repository.findJob(job.getId()).orElseThrow();
        assertEquals("detached", reloaded.getName());
        assertEquals(5, reloaded.getPriority());
    }

    @Test
    void listJobsShouldFilterAndOrderByPriorityThenNewest() {
        repository.saveJob(newJob("low-old", 2, T0));
        repository.saveJob(newJob("high-old", 9, T0));
        repository.saveJob(newJob("high-new", 9, T0.plusSeconds(60)));
        Job backup = newJob("backup-one", 7, T0);
        backup.setJobType(JobType.BACKUP_TASK);
        backup.setActive(false);
        backup.setStatus(JobStatus.PAUSED);
        repository.saveJob(backup);

        Page<Job> all = repository.listJobs(JobQuery.all(), 1, 10);
        assertEquals(List.of("high-new", "high-old", "backup-one", "low-old"),
                all.items().stream().map(Job::getName).toList());

        Page<Job> paused = repository.listJobs(JobQuery.builder().status(JobStatus.PAUSED).build(), 1, 10);
        assertEquals(1, paused.total());
        assertEquals("backup-one", paused.items().get(0).getName());

        Page<Job> custom = repository.listJobs(JobQuery.builder().jobType(JobType.CUSTOM).active(true).build(), 2, 2);
        assertEquals(3, custom.total());
        assertEquals(List.of("low-old"), custom.items().stream().map(Job::getName).toList());
        assertFalse(custom.hasNext());
        assertTrue(custom.hasPrevious());
    }

    @Test
    void pageBeyondEndShouldBeEmptyWithTotal() {
        repository.saveJob(newJob("only-one", 5, T0));

        Page<Job> page = repository.listJobs(JobQuery.all(), 3, 10);

        assertTrue(page.items().isEmpty());
        assertEquals(1, page.total());
    }

    @Test
    void deleteJobShouldCascadeToExecutions() {
        Job job = newJob("to-delete", 5, T0);
        repository.saveJob(job);
        repository.saveExecution(JobExecution.begin(job.getId(), "worker-A", T0)
                .complete("ok", T0.plusSeconds(1), 1.0));

        assertTrue(repository.deleteJob(job.getId()));
        assertTrue(repository.findJob(job.getId()).isEmpty());
        assertEquals(0, repository.listExecutions(job.getId(), 1, 10).total());
        assertFalse(repository.deleteJob(job.getId()));
    }

    @Test
    void executionsShouldListNewestFirst() {
        Job job = newJob("history", 5, T0);
        repository.saveJob(job);
        for (int i = 0; i < 3; i++) {
            Instant started = T0.plusSeconds(i * 60L);
            repository.saveExecution(JobExecution.begin(job.getId(), "worker-A", started)
                    .complete("run-" + i, started.plusSeconds(1), 1.0));
        }

        Page<JobExecution> page = repository.listExecutions(job.getId(), 1, 2);

        assertEquals(3, page.total());
        assertEquals(List.of("run-2", "run-1"), page.items().stream().map(JobExecution::getResult).toList());
    }

    @Test
    void orphanExecutionShouldBeRejected() {
        JobExecution orphan = JobExecution.begin(UUID.randomUUID().toString(), "worker-A", T0)
                .complete("ok", T0, 0.0);

        assertThrows(JobStoreException.class, () -> repository.saveExecution(orphan));
    }

    @Test
    void saveRunShouldRejectExecutionOfAnotherJob() {
        Job job = newJob("owner", 5, T0);
        Job other = newJob("other", 5, T0);
        repository.saveJob(job);
        repository.saveJob(other);
        JobExecution execution = JobExecution.begin(other.getId(), "worker-A", T0).complete("ok", T0, 0.0);

        job.setTotalRuns(1);
        assertThrows(JobStoreException.class, () -> repository.saveRun(job, execution));

        assertEquals(0, repository.findJob(job.getId()).orElseThrow().getTotalRuns());
        assertEquals(0, repository.listExecutions(other.getId(), 1, 10).total());
    }

    @Test
    void findActiveJobsShouldSkipInactive() {
        repository.saveJob(newJob("active-one", 5, T0));
        Job paused = newJob("paused-two", 5, T0);
        paused.setActive(false);
        repository.saveJob(paused);

        List<Job> active = repository.findActiveJobs();

        assertEquals(1, active.size());
        assertEquals("active-one", active.get(0).getName());
    }

    private static Job newJob(String name, int priority, Instant createdAt) {
        Job job = new Job();
        job.setId(UUID.randomUUID().toString());
        job.setName(name);
        job.setIntervalSeconds(3600L);
        job.setNextRunTime(createdAt.plusSeconds(3600));
        job.setMaxRetries(3);
        job.setTimeoutSeconds(60);
        job.setPriority(priority);
        job.setCreatedBy("system");
        job.setCreatedAt(createdAt);
        job.setUpdatedAt(createdAt);
        return job;
    }
}
