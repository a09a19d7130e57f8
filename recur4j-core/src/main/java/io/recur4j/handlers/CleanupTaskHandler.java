package io.recur4j.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.recur4j.JobHandler;
import io.recur4j.core.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CleanupTaskHandler implements JobHandler<CleanupTaskHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(CleanupTaskHandler.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(@JsonProperty("cleanup_type") String cleanupType,
                          @JsonProperty("retention_days") Integer retentionDays,
                          @JsonProperty("estimated_files") Long estimatedFiles,
                          @JsonProperty("estimated_space_mb") Long estimatedSpaceMb) {
        public Payload {
            cleanupType = cleanupType != null ? cleanupType : "temp_files";
            retentionDays = retentionDays != null ? retentionDays : 7;
            estimatedFiles = estimatedFiles != null ? estimatedFiles : 100L;
            estimatedSpaceMb = estimatedSpaceMb != null ? estimatedSpaceMb : 500L;
        }
    }

    @Override
    public JobType type() {
        return JobType.CLEANUP_TASK;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public String execute(Payload payload) {
        Payload p = payload != null ? payload : new Payload(null, null, null, null);
        log.info("recur4j running cleanup type={} retentionDays={}", p.cleanupType(), p.retentionDays());
        return "Cleanup completed: " + p.estimatedFiles() + " files removed, " + p.estimatedSpaceMb() + "MB freed";
    }
}
