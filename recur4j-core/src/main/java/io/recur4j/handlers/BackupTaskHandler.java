package io.recur4j.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.recur4j.JobHandler;
import io.recur4j.core.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public class BackupTaskHandler implements JobHandler<BackupTaskHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(BackupTaskHandler.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(@JsonProperty("backup_type") String backupType,
                          String destination,
                          Boolean compression,
                          @JsonProperty("estimated_size_gb") Double estimatedSizeGb) {
        public Payload {
            backupType = backupType != null ? backupType : "database";
            destination = destination != null ? destination : "s3://backups/";
            compression = compression != null ? compression : Boolean.TRUE;
            estimatedSizeGb = estimatedSizeGb != null ? estimatedSizeGb : 2.5;
        }
    }

    @Override
    public JobType type() {
        return JobType.BACKUP_TASK;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public String execute(Payload payload) {
        Payload p = payload != null ? payload : new Payload(null, null, null, null);
        log.info("recur4j running backup type={} destination={} compression={}",
                p.backupType(), p.destination(), p.compression());
        String file = p.backupType() + "_backup_" + LocalDateTime.now().format(STAMP);
        return "Backup completed: " + file + " (" + p.estimatedSizeGb() + "GB) stored at " + p.destination();
    }
}
