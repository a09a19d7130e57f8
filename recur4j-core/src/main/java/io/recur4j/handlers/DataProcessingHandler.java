package io.recur4j.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.recur4j.JobHandler;
import io.recur4j.core.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class DataProcessingHandler implements JobHandler<DataProcessingHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(DataProcessingHandler.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(String dataset, String operation, Map<String, Object> parameters) {
        public Payload {
            dataset = dataset != null ? dataset : "default_dataset";
            operation = operation != null ? operation : "analyze";
            parameters = parameters != null ? parameters : Map.of();
        }

        long recordCount() {
            Object v = parameters.get("record_count");
            return v instanceof Number n ? n.longValue() : 1000L;
        }
    }

    @Override
    public JobType type() {
        return JobType.DATA_PROCESSING;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public String execute(Payload payload) {
        Payload p = payload != null ? payload : new Payload(null, null, null);
        log.info("recur4j processing dataset={} operation={}", p.dataset(), p.operation());
        return "Processed " + p.recordCount() + " records from " + p.dataset();
    }
}
