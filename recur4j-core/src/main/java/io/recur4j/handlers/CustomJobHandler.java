package io.recur4j.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.recur4j.JobHandler;
import io.recur4j.core.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Default handler, also used for any type without a handler of its own.
 *
 * <p>{@code parameters.duration} (seconds, capped at 30) simulates work by sleeping.
 */
public class CustomJobHandler implements JobHandler<CustomJobHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(CustomJobHandler.class);

    static final long MAX_SIMULATED_SECONDS = 30;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(String operation, Map<String, Object> parameters) {
        public Payload {
            operation = operation != null ? operation : "default";
            parameters = parameters != null ? parameters : Map.of();
        }

        double durationSeconds() {
            Object v = parameters.get("duration");
            return v instanceof Number n ? Math.max(0, n.doubleValue()) : 0;
        }
    }

    @Override
    public JobType type() {
        return JobType.CUSTOM;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public String execute(Payload payload) throws InterruptedException {
        Payload p = payload != null ? payload : new Payload(null, null);
        log.info("recur4j executing custom job operation={}", p.operation());

        long millis = (long) (Math.min(p.durationSeconds(), MAX_SIMULATED_SECONDS) * 1000);
        if (millis > 0) {
            Thread.sleep(millis);
        }
        return "Custom job completed: " + p.operation();
    }
}
