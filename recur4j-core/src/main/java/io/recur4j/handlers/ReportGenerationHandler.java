package io.recur4j.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.recur4j.JobHandler;
import io.recur4j.core.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ReportGenerationHandler implements JobHandler<ReportGenerationHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(ReportGenerationHandler.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(@JsonProperty("report_type") String reportType,
                          @JsonProperty("date_range") String dateRange,
                          String format) {
        public Payload {
            reportType = reportType != null ? reportType : "summary";
            dateRange = dateRange != null ? dateRange : "last_week";
            format = format != null ? format : "pdf";
        }
    }

    @Override
    public JobType type() {
        return JobType.REPORT_GENERATION;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public String execute(Payload payload) {
        Payload p = payload != null ? payload : new Payload(null, null, null);
        log.info("recur4j generating report type={} range={} format={}", p.reportType(), p.dateRange(), p.format());
        return "Report generated successfully: /reports/" + p.reportType() + "_" + p.dateRange() + "." + p.format();
    }
}
