package io.recur4j.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.recur4j.JobHandler;
import io.recur4j.core.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stub notification sender. Delivery is logged, not performed.
 */
public class EmailNotificationHandler implements JobHandler<EmailNotificationHandler.Payload> {
    private static final Logger log = LoggerFactory.getLogger(EmailNotificationHandler.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(String recipient, String subject, String body) {
        public Payload {
            recipient = recipient != null ? recipient : "user@example.com";
            subject = subject != null ? subject : "Notification";
            body = body != null ? body : "This is a notification email.";
        }
    }

    @Override
    public JobType type() {
        return JobType.EMAIL_NOTIFICATION;
    }

    @Override
    public Class<Payload> payloadClass() {
        return Payload.class;
    }

    @Override
    public String execute(Payload payload) {
        Payload p = payload != null ? payload : new Payload(null, null, null);
        log.info("recur4j sending email recipient={} subject={}", p.recipient(), p.subject());
        return "Email sent successfully to " + p.recipient();
    }
}
