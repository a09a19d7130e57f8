package io.recur4j.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduler behavior.
 */
@ConfigurationProperties(prefix = "recur4j")
public class Recur4jProperties {
    private int maxConcurrency = 20; // worker pool size
    private String workerId;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean restoreOnStartup = true;
    private String timezone = "UTC"; // cron evaluation
    private int defaultMaxRetries = 3;
    private int defaultTimeoutSeconds = 3600;
    private int defaultPriority = 5;
    private String defaultCreatedBy = "system";
    private int maxPageSize = 100;
    private boolean ensureIndexesOnStartup = false;
    private boolean mongoTransactions = false;

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isRestoreOnStartup() {
        return restoreOnStartup;
    }

    public void setRestoreOnStartup(boolean restoreOnStartup) {
        this.restoreOnStartup = restoreOnStartup;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public void setDefaultPriority(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public String getDefaultCreatedBy() {
        return defaultCreatedBy;
    }

    public void setDefaultCreatedBy(String defaultCreatedBy) {
        this.defaultCreatedBy = defaultCreatedBy;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isMongoTransactions() {
        return mongoTransactions;
    }

    public void setMongoTransactions(boolean mongoTransactions) {
        this.mongoTransactions = mongoTransactions;
    }
}
