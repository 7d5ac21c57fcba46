package io.tempo4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduler behavior.
 */
@ConfigurationProperties(prefix = "tempo")
public class SchedulerProperties {
    private Duration checkInterval = Duration.ofSeconds(60);
    private int maxConcurrency = 20; // concurrently executing jobs
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Duration defaultTimeout = Duration.ofHours(1);
    private int defaultRetryCount = 3;
    private Duration defaultRetryDelay = Duration.ofMinutes(5);
    private String defaultTimezone = "UTC";
    private boolean reconcileOnStartup = true;
    private boolean registerShutdownHook = true;
    private boolean ensureIndexesOnStartup = false;
    private boolean cleanupHandlerEnabled = true;

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getDefaultRetryCount() {
        return defaultRetryCount;
    }

    public void setDefaultRetryCount(int defaultRetryCount) {
        this.defaultRetryCount = defaultRetryCount;
    }

    public Duration getDefaultRetryDelay() {
        return defaultRetryDelay;
    }

    public void setDefaultRetryDelay(Duration defaultRetryDelay) {
        this.defaultRetryDelay = defaultRetryDelay;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public boolean isReconcileOnStartup() {
        return reconcileOnStartup;
    }

    public void setReconcileOnStartup(boolean reconcileOnStartup) {
        this.reconcileOnStartup = reconcileOnStartup;
    }

    public boolean isRegisterShutdownHook() {
        return registerShutdownHook;
    }

    public void setRegisterShutdownHook(boolean registerShutdownHook) {
        this.registerShutdownHook = registerShutdownHook;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isCleanupHandlerEnabled() {
        return cleanupHandlerEnabled;
    }

    public void setCleanupHandlerEnabled(boolean cleanupHandlerEnabled) {
        this.cleanupHandlerEnabled = cleanupHandlerEnabled;
    }
}
