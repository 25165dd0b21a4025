package io.autopilot4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for the autopilot scheduler and workers.
 */
@ConfigurationProperties(prefix = "autopilot")
public class AutopilotProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private String workerId;
    private int workerConcurrency = 3;
    private Duration pollEvery = Duration.ofSeconds(5);
    private Duration dispatchEvery = Duration.ofSeconds(60);
    private String timezone; // system default when blank
    private String defaultAccount = "default";
    private boolean dispatchEnabledByDefault = true;
    private boolean autoGenerateSchedule = true;
    private boolean skipMissedSlots = true;
    private String rolloverAt = "0 0 * * *";
    private Duration staleJobThreshold = Duration.ofMinutes(15);
    private Duration reapEvery = Duration.ofMinutes(1);
    private int maxAttempts = 3;
    private Duration shutdownGrace = Duration.ofSeconds(30);
    private String profilesDir = "browser_profiles";
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public Duration getPollEvery() {
        return pollEvery;
    }

    public void setPollEvery(Duration pollEvery) {
        this.pollEvery = pollEvery;
    }

    public Duration getDispatchEvery() {
        return dispatchEvery;
    }

    public void setDispatchEvery(Duration dispatchEvery) {
        this.dispatchEvery = dispatchEvery;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    /**
     * Zone schedules are built in; the system zone when {@code timezone} is blank.
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone.trim());
    }

    public String getDefaultAccount() {
        return defaultAccount;
    }

    public void setDefaultAccount(String defaultAccount) {
        this.defaultAccount = defaultAccount;
    }

    public boolean isDispatchEnabledByDefault() {
        return dispatchEnabledByDefault;
    }

    public void setDispatchEnabledByDefault(boolean dispatchEnabledByDefault) {
        this.dispatchEnabledByDefault = dispatchEnabledByDefault;
    }

    public boolean isAutoGenerateSchedule() {
        return autoGenerateSchedule;
    }

    public void setAutoGenerateSchedule(boolean autoGenerateSchedule) {
        this.autoGenerateSchedule = autoGenerateSchedule;
    }

    public boolean isSkipMissedSlots() {
        return skipMissedSlots;
    }

    public void setSkipMissedSlots(boolean skipMissedSlots) {
        this.skipMissedSlots = skipMissedSlots;
    }

    public String getRolloverAt() {
        return rolloverAt;
    }

    public void setRolloverAt(String rolloverAt) {
        this.rolloverAt = rolloverAt;
    }

    public Duration getStaleJobThreshold() {
        return staleJobThreshold;
    }

    public void setStaleJobThreshold(Duration staleJobThreshold) {
        this.staleJobThreshold = staleJobThreshold;
    }

    public Duration getReapEvery() {
        return reapEvery;
    }

    public void setReapEvery(Duration reapEvery) {
        this.reapEvery = reapEvery;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public String getProfilesDir() {
        return profilesDir;
    }

    public void setProfilesDir(String profilesDir) {
        this.profilesDir = profilesDir;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
