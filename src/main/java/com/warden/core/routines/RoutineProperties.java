package com.warden.core.routines;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warden.routines")
public class RoutineProperties {

    public static final int DEFAULT_RUN_HISTORY_LIMIT = 500;

    private long tickIntervalMs = 15000;
    /** Zone cron expressions are evaluated in. */
    private String zone = "UTC";
    private int recentRunsLimit = 20;
    /** Runs retained per routine; older finished runs are deleted as new ones are recorded. */
    private int runHistoryLimit = DEFAULT_RUN_HISTORY_LIMIT;
    private int lightweightMaxIterations = 5;
    private int fullJobMaxIterations = 10;
    private long defaultCooldownSecs = 300;

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public int getRecentRunsLimit() {
        return recentRunsLimit;
    }

    public void setRecentRunsLimit(int recentRunsLimit) {
        this.recentRunsLimit = recentRunsLimit;
    }

    public int getRunHistoryLimit() {
        return runHistoryLimit;
    }

    public void setRunHistoryLimit(int runHistoryLimit) {
        this.runHistoryLimit = runHistoryLimit;
    }

    public int getLightweightMaxIterations() {
        return lightweightMaxIterations;
    }

    public void setLightweightMaxIterations(int lightweightMaxIterations) {
        this.lightweightMaxIterations = lightweightMaxIterations;
    }

    public int getFullJobMaxIterations() {
        return fullJobMaxIterations;
    }

    public void setFullJobMaxIterations(int fullJobMaxIterations) {
        this.fullJobMaxIterations = fullJobMaxIterations;
    }

    public long getDefaultCooldownSecs() {
        return defaultCooldownSecs;
    }

    public void setDefaultCooldownSecs(long defaultCooldownSecs) {
        this.defaultCooldownSecs = defaultCooldownSecs;
    }
}
