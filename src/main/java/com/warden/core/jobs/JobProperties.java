package com.warden.core.jobs;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "warden.jobs")
public class JobProperties {

    /** In-progress jobs silent for longer than this are labelled stuck. */
    private int stuckAfterSeconds = 120;
    private int eventBufferCapacity = 500;
    private int defaultMaxIterations = 50;
    private int defaultMaxTurns = 30;
    private String defaultModel = "sonnet";

    public int getStuckAfterSeconds() {
        return stuckAfterSeconds;
    }

    public void setStuckAfterSeconds(int stuckAfterSeconds) {
        this.stuckAfterSeconds = stuckAfterSeconds;
    }

    public int getEventBufferCapacity() {
        return eventBufferCapacity;
    }

    public void setEventBufferCapacity(int eventBufferCapacity) {
        this.eventBufferCapacity = eventBufferCapacity;
    }

    public int getDefaultMaxIterations() {
        return defaultMaxIterations;
    }

    public void setDefaultMaxIterations(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }

    public int getDefaultMaxTurns() {
        return defaultMaxTurns;
    }

    public void setDefaultMaxTurns(int defaultMaxTurns) {
        this.defaultMaxTurns = defaultMaxTurns;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }
}
