package com.warden.core.jobs;

import com.warden.core.model.Job;
import com.warden.core.model.Transition;

/**
 * Spring application event published after a transition has been stored.
 * The supervisor, event pipeline and routine scheduler react to terminal ones.
 */
public record JobTransitionedEvent(Job job, Transition transition) {

    public boolean isTerminal() {
        return job.state().isTerminal();
    }
}
