package com.docweaver.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the steps of a generation run and logs them.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final int totalSteps;
    private int completedSteps;

    /**
     * Creates a tracker.
     *
     * @param totalSteps number of steps expected
     */
    public ProgressTracker(int totalSteps) {
        this.totalSteps = totalSteps;
    }

    /**
     * Starts a phase of the run.
     *
     * @param activity description of the phase
     */
    public void begin(String activity) {
        log.info("{} ({}/{} steps done)", activity, completedSteps, totalSteps);
    }

    /**
     * Records a completed step.
     *
     * @param step description of the step
     */
    public void step(String step) {
        completedSteps++;
        log.debug("[{}/{}] {}", completedSteps, totalSteps, step);
    }
}
