package io.github.byzatic.jobscheduler.model;

/**
 * Lifecycle states of a registered job.
 */
public enum JobState {SCHEDULED, FIRING, RUNNING, COMPLETED}
