package io.github.byzatic.jobscheduler.engine;

/**
 * Why a fire event did not start an execution.
 */
public enum SkipReason {PAUSED, ALREADY_RUNNING}
