package io.github.byzatic.jobscheduler.engine;

public final class SchedulerStatistics {
    public final int totalJobs;
    public final int activeJobs;
    public final int pausedJobs;
    public final int runningJobs;
    public final int completedJobs;

    SchedulerStatistics(int totalJobs, int activeJobs, int pausedJobs, int runningJobs, int completedJobs) {
        this.totalJobs = totalJobs;
        this.activeJobs = activeJobs;
        this.pausedJobs = pausedJobs;
        this.runningJobs = runningJobs;
        this.completedJobs = completedJobs;
    }

    @Override
    public String toString() {
        return "SchedulerStatistics{total=" + totalJobs + ", active=" + activeJobs + ", paused=" + pausedJobs +
                ", running=" + runningJobs + ", completed=" + completedJobs + '}';
    }
}
