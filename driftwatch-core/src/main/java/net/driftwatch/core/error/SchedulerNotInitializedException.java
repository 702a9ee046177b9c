package net.driftwatch.core.error;

public class SchedulerNotInitializedException extends IllegalStateException {
    public SchedulerNotInitializedException() {
        super("Scheduler not started: call start() and let restart recovery finish first");
    }
}
