package net.driftwatch.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("driftwatch")
public class DriftwatchProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Statistics statistics = new Statistics();
    private Scraper scraper = new Scraper();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    public void setStatistics(Statistics statistics) {
        this.statistics = statistics;
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public enum Mode { POLLING, MANUAL }

    public static class Scheduler {
        private boolean enabled = true;
        private Mode mode = Mode.POLLING;
        private long tickDelayMs = 30_000;
        private Duration misfireGrace = Duration.ofMinutes(60);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private int workerThreads = 4;
        private int failureAlertThreshold = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Mode getMode() {
            return mode;
        }

        public void setMode(Mode mode) {
            this.mode = mode;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public Duration getMisfireGrace() {
            return misfireGrace;
        }

        public void setMisfireGrace(Duration misfireGrace) {
            this.misfireGrace = misfireGrace;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getFailureAlertThreshold() {
            return failureAlertThreshold;
        }

        public void setFailureAlertThreshold(int failureAlertThreshold) {
            this.failureAlertThreshold = failureAlertThreshold;
        }
    }

    public static class Statistics {
        private Duration window = Duration.ofDays(30);

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class Scraper {
        // <snapshotDir>/<userId>/<kind>.json
        private String snapshotDir;

        public String getSnapshotDir() {
            return snapshotDir;
        }

        public void setSnapshotDir(String snapshotDir) {
            this.snapshotDir = snapshotDir;
        }
    }
}
