package net.cadence.bootstrap.props;

import net.cadence.core.config.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("cadence")
public class CadenceProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Recovery recovery = new Recovery();
    private Cache cache = new Cache();
    private Catalog catalog = new Catalog();

    /** 코어로 넘길 불변 설정. 값 검증은 SchedulerSettings 생성자에서 */
    public SchedulerSettings toSettings() {
        return new SchedulerSettings(
                scheduler.getMinInterval(),
                scheduler.getGraceDelay(),
                scheduler.getMisfireGrace(),
                scheduler.getTickInterval(),
                scheduler.getShutdownGrace(),
                scheduler.getWorkerThreads(),
                ZoneId.of(zone));
    }

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

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration minInterval = Duration.ofSeconds(60);
        private Duration graceDelay = Duration.ofSeconds(1);
        private Duration misfireGrace = Duration.ofSeconds(60);
        private Duration tickInterval = Duration.ofMillis(250);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private int workerThreads = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getMinInterval() {
            return minInterval;
        }

        public void setMinInterval(Duration minInterval) {
            this.minInterval = minInterval;
        }

        public Duration getGraceDelay() {
            return graceDelay;
        }

        public void setGraceDelay(Duration graceDelay) {
            this.graceDelay = graceDelay;
        }

        public Duration getMisfireGrace() {
            return misfireGrace;
        }

        public void setMisfireGrace(Duration misfireGrace) {
            this.misfireGrace = misfireGrace;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
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
    }

    public static class Recovery {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 256;
        private Duration ttl = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String description;
        private String interval;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", description='" + description + '\'' +
                    ", interval='" + interval + '\'' +
                    '}';
        }
    }
}
