package app.scapin.memory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "app.memory.worker")
public record WorkerProps(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("UTC") String zone,
        @DefaultValue("50") int maxDailyReviews,
        @DefaultValue("100") int maxDailyRetouches,
        @DefaultValue("5") int maxSessionMinutes,
        @DefaultValue("10") int sleepBetweenReviewsSeconds,
        @DefaultValue("300") int sleepWhenIdleSeconds,
        @DefaultValue("60") int sleepOnErrorSeconds,
        @DefaultValue("60") int ingestionIntervalSeconds,
        @DefaultValue("24") int janitorIntervalHours,
        @DefaultValue("30") int indexRefreshIntervalMinutes,
        @DefaultValue("10") int retoucheBatchSize,
        @DefaultValue("10") int lectureBatchSize,
        @DefaultValue("23") int quietHoursStart,
        @DefaultValue("7") int quietHoursEnd,
        @DefaultValue("6") int digestHour,
        @DefaultValue("20") int digestMaxItems
) {

    public WorkerProps {
        zone = (zone == null || zone.isBlank()) ? "UTC" : zone.trim();
        maxDailyReviews = Math.max(maxDailyReviews, 0);
        maxDailyRetouches = Math.max(maxDailyRetouches, 0);
        maxSessionMinutes = Math.max(maxSessionMinutes, 1);
        sleepBetweenReviewsSeconds = Math.max(sleepBetweenReviewsSeconds, 0);
        sleepWhenIdleSeconds = Math.max(sleepWhenIdleSeconds, 1);
        sleepOnErrorSeconds = Math.max(sleepOnErrorSeconds, 1);
        ingestionIntervalSeconds = Math.max(ingestionIntervalSeconds, 1);
        janitorIntervalHours = Math.max(janitorIntervalHours, 1);
        indexRefreshIntervalMinutes = Math.max(indexRefreshIntervalMinutes, 1);
        retoucheBatchSize = Math.max(retoucheBatchSize, 1);
        lectureBatchSize = Math.max(lectureBatchSize, 1);
        quietHoursStart = Math.floorMod(quietHoursStart, 24);
        quietHoursEnd = Math.floorMod(quietHoursEnd, 24);
        digestHour = Math.floorMod(digestHour, 24);
        digestMaxItems = Math.max(digestMaxItems, 1);
    }

    public static WorkerProps defaults() {
        return new WorkerProps(true, "UTC", 50, 100, 5, 10, 300, 60, 60, 24, 30, 10, 10, 23, 7, 6, 20);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public Duration maxSession() {
        return Duration.ofMinutes(maxSessionMinutes);
    }

    public Duration sleepBetweenReviews() {
        return Duration.ofSeconds(sleepBetweenReviewsSeconds);
    }

    public Duration sleepWhenIdle() {
        return Duration.ofSeconds(sleepWhenIdleSeconds);
    }

    public Duration sleepOnError() {
        return Duration.ofSeconds(sleepOnErrorSeconds);
    }

    public Duration ingestionInterval() {
        return Duration.ofSeconds(ingestionIntervalSeconds);
    }

    public Duration janitorInterval() {
        return Duration.ofHours(janitorIntervalHours);
    }

    public Duration indexRefreshInterval() {
        return Duration.ofMinutes(indexRefreshIntervalMinutes);
    }
}
