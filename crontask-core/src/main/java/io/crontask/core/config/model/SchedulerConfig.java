package io.crontask.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(String timezone, int misfireGraceSeconds) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("Asia/Shanghai", 60);
    }

    @JsonIgnore
    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    @JsonIgnore
    public Duration misfireGrace() {
        return Duration.ofSeconds(Math.max(0, misfireGraceSeconds));
    }
}
