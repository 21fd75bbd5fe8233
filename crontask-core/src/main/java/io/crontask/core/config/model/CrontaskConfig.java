package io.crontask.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CrontaskConfig(
    ServerConfig server,
    StorageConfig storage,
    SchedulerConfig scheduler,
    HttpConfig http
) {

    public static CrontaskConfig defaults() {
        return new CrontaskConfig(
            ServerConfig.defaults(),
            StorageConfig.defaults(),
            SchedulerConfig.defaults(),
            HttpConfig.defaults()
        );
    }
}
