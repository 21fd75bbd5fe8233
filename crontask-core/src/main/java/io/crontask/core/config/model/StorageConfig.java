package io.crontask.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String databasePath) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.crontask/crontask.db");
    }
}
