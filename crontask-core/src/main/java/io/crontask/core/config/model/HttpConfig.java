package io.crontask.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpConfig(int requestTimeoutSeconds) {

    public static HttpConfig defaults() {
        return new HttpConfig(10);
    }

    @JsonIgnore
    public Duration requestTimeout() {
        if (requestTimeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                "http.requestTimeoutSeconds must be positive, got " + requestTimeoutSeconds
            );
        }
        return Duration.ofSeconds(requestTimeoutSeconds);
    }
}
