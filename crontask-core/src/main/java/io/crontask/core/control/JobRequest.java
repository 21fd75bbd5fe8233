package io.crontask.core.control;

import java.util.Map;

public record JobRequest(
    String id,
    String cron,
    String url,
    String method,
    Map<String, String> headers,
    String body
) {
    public JobRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
