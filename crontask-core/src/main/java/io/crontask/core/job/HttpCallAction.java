package io.crontask.core.job;

import java.util.Map;
import java.util.Objects;

public record HttpCallAction(
    HttpMethod method,
    String url,
    Map<String, String> headers,
    String body
) implements JobAction {
    public HttpCallAction {
        method = method == null ? HttpMethod.GET : method;
        url = Objects.requireNonNull(url, "url must not be null").trim();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
