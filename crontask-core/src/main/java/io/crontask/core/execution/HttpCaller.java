package io.crontask.core.execution;

import io.crontask.core.job.HttpMethod;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

@FunctionalInterface
public interface HttpCaller {
    HttpCallResult send(
        HttpMethod method,
        String url,
        Map<String, String> headers,
        String body,
        Duration timeout
    ) throws IOException;
}
