package io.crontask.core.execution;

public record HttpCallResult(int statusCode, String body, long elapsedMs) {
    public HttpCallResult {
        body = body == null ? "" : body;
    }
}
