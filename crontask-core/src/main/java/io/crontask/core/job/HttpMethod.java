package io.crontask.core.job;

import java.util.Locale;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    public static HttpMethod parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return GET;
        }
        try {
            return HttpMethod.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("method must be GET/POST/PUT/PATCH/DELETE");
        }
    }

    public boolean requiresBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
