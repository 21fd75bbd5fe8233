package io.crontask.core.execution;

import io.crontask.core.job.HttpMethod;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public final class OkHttpCaller implements HttpCaller {
    private final OkHttpClient client;

    public OkHttpCaller() {
        this(new OkHttpClient());
    }

    public OkHttpCaller(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public HttpCallResult send(
        HttpMethod method,
        String url,
        Map<String, String> headers,
        String body,
        Duration timeout
    ) throws IOException {
        Request.Builder requestBuilder = new Request.Builder().url(url);
        String contentType = null;
        for (Map.Entry<String, String> header : headers.entrySet()) {
            requestBuilder.addHeader(header.getKey(), header.getValue());
            if ("Content-Type".equalsIgnoreCase(header.getKey())) {
                contentType = header.getValue();
            }
        }

        Request request = requestBuilder.method(method.name(), requestBody(method, body, contentType)).build();
        OkHttpClient call = client.newBuilder().callTimeout(timeout).build();

        try (Response response = call.newCall(request).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            long elapsed = Math.max(0, response.receivedResponseAtMillis() - response.sentRequestAtMillis());
            return new HttpCallResult(response.code(), raw, elapsed);
        }
    }

    // GET never carries a body; DELETE carries one only when given.
    private RequestBody requestBody(HttpMethod method, String body, String contentType) {
        if (method == HttpMethod.GET) {
            return null;
        }
        MediaType mediaType = contentType == null ? null : MediaType.parse(contentType);
        if (body == null) {
            return method.requiresBody() ? RequestBody.create(new byte[0], mediaType) : null;
        }
        return RequestBody.create(body, mediaType);
    }
}
