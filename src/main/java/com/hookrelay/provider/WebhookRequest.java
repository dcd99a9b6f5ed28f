package com.hookrelay.provider;

import jakarta.servlet.http.HttpServletRequest;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable snapshot of an inbound webhook: content type, headers and raw body.
 *
 * Providers only ever see this snapshot, never the servlet request, so the same
 * bytes always transform to the same result. Header lookup is case-insensitive
 * (names are stored lower-cased) and keeps the first value of repeated headers.
 */
@Getter
@EqualsAndHashCode
public final class WebhookRequest {

    private final String contentType;
    private final Map<String, String> headers;
    private final byte[] body;

    @Builder
    private WebhookRequest(String contentType, @Singular Map<String, String> headers, byte[] body) {
        Map<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, value) -> normalized.putIfAbsent(name.toLowerCase(Locale.ROOT), value));
        this.contentType = contentType;
        this.headers = Collections.unmodifiableMap(normalized);
        this.body = body == null ? new byte[0] : body.clone();
    }

    public static WebhookRequest from(HttpServletRequest request) throws IOException {
        WebhookRequestBuilder builder = WebhookRequest.builder()
                .contentType(request.getContentType())
                .body(request.getInputStream().readAllBytes());
        for (String name : Collections.list(request.getHeaderNames())) {
            builder.header(name, request.getHeader(name));
        }
        return builder.build();
    }

    /** Header value, or null when absent. */
    public String header(String name) {
        return headers.get(name);
    }

    public byte[] getBody() {
        return body.clone();
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
