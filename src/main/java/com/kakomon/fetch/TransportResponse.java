package com.kakomon.fetch;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class TransportResponse {
    public final int statusCode;
    public final String body;
    public final Map<String, List<String>> headers;

    public TransportResponse(int statusCode, String body, Map<String, List<String>> headers) {
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, body, Map.of());
    }

    public Optional<String> header(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String target = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null
                    && entry.getKey().toLowerCase(Locale.ROOT).equals(target)
                    && !entry.getValue().isEmpty()) {
                return Optional.ofNullable(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    public boolean isSuccess() {
        return statusCode / 100 == 2;
    }
}
