package com.kakomon.fetch;

public final class FetchResult {
    public final String body;
    public final boolean fromCache;
    public final int attempts;
    public final int statusCode;

    private FetchResult(String body, boolean fromCache, int attempts, int statusCode) {
        this.body = body == null ? "" : body;
        this.fromCache = fromCache;
        this.attempts = Math.max(0, attempts);
        this.statusCode = statusCode;
    }

    public static FetchResult cached(String body) {
        return new FetchResult(body, true, 0, 200);
    }

    public static FetchResult network(String body, int attempts, int statusCode) {
        return new FetchResult(body, false, attempts, statusCode);
    }
}
