package com.kakomon.fetch;

/**
 * The server kept answering 429 until the retry budget ran out.
 */
public class RateLimitException extends NetworkException {

    public RateLimitException(String url, int attempts) {
        super("rate limited after " + attempts + " attempts: " + url, url, 429, true);
    }
}
