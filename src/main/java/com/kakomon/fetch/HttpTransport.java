package com.kakomon.fetch;

import java.io.IOException;
import java.time.Duration;

/**
 * Single network exchange without retry, throttle or cache. Non-2xx statuses are returned, not thrown.
 */
public interface HttpTransport {

    TransportResponse send(FetchRequest request, Duration timeout) throws IOException, InterruptedException;
}
