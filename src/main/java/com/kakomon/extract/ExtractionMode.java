package com.kakomon.extract;

public enum ExtractionMode {
    /** Paginated JSON API, deterministic. */
    API,
    /** Randomized HTML page, one draw per request. */
    HTML
}
