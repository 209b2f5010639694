package com.kakomon.fetch;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class CacheEntry {
    public final String key;
    public final String signature;
    public final String body;
    public final Instant fetchedAt;
}
