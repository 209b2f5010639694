package com.kakomon.dataset;

import java.util.Locale;

/**
 * Which record survives when an incoming id collides with an existing one.
 */
public enum MergePolicy {
    /** The incoming record replaces the existing one entirely. */
    PREFER_NEW("preferNew"),
    /** The existing record is kept unchanged. */
    PREFER_EXISTING("preferExisting");

    private final String cliName;

    MergePolicy(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    /**
     * Accepts {@code preferNew}/{@code preferExisting} and the enum names, case-insensitively.
     */
    public static MergePolicy parse(String raw) {
        String key = raw == null ? "" : raw.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (MergePolicy policy : values()) {
            if (policy.cliName.toLowerCase(Locale.ROOT).equals(key)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("unknown merge policy: " + raw + " (expected preferNew or preferExisting)");
    }
}
