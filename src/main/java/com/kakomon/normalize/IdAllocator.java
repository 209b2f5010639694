package com.kakomon.normalize;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds stable ids {@code <prefix>-q<NNN>} and hands out the next free sequence per prefix
 * for records the source did not number.
 */
public final class IdAllocator {
    private static final Pattern ID = Pattern.compile("^(.+)-q(\\d+)$");

    private final Map<String, Integer> highest = new HashMap<>();

    public static String format(String prefix, int sequence) {
        return String.format("%s-q%03d", prefix, sequence);
    }

    /**
     * Registers already used ids so allocation continues after them.
     */
    public synchronized void seed(Collection<String> existingIds) {
        if (existingIds == null) {
            return;
        }
        for (String id : existingIds) {
            reserve(id);
        }
    }

    /**
     * Marks {@code id} as taken; later allocations for its prefix continue after it.
     */
    public synchronized void reserve(String id) {
        Matcher m = ID.matcher(id == null ? "" : id);
        if (m.matches()) {
            try {
                observe(m.group(1), Integer.parseInt(m.group(2)));
            } catch (NumberFormatException ignored) {
                // sequence too large to be one of ours
            }
        }
    }

    public synchronized String idFor(String prefix, Integer sourceSequence) {
        if (sourceSequence != null && sourceSequence > 0) {
            observe(prefix, sourceSequence);
            return format(prefix, sourceSequence);
        }
        int next = highest.getOrDefault(prefix, 0) + 1;
        highest.put(prefix, next);
        return format(prefix, next);
    }

    private void observe(String prefix, int sequence) {
        highest.merge(prefix, sequence, Math::max);
    }
}
