package com.kakomon.fetch;

import java.util.ArrayList;
import java.util.List;

public final class RecordingSleeper implements Sleeper {
    private final List<Long> sleeps = new ArrayList<>();

    @Override
    public synchronized void sleep(long millis) {
        sleeps.add(millis);
    }

    public synchronized List<Long> sleeps() {
        return new ArrayList<>(sleeps);
    }
}
