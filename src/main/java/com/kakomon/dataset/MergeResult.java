package com.kakomon.dataset;

public final class MergeResult {
    public final Dataset merged;
    public final int insertedCount;
    /** Collisions that replaced different content (preferNew only). */
    public final int replacedCount;
    public final int unchangedCount;
    public final boolean changed;

    public MergeResult(Dataset merged, int insertedCount, int replacedCount, int unchangedCount, boolean changed) {
        this.merged = merged;
        this.insertedCount = insertedCount;
        this.replacedCount = replacedCount;
        this.unchangedCount = unchangedCount;
        this.changed = changed;
    }

    @Override
    public String toString() {
        return "inserted=" + insertedCount
                + " replaced=" + replacedCount
                + " unchanged=" + unchangedCount
                + " changed=" + changed
                + " version=" + merged.version;
    }
}
