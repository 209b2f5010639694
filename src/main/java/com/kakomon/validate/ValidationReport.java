package com.kakomon.validate;

import com.kakomon.dataset.Question;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one validation pass: the accepted batch plus aggregate counts.
 */
public final class ValidationReport {
    public final List<Question> accepted;
    public final int rejected;
    /** Rejections per reason key, see {@link ValidationException}. */
    public final Map<String, Integer> rejectedByReason;
    public final Map<Integer, Integer> perYear;
    public final Map<String, Integer> perCategory;

    public ValidationReport(List<Question> accepted, Map<String, Integer> rejectedByReason) {
        this.accepted = List.copyOf(accepted);
        this.rejectedByReason = Map.copyOf(rejectedByReason);
        int total = 0;
        for (int count : rejectedByReason.values()) {
            total += count;
        }
        this.rejected = total;
        this.perYear = tallyYears(accepted);
        this.perCategory = tallyCategories(accepted);
    }

    public int total() {
        return accepted.size();
    }

    public static Map<Integer, Integer> tallyYears(List<Question> questions) {
        Map<Integer, Integer> out = new TreeMap<>();
        for (Question q : questions) {
            out.merge(q.year, 1, Integer::sum);
        }
        return out;
    }

    public static Map<String, Integer> tallyCategories(List<Question> questions) {
        Map<String, Integer> out = new TreeMap<>();
        for (Question q : questions) {
            out.merge(q.category, 1, Integer::sum);
        }
        return out;
    }
}
