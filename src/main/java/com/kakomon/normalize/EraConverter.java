package com.kakomon.normalize;

import java.text.Normalizer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Japanese era labels to Gregorian years. Only 令和 and 平成 are supported; exam sessions
 * older than 平成 are not published by the source.
 */
public final class EraConverter {
    private static final int REIWA_OFFSET = 2018;
    private static final int HEISEI_OFFSET = 1988;

    private static final Pattern SUPPORTED_ERA = Pattern.compile("(令和|平成)\\s*(元|\\d{1,2})");
    private static final Pattern OTHER_ERA = Pattern.compile("昭和|大正|明治");
    private static final Pattern GREGORIAN = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");

    private EraConverter() {
    }

    public static int toGregorian(String label) throws NormalizationException {
        if (label == null || label.isBlank()) {
            throw new NormalizationException("missing year label");
        }
        String text = Normalizer.normalize(label, Normalizer.Form.NFKC).trim();

        Matcher era = SUPPORTED_ERA.matcher(text);
        if (era.find()) {
            int offset = era.group(1).equals("令和") ? REIWA_OFFSET : HEISEI_OFFSET;
            String number = era.group(2);
            int n = number.equals("元") ? 1 : Integer.parseInt(number);
            if (n < 1) {
                throw new NormalizationException("invalid era year: " + label);
            }
            return offset + n;
        }
        if (OTHER_ERA.matcher(text).find()) {
            throw new NormalizationException("unsupported era: " + label);
        }
        Matcher year = GREGORIAN.matcher(text);
        if (year.find()) {
            return Integer.parseInt(year.group(1));
        }
        throw new NormalizationException("unable to parse year from label: " + label);
    }

    /**
     * Same as {@link #toGregorian(String)} but falls back to {@code fallbackYear} when the label is blank.
     */
    public static int toGregorian(String label, int fallbackYear) throws NormalizationException {
        if ((label == null || label.isBlank()) && fallbackYear > 0) {
            return fallbackYear;
        }
        return toGregorian(label);
    }
}
