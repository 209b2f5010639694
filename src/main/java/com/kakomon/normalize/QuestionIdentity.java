package com.kakomon.normalize;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Content identity used for convergence tracking: the same question drawn twice hashes the same
 * regardless of which URL or draw number served it.
 */
public final class QuestionIdentity {
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private QuestionIdentity() {
    }

    public static String of(String text, List<String> choices) {
        StringBuilder sb = new StringBuilder(collapse(text));
        if (choices != null) {
            for (String choice : choices) {
                sb.append('\u001f').append(collapse(choice));
            }
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String collapse(String value) {
        return value == null ? "" : SPACES.matcher(value).replaceAll(" ").trim();
    }
}
