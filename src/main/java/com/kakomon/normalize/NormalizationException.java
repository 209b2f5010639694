package com.kakomon.normalize;

/**
 * A single record could not be mapped to canonical values, e.g. an unsupported era.
 */
public class NormalizationException extends Exception {
    public NormalizationException(String message) {
        super(message);
    }
}
