package com.kakomon.extract;

/**
 * A response could not be read as the expected shape. Recoverable per response.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
