package com.match.lp.exceptions;

/**
 * Base type for failures raised while formulating, solving or extracting a matching.
 */
public class MatchingException extends RuntimeException {

    /**
     * Constructs a new MatchingException with the specified detail message.
     *
     * @param message the detail message which explains the cause of the exception.
     */
    public MatchingException(String message) {
        super(message);
    }

    /**
     * Constructs a new MatchingException wrapping the failure that caused it.
     *
     * @param message the detail message.
     * @param cause   the underlying failure.
     */
    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
