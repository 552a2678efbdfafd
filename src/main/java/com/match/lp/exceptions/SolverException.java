package com.match.lp.exceptions;

/**
 * Exception thrown when the optimization backend fails or returns an assignment that is not a matching.
 */
public class SolverException extends MatchingException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
