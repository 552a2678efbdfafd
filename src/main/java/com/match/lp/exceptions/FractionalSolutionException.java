package com.match.lp.exceptions;

import com.match.lp.models.Edge;

/**
 * Thrown when the solver assigns an edge variable a value that is neither selected nor unselected
 * within tolerance.
 */
public class FractionalSolutionException extends MatchingException {

    public FractionalSolutionException(Edge edge, double value, double tolerance) {
        super("Edge " + edge + " has fractional value " + value + " (tolerance " + tolerance + ")");
    }
}
