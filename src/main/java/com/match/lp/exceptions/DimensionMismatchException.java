package com.match.lp.exceptions;

/**
 * Thrown when a weight matrix does not have one row and one column per graph vertex.
 */
public class DimensionMismatchException extends MatchingException {

    public DimensionMismatchException(int matrixSize, int vertexCount) {
        super("Weight matrix is " + matrixSize + "x" + matrixSize + " but the graph has " + vertexCount + " vertices");
    }
}
