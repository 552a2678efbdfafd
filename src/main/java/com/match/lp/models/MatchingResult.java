package com.match.lp.models;

import com.match.lp.models.enums.SolveStatus;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a matching solve: the solver status, the objective value and each vertex's mate.
 * <p>
 * {@code mate[i - 1]} holds the partner of vertex {@code i}, or {@link #UNMATCHED}. The mate array is
 * validated to be symmetric on construction and never exposed directly.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MatchingResult {

    public static final int UNMATCHED = -1;

    private final SolveStatus status;
    private final double cost;
    @Getter(AccessLevel.NONE)
    private final int[] mate;

    private MatchingResult(SolveStatus status, double cost, int[] mate) {
        this.status = Objects.requireNonNull(status, "status");
        this.cost = cost;
        this.mate = mate.clone();
        checkSymmetric(this.mate);
    }

    public static MatchingResult of(SolveStatus status, double cost, int[] mate) {
        return new MatchingResult(status, cost, mate);
    }

    /**
     * Result for a solve that produced no usable assignment: every vertex unmatched, zero cost.
     */
    public static MatchingResult unsolved(SolveStatus status, int vertexCount) {
        return new MatchingResult(status, 0.0, unmatchedMates(vertexCount));
    }

    public static int[] unmatchedMates(int vertexCount) {
        int[] mate = new int[vertexCount];
        Arrays.fill(mate, UNMATCHED);
        return mate;
    }

    public int[] getMate() {
        return mate.clone();
    }

    public int vertexCount() {
        return mate.length;
    }

    public int mateOf(int vertex) {
        if (vertex < 1 || vertex > mate.length) {
            throw new IllegalArgumentException("Vertex " + vertex + " outside 1.." + mate.length);
        }
        return mate[vertex - 1];
    }

    public boolean isMatched(int vertex) {
        return mateOf(vertex) != UNMATCHED;
    }

    public boolean isSolved() {
        return status.hasSolution();
    }

    /**
     * Matched pairs as canonical edges, ascending.
     */
    public List<Edge> matchedEdges() {
        List<Edge> pairs = new ArrayList<>();
        for (int v = 1; v <= mate.length; v++) {
            int partner = mate[v - 1];
            if (partner != UNMATCHED && v < partner) {
                pairs.add(Edge.of(v, partner));
            }
        }
        return pairs;
    }

    private static void checkSymmetric(int[] mate) {
        for (int v = 1; v <= mate.length; v++) {
            int partner = mate[v - 1];
            if (partner == UNMATCHED) {
                continue;
            }
            if (partner < 1 || partner > mate.length || partner == v || mate[partner - 1] != v) {
                throw new IllegalArgumentException("Mate array is not a valid matching at vertex " + v);
            }
        }
    }
}
