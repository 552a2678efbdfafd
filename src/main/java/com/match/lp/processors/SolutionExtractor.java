package com.match.lp.processors;

import com.google.common.base.Preconditions;
import com.match.lp.config.ExtractionConfig;
import com.match.lp.exceptions.FractionalSolutionException;
import com.match.lp.exceptions.SolverException;
import com.match.lp.models.Edge;
import com.match.lp.models.MatchingResult;
import com.match.lp.models.enums.FractionalValuePolicy;
import com.match.lp.models.enums.SolveStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Reads a matching back out of the solver's edge variable values.
 * <p>
 * An edge is selected when its value is at least {@code 1 - tolerance}. Values within {@code tolerance} of
 * zero are unselected; anything in between is handled by the configured {@link FractionalValuePolicy}.
 * </p>
 */
@Slf4j
public class SolutionExtractor {

    private final double tolerance;
    private final FractionalValuePolicy fractionalPolicy;

    public SolutionExtractor(ExtractionConfig config) {
        Preconditions.checkArgument(config.getTolerance() >= 0 && config.getTolerance() < 0.5,
                "Tolerance must be in [0, 0.5): %s", config.getTolerance());
        this.tolerance = config.getTolerance();
        this.fractionalPolicy = config.getFractionalPolicy();
    }

    public MatchingResult extract(MatchingFormulation formulation, SolveStatus status) {
        if (!status.hasSolution()) {
            log.warn("Solver returned {}, no matching extracted for {} vertices", status, formulation.getVertexCount());
            return MatchingResult.unsolved(status, formulation.getVertexCount());
        }
        return extract(formulation.getVertexCount(), formulation.readSolution(), formulation.objectiveValue(), status);
    }

    public MatchingResult extract(int vertexCount, Map<Edge, Double> solution, double objectiveValue, SolveStatus status) {
        if (!status.hasSolution()) {
            return MatchingResult.unsolved(status, vertexCount);
        }

        int[] mate = MatchingResult.unmatchedMates(vertexCount);
        for (Map.Entry<Edge, Double> entry : solution.entrySet()) {
            Edge edge = entry.getKey();
            double value = entry.getValue();
            if (value >= 1 - tolerance) {
                select(mate, edge, value);
            } else if (value > tolerance) {
                onFractional(edge, value);
            }
        }
        return MatchingResult.of(status, objectiveValue, mate);
    }

    private void select(int[] mate, Edge edge, double value) {
        int u = edge.getSrc();
        int v = edge.getDst();
        if (mate[u - 1] != MatchingResult.UNMATCHED || mate[v - 1] != MatchingResult.UNMATCHED) {
            throw new SolverException("Edge " + edge + " (value " + value + ") shares a vertex with an already selected edge");
        }
        mate[u - 1] = v;
        mate[v - 1] = u;
    }

    private void onFractional(Edge edge, double value) {
        if (fractionalPolicy == FractionalValuePolicy.REJECT) {
            throw new FractionalSolutionException(edge, value, tolerance);
        }
        log.warn("Discarding edge {} with fractional value {}", edge, value);
    }
}
