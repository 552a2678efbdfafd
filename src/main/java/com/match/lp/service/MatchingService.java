package com.match.lp.service;

import com.match.lp.models.Graph;
import com.match.lp.models.MatchingResult;
import com.match.lp.models.WeightMatrix;
import com.match.lp.solver.LinearSolver;

public interface MatchingService {

    /**
     * Maximum-cardinality matching with the configured solver.
     */
    MatchingResult maximumWeightMatching(Graph graph);

    MatchingResult maximumWeightMatching(Graph graph, WeightMatrix weights);

    /**
     * Maximum-weight matching of {@code graph}.
     *
     * @param graph   the graph to match
     * @param solver  backend used for the linear or integer program
     * @param weights weights indexed by vertex pair, normalized in place; {@code null} for unit weights
     * @return the solve status, objective value and mate array
     */
    MatchingResult maximumWeightMatching(Graph graph, LinearSolver solver, WeightMatrix weights);
}
