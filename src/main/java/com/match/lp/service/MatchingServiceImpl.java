package com.match.lp.service;

import com.match.lp.models.Graph;
import com.match.lp.models.MatchingResult;
import com.match.lp.models.WeightMatrix;
import com.match.lp.models.enums.SolveStatus;
import com.match.lp.processors.FormulationBuilder;
import com.match.lp.processors.MatchingFormulation;
import com.match.lp.processors.SolutionExtractor;
import com.match.lp.processors.WeightMatrixNormalizer;
import com.match.lp.solver.LinearSolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;


@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingServiceImpl implements MatchingService {

    private final LinearSolver linearSolver;
    private final WeightMatrixNormalizer weightMatrixNormalizer;
    private final FormulationBuilder formulationBuilder;
    private final SolutionExtractor solutionExtractor;
    private final MeterRegistry meterRegistry;

    @Override
    public MatchingResult maximumWeightMatching(Graph graph) {
        return maximumWeightMatching(graph, linearSolver, null);
    }

    @Override
    public MatchingResult maximumWeightMatching(Graph graph, WeightMatrix weights) {
        return maximumWeightMatching(graph, linearSolver, weights);
    }

    @Override
    public MatchingResult maximumWeightMatching(Graph graph, LinearSolver solver, WeightMatrix weights) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(solver, "solver");

        WeightMatrix normalized = weightMatrixNormalizer.normalize(
                graph, weights != null ? weights : WeightMatrix.defaultWeights(graph));

        if (graph.edges().isEmpty()) {
            log.info("Graph with {} vertices has no edges, returning empty matching", graph.vertexCount());
            return record(MatchingResult.of(SolveStatus.OPTIMAL, 0.0, MatchingResult.unmatchedMates(graph.vertexCount())));
        }

        MatchingFormulation formulation = formulationBuilder.build(graph, normalized, solver);
        SolveStatus status = Timer.builder("matching_solve_duration")
                .tag("solver", solver.name())
                .tag("formulation", formulation.isIntegral() ? "integer" : "relaxation")
                .register(meterRegistry)
                .record(formulation::solve);

        MatchingResult result = solutionExtractor.extract(formulation, status);
        log.info("Matching on {} vertices / {} edges finished: status={}, pairs={}, cost={}",
                graph.vertexCount(), formulation.getVariables().size(), result.getStatus(),
                result.matchedEdges().size(), result.getCost());
        return record(result);
    }

    private MatchingResult record(MatchingResult result) {
        meterRegistry.counter("matching_results_total", "status", result.getStatus().name()).increment();
        return result;
    }
}
