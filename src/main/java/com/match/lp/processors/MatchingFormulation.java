package com.match.lp.processors;

import com.match.lp.models.Edge;
import com.match.lp.models.enums.SolveStatus;
import com.match.lp.solver.DecisionVariable;
import com.match.lp.solver.LinearModel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A built matching program: the solver model plus one variable per edge, in edge-list order.
 */
@Getter
public class MatchingFormulation {

    private final LinearModel model;
    private final Map<Edge, DecisionVariable> variables;
    private final int vertexCount;
    private final boolean integral;

    MatchingFormulation(LinearModel model, Map<Edge, DecisionVariable> variables, int vertexCount, boolean integral) {
        this.model = model;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.vertexCount = vertexCount;
        this.integral = integral;
    }

    public List<Edge> edges() {
        return List.copyOf(variables.keySet());
    }

    public SolveStatus solve() {
        return model.solve();
    }

    /**
     * Edge to variable value, in edge-list order. Only valid after a solve that produced a solution.
     */
    public Map<Edge, Double> readSolution() {
        Map<Edge, Double> solution = new LinkedHashMap<>();
        variables.forEach((edge, variable) -> solution.put(edge, model.value(variable)));
        return solution;
    }

    public double objectiveValue() {
        return model.objectiveValue();
    }
}
