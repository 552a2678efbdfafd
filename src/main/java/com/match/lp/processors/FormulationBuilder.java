package com.match.lp.processors;

import com.match.lp.models.Edge;
import com.match.lp.models.Graph;
import com.match.lp.models.WeightMatrix;
import com.match.lp.models.enums.VariableDomain;
import com.match.lp.solver.DecisionVariable;
import com.match.lp.solver.LinearModel;
import com.match.lp.solver.LinearSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a graph and its normalized weights into the matching program
 * <pre>
 *   max  sum_e w[src(e), dst(e)] * x_e
 *   s.t. sum of x_e over edges incident to i  &lt;= 1   for every vertex i
 *        0 &lt;= x_e &lt;= 1
 * </pre>
 * Variables stay continuous on bipartite graphs, whose matching polytope is integral. Any other graph
 * needs integer variables, and therefore a MIP solve, for the optimum to be a matching.
 */
@Slf4j
@Component
public class FormulationBuilder {

    public MatchingFormulation build(Graph graph, WeightMatrix weights, LinearSolver solver) {
        boolean bipartite = graph.isBipartite();
        VariableDomain domain = bipartite ? VariableDomain.CONTINUOUS : VariableDomain.INTEGER;
        LinearModel model = solver.newModel();

        Map<Edge, DecisionVariable> variables = new LinkedHashMap<>();
        Map<DecisionVariable, Double> objective = new LinkedHashMap<>();
        for (Edge edge : graph.edges()) {
            DecisionVariable x = model.addVariable("x_" + edge.getSrc() + "_" + edge.getDst(), 0.0, 1.0, domain);
            variables.put(edge, x);
            objective.put(x, weights.get(edge.getSrc(), edge.getDst()));
        }
        model.maximize(objective);

        int constraints = 0;
        for (int i = 1; i <= graph.vertexCount(); i++) {
            Map<DecisionVariable, Double> incident = new LinkedHashMap<>();
            for (int j : graph.neighbors(i)) {
                incident.put(variables.get(Edge.of(i, j)), 1.0);
            }
            // isolated vertex
            if (incident.isEmpty()) {
                continue;
            }
            model.addConstraint("deg_" + i, incident, 1.0);
            constraints++;
        }

        log.debug("Built {} formulation on {}: variables={}, degreeConstraints={}",
                bipartite ? "LP relaxation" : "integer", solver.name(), variables.size(), constraints);
        return new MatchingFormulation(model, variables, graph.vertexCount(), !bipartite);
    }
}
