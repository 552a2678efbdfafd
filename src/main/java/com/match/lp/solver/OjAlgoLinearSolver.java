package com.match.lp.solver;

import com.match.lp.exceptions.SolverException;
import com.match.lp.models.enums.SolveStatus;
import com.match.lp.models.enums.VariableDomain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link LinearSolver} running on ojAlgo's {@link ExpressionsBasedModel}, which picks its LP or
 * integer solver depending on whether any variable is integer.
 */
@Slf4j
@RequiredArgsConstructor
public class OjAlgoLinearSolver implements LinearSolver {

    /** Zero or negative means no limit. */
    private final long timeLimitMillis;

    public OjAlgoLinearSolver() {
        this(0L);
    }

    @Override
    public LinearModel newModel() {
        return new OjAlgoModel(timeLimitMillis);
    }

    @Override
    public String name() {
        return "ojAlgo";
    }

    static SolveStatus toStatus(Optimisation.State state) {
        if (state == Optimisation.State.INFEASIBLE) {
            return SolveStatus.INFEASIBLE;
        }
        if (state == Optimisation.State.UNBOUNDED) {
            return SolveStatus.UNBOUNDED;
        }
        if (state.isOptimal()) {
            return SolveStatus.OPTIMAL;
        }
        if (state.isFeasible()) {
            return SolveStatus.FEASIBLE;
        }
        return SolveStatus.ERROR;
    }

    private static final class OjAlgoModel implements LinearModel {

        private final ExpressionsBasedModel model = new ExpressionsBasedModel();
        private final List<Variable> variables = new ArrayList<>();
        private final long timeLimitMillis;
        private Optimisation.Result result;
        private SolveStatus status;

        private OjAlgoModel(long timeLimitMillis) {
            this.timeLimitMillis = timeLimitMillis;
        }

        @Override
        public DecisionVariable addVariable(String name, double lowerBound, double upperBound, VariableDomain domain) {
            Variable variable = model.newVariable(name)
                    .lower(BigDecimal.valueOf(lowerBound))
                    .upper(BigDecimal.valueOf(upperBound));
            if (domain == VariableDomain.INTEGER) {
                variable.integer(true);
            }
            variables.add(variable);
            return DecisionVariable.builder()
                    .index(variables.size() - 1)
                    .name(name)
                    .lowerBound(lowerBound)
                    .upperBound(upperBound)
                    .domain(domain)
                    .build();
        }

        @Override
        public void maximize(Map<DecisionVariable, Double> coefficients) {
            coefficients.forEach((handle, coefficient) ->
                    lookup(handle).weight(BigDecimal.valueOf(coefficient)));
        }

        @Override
        public void addConstraint(String name, Map<DecisionVariable, Double> coefficients, double upperBound) {
            Expression constraint = model.newExpression(name).upper(BigDecimal.valueOf(upperBound));
            coefficients.forEach((handle, coefficient) ->
                    constraint.set(lookup(handle), BigDecimal.valueOf(coefficient)));
        }

        @Override
        public SolveStatus solve() {
            if (timeLimitMillis > 0) {
                model.options.time_abort = timeLimitMillis;
            }
            try {
                result = model.maximise();
            } catch (RuntimeException e) {
                log.error("ojAlgo failed to solve model: variables={}, constraints={}",
                        variables.size(), model.getExpressions().size(), e);
                throw new SolverException("ojAlgo solve failed", e);
            }
            status = toStatus(result.getState());
            log.debug("ojAlgo finished with state {} -> {}, objective={}", result.getState(), status, result.getValue());
            return status;
        }

        @Override
        public SolveStatus status() {
            return status;
        }

        @Override
        public double value(DecisionVariable variable) {
            checkSolved();
            return result.get(variable.getIndex()).doubleValue();
        }

        @Override
        public double objectiveValue() {
            checkSolved();
            return result.getValue();
        }

        private Variable lookup(DecisionVariable handle) {
            int index = handle.getIndex();
            if (index < 0 || index >= variables.size() || !variables.get(index).getName().equals(handle.getName())) {
                throw new IllegalArgumentException("Variable " + handle.getName() + " does not belong to this model");
            }
            return variables.get(index);
        }

        private void checkSolved() {
            if (result == null) {
                throw new IllegalStateException("Model has not been solved");
            }
        }
    }
}
