package com.match.lp.solver;

import com.match.lp.models.enums.SolveStatus;
import com.match.lp.models.enums.VariableDomain;
import org.junit.jupiter.api.Test;
import org.ojalgo.optimisation.Optimisation;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OjAlgoLinearSolverTest {

    private final LinearSolver solver = new OjAlgoLinearSolver();

    @Test
    void solvesContinuousProgram() {
        LinearModel model = solver.newModel();
        DecisionVariable x = model.addVariable("x", 0, 1, VariableDomain.CONTINUOUS);
        DecisionVariable y = model.addVariable("y", 0, 1, VariableDomain.CONTINUOUS);
        model.maximize(Map.of(x, 2.0, y, 3.0));
        model.addConstraint("cap", Map.of(x, 1.0, y, 2.0), 2.0);

        SolveStatus status = model.solve();

        assertThat(status).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(model.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(model.value(y)).isCloseTo(0.5, within(1e-6));
        assertThat(model.value(x)).isCloseTo(1.0, within(1e-6));
        assertThat(model.objectiveValue()).isCloseTo(3.5, within(1e-6));
    }

    @Test
    void integerVariablesDoNotTakeFractionalValues() {
        LinearModel model = solver.newModel();
        DecisionVariable a = model.addVariable("a", 0, 1, VariableDomain.INTEGER);
        DecisionVariable b = model.addVariable("b", 0, 1, VariableDomain.INTEGER);
        DecisionVariable c = model.addVariable("c", 0, 1, VariableDomain.INTEGER);
        model.maximize(Map.of(a, 1.0, b, 1.0, c, 1.0));
        model.addConstraint("ab", Map.of(a, 1.0, b, 1.0), 1.0);
        model.addConstraint("bc", Map.of(b, 1.0, c, 1.0), 1.0);
        model.addConstraint("ac", Map.of(a, 1.0, c, 1.0), 1.0);

        assertThat(model.solve()).isEqualTo(SolveStatus.OPTIMAL);

        double total = model.value(a) + model.value(b) + model.value(c);
        assertThat(total).isCloseTo(1.0, within(1e-6));
        assertThat(model.objectiveValue()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void readingBeforeSolveFails() {
        LinearModel model = solver.newModel();
        DecisionVariable x = model.addVariable("x", 0, 1, VariableDomain.CONTINUOUS);

        assertThat(model.status()).isNull();
        assertThatThrownBy(() -> model.value(x)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(model::objectiveValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsVariablesFromAnotherModel() {
        LinearModel first = solver.newModel();
        LinearModel second = solver.newModel();
        DecisionVariable foreign = first.addVariable("x_1_2", 0, 1, VariableDomain.CONTINUOUS);

        assertThatThrownBy(() -> second.maximize(Map.of(foreign, 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mapsSolverStates() {
        assertThat(OjAlgoLinearSolver.toStatus(Optimisation.State.OPTIMAL)).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(OjAlgoLinearSolver.toStatus(Optimisation.State.FEASIBLE)).isEqualTo(SolveStatus.FEASIBLE);
        assertThat(OjAlgoLinearSolver.toStatus(Optimisation.State.INFEASIBLE)).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(OjAlgoLinearSolver.toStatus(Optimisation.State.UNBOUNDED)).isEqualTo(SolveStatus.UNBOUNDED);
        assertThat(OjAlgoLinearSolver.toStatus(Optimisation.State.FAILED)).isEqualTo(SolveStatus.ERROR);
    }
}
