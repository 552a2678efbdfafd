package com.match.lp.solver;

import com.match.lp.models.enums.SolveStatus;
import com.match.lp.models.enums.VariableDomain;

import java.util.Map;

/**
 * A single linear or mixed-integer program under construction, then solved once.
 */
public interface LinearModel {

    DecisionVariable addVariable(String name, double lowerBound, double upperBound, VariableDomain domain);

    /**
     * Sets the objective to maximize {@code sum(coefficient * variable)}.
     */
    void maximize(Map<DecisionVariable, Double> coefficients);

    /**
     * Adds {@code sum(coefficient * variable) <= upperBound}.
     */
    void addConstraint(String name, Map<DecisionVariable, Double> coefficients, double upperBound);

    SolveStatus solve();

    /**
     * Status of the last {@link #solve()}; {@code null} before the model was solved.
     */
    SolveStatus status();

    double value(DecisionVariable variable);

    double objectiveValue();
}
