package com.match.lp.solver;

/**
 * Optimization backend capable of solving linear and mixed-integer programs.
 */
public interface LinearSolver {

    LinearModel newModel();

    String name();
}
