package com.match.lp.models.enums;

public enum SolveStatus {
    OPTIMAL,
    /** A solution that satisfies every constraint, without a proof of optimality. */
    FEASIBLE,
    INFEASIBLE,
    UNBOUNDED,
    ERROR;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
