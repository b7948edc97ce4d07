package com.rapidlayout.solver;

public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    MODEL_INVALID,
    UNKNOWN;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
