package com.rapidlayout.solver;

import com.rapidlayout.LayoutParams;

public interface SolverBackend {

    SolveResult solve(LayoutModel model, LayoutParams params);

    String getName();
}
