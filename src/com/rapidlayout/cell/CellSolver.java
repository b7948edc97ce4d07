package com.rapidlayout.cell;

@FunctionalInterface
public interface CellSolver {
    boolean solve(Cell root);
}
