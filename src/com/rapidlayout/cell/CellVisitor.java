package com.rapidlayout.cell;

public interface CellVisitor {

    default boolean enterCell(Cell cell, int depth) {
        return true;
    }

    default void visitConstraint(Cell owner, Constraint constraint) {
    }

    default void exitCell(Cell cell, int depth) {
    }
}
