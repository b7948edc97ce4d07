package com.rapidlayout.cell;

public enum ConstraintKind {
    // binds the owning cell's own corners
    SELF,
    // binds one cell, coordinates spelled x1|y1|x2|y2
    ABSOLUTE,
    // binds a subject cell (s-prefix) against an object cell (o-prefix)
    RELATIVE;

    public boolean hasObject() {
        return this == RELATIVE;
    }
}
