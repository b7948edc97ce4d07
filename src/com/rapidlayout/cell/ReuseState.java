package com.rapidlayout.cell;

public enum ReuseState {
    PLAIN,
    // opaque unit of fixed size, descendants hidden from later solves
    FROZEN,
    // repositionable unit, descendants replayed from cached offsets
    FIXED;
}
