package com.rapidlayout.solver;

import com.rapidlayout.LayoutException;

public class SolverUnavailableException extends LayoutException {

    private static final long serialVersionUID = 1L;

    public SolverUnavailableException(String message) {
        super(message);
    }

    public SolverUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
