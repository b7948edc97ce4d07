package com.rapidlayout.constraint;

import com.rapidlayout.LayoutException;

public class GrammarException extends LayoutException {

    private static final long serialVersionUID = 1L;

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
