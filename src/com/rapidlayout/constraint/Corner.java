package com.rapidlayout.constraint;

public enum Corner {
    X1(0),
    Y1(1),
    X2(2),
    Y2(3);

    private final int slot;

    Corner(int slot) {
        this.slot = slot;
    }

    public int getSlot() {
        return slot;
    }

    public String getToken() {
        return name().toLowerCase();
    }

    public static Corner fromToken(String token) {
        switch (token) {
            case "x1":
                return X1;
            case "y1":
                return Y1;
            case "x2":
                return X2;
            case "y2":
                return Y2;
            default:
                return null;
        }
    }
}
