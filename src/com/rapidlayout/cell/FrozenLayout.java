package com.rapidlayout.cell;

public final class FrozenLayout {

    private final BoundingBox frozenBox;

    FrozenLayout(BoundingBox frozenBox) {
        this.frozenBox = frozenBox;
    }

    public BoundingBox getFrozenBox() {
        return frozenBox;
    }

    public int getWidth() {
        return frozenBox.getWidth();
    }

    public int getHeight() {
        return frozenBox.getHeight();
    }

    @Override
    public String toString() {
        return "FrozenLayout" + frozenBox;
    }
}
