package com.rapidlayout.cell;

import java.util.Collection;

public final class BoundingBox {

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public BoundingBox(int x1, int y1, int x2, int y2) {
        if (x2 <= x1 || y2 <= y1) {
            throw new IllegalArgumentException(
                String.format("Degenerated box [%d, %d, %d, %d]: x2 > x1 and y2 > y1 are required", x1, y1, x2, y2));
        }
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public static BoundingBox of(int x1, int y1, int x2, int y2) {
        return new BoundingBox(x1, y1, x2, y2);
    }

    public static BoundingBox ofSize(int x1, int y1, int width, int height) {
        return new BoundingBox(x1, y1, x1 + width, y1 + height);
    }

    public static BoundingBox enclosing(Collection<BoundingBox> boxes) {
        assert !boxes.isEmpty();
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int maxY = Integer.MIN_VALUE;
        for (BoundingBox box : boxes) {
            minX = Math.min(minX, box.x1);
            minY = Math.min(minY, box.y1);
            maxX = Math.max(maxX, box.x2);
            maxY = Math.max(maxY, box.y2);
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    public int getX1() {
        return x1;
    }

    public int getY1() {
        return y1;
    }

    public int getX2() {
        return x2;
    }

    public int getY2() {
        return y2;
    }

    public int getWidth() {
        return x2 - x1;
    }

    public int getHeight() {
        return y2 - y1;
    }

    public BoundingBox translate(int dx, int dy) {
        return new BoundingBox(x1 + dx, y1 + dy, x2 + dx, y2 + dy);
    }

    public BoundingBox moveTo(int newX1, int newY1) {
        return translate(newX1 - x1, newY1 - y1);
    }

    public boolean contains(BoundingBox other) {
        return x1 <= other.x1 && y1 <= other.y1 && x2 >= other.x2 && y2 >= other.y2;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BoundingBox)) {
            return false;
        }
        BoundingBox other = (BoundingBox) obj;
        return x1 == other.x1 && y1 == other.y1 && x2 == other.x2 && y2 == other.y2;
    }

    @Override
    public int hashCode() {
        int result = x1;
        result = 31 * result + y1;
        result = 31 * result + x2;
        result = 31 * result + y2;
        return result;
    }

    @Override
    public String toString() {
        return String.format("[%d, %d, %d, %d]", x1, y1, x2, y2);
    }
}
