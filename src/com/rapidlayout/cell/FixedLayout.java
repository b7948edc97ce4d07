package com.rapidlayout.cell;

import java.util.HashMap;
import java.util.Map;

public final class FixedLayout {

    public static final class Offset {
        private final int dx;
        private final int dy;
        private final int width;
        private final int height;

        Offset(int dx, int dy, int width, int height) {
            this.dx = dx;
            this.dy = dy;
            this.width = width;
            this.height = height;
        }

        public int getDx() {
            return dx;
        }

        public int getDy() {
            return dy;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }

        public BoundingBox placeAt(int originX, int originY) {
            return BoundingBox.ofSize(originX + dx, originY + dy, width, height);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Offset)) {
                return false;
            }
            Offset other = (Offset) obj;
            return dx == other.dx && dy == other.dy && width == other.width && height == other.height;
        }

        @Override
        public int hashCode() {
            return ((dx * 31 + dy) * 31 + width) * 31 + height;
        }

        @Override
        public String toString() {
            return String.format("(dx=%d, dy=%d, w=%d, h=%d)", dx, dy, width, height);
        }
    }

    private final int width;
    private final int height;
    private final Map<Long, Offset> id2Offset;

    private FixedLayout(int width, int height, Map<Long, Offset> id2Offset) {
        this.width = width;
        this.height = height;
        this.id2Offset = id2Offset;
    }

    static FixedLayout capture(Cell anchor) {
        BoundingBox anchorBox = anchor.getBox();
        assert anchorBox != null;

        Map<Long, Offset> id2Offset = new HashMap<>();
        for (Cell descendant : anchor.collectReachable()) {
            if (descendant == anchor) continue;

            BoundingBox box = descendant.getBox();
            assert box != null : "Descendant " + descendant.getName() + " is unresolved";
            Offset offset = new Offset(
                box.getX1() - anchorBox.getX1(),
                box.getY1() - anchorBox.getY1(),
                box.getWidth(),
                box.getHeight()
            );
            id2Offset.put(descendant.getId(), offset);
        }
        return new FixedLayout(anchorBox.getWidth(), anchorBox.getHeight(), id2Offset);
    }

    FixedLayout remap(Map<Long, Long> oldId2NewId) {
        Map<Long, Offset> newId2Offset = new HashMap<>();
        for (Map.Entry<Long, Offset> entry : id2Offset.entrySet()) {
            Long newId = oldId2NewId.get(entry.getKey());
            if (newId != null) {
                newId2Offset.put(newId, entry.getValue());
            }
        }
        return new FixedLayout(width, height, newId2Offset);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Offset getOffset(Cell descendant) {
        return id2Offset.get(descendant.getId());
    }

    public boolean hasOffset(Cell descendant) {
        return id2Offset.containsKey(descendant.getId());
    }

    public int size() {
        return id2Offset.size();
    }

    @Override
    public String toString() {
        return String.format("FixedLayout(%dx%d, %d offsets)", width, height, id2Offset.size());
    }
}
