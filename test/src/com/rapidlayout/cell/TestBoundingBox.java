package com.rapidlayout.cell;

import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestBoundingBox {

    @Test
    public void testDegeneratedBoxRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0, 0, 0, 10));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0, 5, 10, 4));
    }

    @Test
    public void testSizeAndTranslate() {
        BoundingBox box = BoundingBox.ofSize(3, 4, 10, 20);
        Assertions.assertEquals(13, box.getX2());
        Assertions.assertEquals(24, box.getY2());
        Assertions.assertEquals(10, box.getWidth());
        Assertions.assertEquals(20, box.getHeight());

        BoundingBox moved = box.moveTo(50, 0);
        Assertions.assertEquals(BoundingBox.of(50, 0, 60, 20), moved);
        Assertions.assertEquals(BoundingBox.of(4, 2, 14, 22), box.translate(1, -2));
    }

    @Test
    public void testEnclosing() {
        BoundingBox a = BoundingBox.of(0, 5, 10, 15);
        BoundingBox b = BoundingBox.of(20, 0, 30, 8);
        BoundingBox enclosing = BoundingBox.enclosing(Arrays.asList(a, b));
        Assertions.assertEquals(BoundingBox.of(0, 0, 30, 15), enclosing);
        Assertions.assertTrue(enclosing.contains(a));
        Assertions.assertTrue(enclosing.contains(b));
        Assertions.assertFalse(a.contains(enclosing));
    }

    @Test
    public void testToString() {
        Assertions.assertEquals("[1, 2, 3, 4]", BoundingBox.of(1, 2, 3, 4).toString());
    }
}
