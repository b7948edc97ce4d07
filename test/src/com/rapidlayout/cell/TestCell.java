package com.rapidlayout.cell;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestCell {

    @Test
    public void testIdsAreUniqueAndIncreasing() {
        Cell a = new Cell("same");
        Cell b = new Cell("same");
        Assertions.assertNotEquals(a.getId(), b.getId());
        Assertions.assertTrue(b.getId() > a.getId());
    }

    @Test
    public void testLeafNeedsLayer() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Cell("m1", " "));
        Cell leaf = new Cell("m1", "metal1");
        Assertions.assertTrue(leaf.isLeaf());
        Assertions.assertEquals("metal1", leaf.getLayerName());
    }

    @Test
    public void testAddChildKeepsOrder() {
        Cell a = new Cell("a", "metal1");
        Cell b = new Cell("b", "poly");
        Cell c = new Cell("c", "via");
        Cell top = new Cell("top", a, b);
        top.addChild(c);
        Assertions.assertEquals(List.of(a, b, c), top.getChildren());
    }

    @Test
    public void testInvalidTreeEdits() {
        Cell leaf = new Cell("m1", "metal1");
        Cell block = new Cell("block", leaf);
        Cell top = new Cell("top", block);

        Assertions.assertThrows(IllegalStateException.class, () -> leaf.addChild(new Cell("x", "poly")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> block.addChild(block));
        Assertions.assertThrows(IllegalArgumentException.class, () -> block.addChild(leaf));
        Assertions.assertThrows(IllegalArgumentException.class, () -> block.addChild(top));
        Assertions.assertEquals(1, block.getChildCount());
    }

    @Test
    public void testConstrainRegistersReferencedCells() {
        Cell top = new Cell("top");
        Cell a = new Cell("a", "metal1");
        Cell b = new Cell("b", "metal1");
        Cell nested = new Cell("nested", "poly");
        Cell block = new Cell("block", nested);
        top.addChild(block);

        top.constrain(a, "sx2+3<ox1", b);
        top.constrain(nested, "x1=5");

        Assertions.assertEquals(List.of(block, a, b), top.getChildren());
        Assertions.assertEquals(2, top.getConstraints().size());

        Constraint relative = top.getConstraints().get(0);
        Assertions.assertEquals(ConstraintKind.RELATIVE, relative.getKind());
        Assertions.assertSame(a, relative.getSubject());
        Assertions.assertSame(b, relative.getObject());

        Constraint absolute = top.getConstraints().get(1);
        Assertions.assertEquals(ConstraintKind.ABSOLUTE, absolute.getKind());
        Assertions.assertNull(absolute.getObject());
    }

    @Test
    public void testFailedConstrainLeavesTreeUnchanged() {
        Cell top = new Cell("top");
        Cell parent = new Cell("parent", top);
        Cell a = new Cell("a", "metal1");

        Assertions.assertThrows(IllegalArgumentException.class, () -> top.constrain(a, "sx1=ox1", parent));
        Assertions.assertThrows(IllegalArgumentException.class, () -> top.constrain(a, null, new Cell("b", "metal1")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> top.constrain(a, null));
        Assertions.assertEquals(0, top.getChildCount());
        Assertions.assertTrue(top.getConstraints().isEmpty());

        top.constrain(a, "sx1=ox1", a);
        Assertions.assertEquals(List.of(a), top.getChildren());
    }

    @Test
    public void testConstraintKeywordsExpandedAtConstrainTime() {
        Cell top = new Cell("top");
        Cell a = new Cell("a", "metal1");
        top.constrain(a, "center", top);
        top.constrain("width=100");

        Constraint center = top.getConstraints().get(0);
        Assertions.assertEquals("center", center.getSourceText());
        Assertions.assertTrue(center.getText().startsWith("sx1+sx2>=ox1+ox2-2, "), center.getText());
        Assertions.assertEquals(ConstraintKind.SELF, top.getConstraints().get(1).getKind());
        Assertions.assertEquals("(x2-x1)=100", top.getConstraints().get(1).getText());
    }

    @Test
    public void testCenterWithTolerance() {
        Cell top = new Cell("top");
        Cell a = new Cell("a", "metal1");
        top.centerWithTolerance(a, null, 3);
        Assertions.assertEquals(2, top.getConstraints().size());
        Assertions.assertEquals("sx1+sx2>=ox1+ox2-6, sx1+sx2<=ox1+ox2+6", top.getConstraints().get(0).getText());
        Assertions.assertSame(top, top.getConstraints().get(0).getObject());
        Assertions.assertThrows(IllegalArgumentException.class, () -> top.centerWithTolerance(a, null, -1));

        top.centerWithTolerance(a, null, 0);
        Assertions.assertEquals("sx1+sx2=ox1+ox2", top.getConstraints().get(2).getText());
        Assertions.assertEquals("sy1+sy2=oy1+oy2", top.getConstraints().get(3).getText());
    }

    @Test
    public void testUnresolvedAccessors() {
        Cell cell = new Cell("c", "metal1");
        Assertions.assertFalse(cell.isResolved());
        Assertions.assertNull(cell.getBox());
        Assertions.assertThrows(IllegalStateException.class, cell::getX1);
        Assertions.assertThrows(IllegalStateException.class, cell::getWidth);

        cell.setBox(BoundingBox.of(1, 2, 11, 7));
        Assertions.assertEquals(10, cell.getWidth());
        Assertions.assertEquals(5, cell.getHeight());
    }

    @Test
    public void testCollectReachableVisitsSharedCellOnce() {
        Cell shared = new Cell("shared", "metal1");
        Cell left = new Cell("left", shared);
        Cell right = new Cell("right", shared);
        Cell top = new Cell("top", left, right);

        List<Cell> reachable = top.collectReachable();
        Assertions.assertEquals(List.of(top, left, shared, right), reachable);
    }

    @Test
    public void testAcceptCanSkipSubtrees() {
        Cell a = new Cell("a", "metal1");
        Cell block = new Cell("block", a);
        Cell top = new Cell("top", block);
        block.constrain(a, "x1=0");

        StringBuilder visited = new StringBuilder();
        top.accept(new CellVisitor() {
            @Override
            public boolean enterCell(Cell cell, int depth) {
                visited.append(cell.getName()).append(depth).append(' ');
                return cell != block;
            }

            @Override
            public void visitConstraint(Cell owner, Constraint constraint) {
                visited.append("constraint ");
            }
        });
        Assertions.assertEquals("top0 block1 ", visited.toString());
    }

    @Test
    public void testMoveToTranslatesSubtree() {
        Cell a = new Cell("a", "metal1");
        Cell b = new Cell("b", "poly");
        Cell block = new Cell("block", a, b);
        a.setBox(BoundingBox.of(0, 0, 10, 10));
        b.setBox(BoundingBox.of(15, 5, 20, 10));
        block.setBox(BoundingBox.of(0, 0, 20, 10));

        block.moveTo(100, 50);
        Assertions.assertEquals(BoundingBox.of(100, 50, 120, 60), block.getBox());
        Assertions.assertEquals(BoundingBox.of(100, 50, 110, 60), a.getBox());
        Assertions.assertEquals(BoundingBox.of(115, 55, 120, 60), b.getBox());
    }

    @Test
    public void testFreezeWithoutSolverNeedsResolvedLayout() {
        Cell block = new Cell("block", new Cell("a", "metal1"));
        Assertions.assertThrows(IllegalStateException.class, block::freeze);
        Assertions.assertThrows(IllegalStateException.class, block::fix);
        Assertions.assertFalse(block.isFrozen());
        Assertions.assertFalse(block.isFixed());
    }

    @Test
    public void testFreezeAndFixAreExclusive() {
        Cell a = new Cell("a", "metal1");
        Cell inner = new Cell("inner", a);
        Cell block = new Cell("block", inner);
        a.setBox(BoundingBox.of(0, 0, 10, 10));
        inner.setBox(BoundingBox.of(0, 0, 10, 10));
        block.setBox(BoundingBox.of(0, 0, 10, 10));

        block.freeze();
        Assertions.assertTrue(block.isFrozen());
        Assertions.assertTrue(inner.isFrozen());
        Assertions.assertFalse(a.isFrozen());
        Assertions.assertSame(block, block.freeze());
        Assertions.assertThrows(IllegalStateException.class, block::fix);
        Assertions.assertThrows(IllegalStateException.class, () -> block.addChild(new Cell("b", "poly")));
        Assertions.assertThrows(IllegalStateException.class, () -> block.constrain("x1=0"));

        block.unfreeze();
        Assertions.assertFalse(block.isFrozen());
        Assertions.assertFalse(inner.isFrozen());
        Assertions.assertNull(block.getFrozenLayout());

        block.fix();
        Assertions.assertTrue(block.isFixed());
        Assertions.assertThrows(IllegalStateException.class, block::freeze);
        block.unfix();
        Assertions.assertEquals(ReuseState.PLAIN, block.getReuseState());
    }

    @Test
    public void testFreezeUnfixesDescendants() {
        Cell a = new Cell("a", "metal1");
        Cell inner = new Cell("inner", a);
        Cell block = new Cell("block", inner);
        a.setBox(BoundingBox.of(0, 0, 10, 10));
        inner.setBox(BoundingBox.of(0, 0, 10, 10));
        block.setBox(BoundingBox.of(0, 0, 10, 10));

        inner.fix();
        block.freeze();
        Assertions.assertFalse(inner.isFixed());
        Assertions.assertTrue(inner.isFrozen());
    }

    @Test
    public void testFixCapturesOffsets() {
        Cell a = new Cell("a", "metal1");
        Cell b = new Cell("b", "poly");
        Cell block = new Cell("block", a, b);
        a.setBox(BoundingBox.of(10, 10, 20, 20));
        b.setBox(BoundingBox.of(25, 12, 30, 15));
        block.setBox(BoundingBox.of(10, 10, 30, 20));

        block.fix();
        FixedLayout fixedLayout = block.getFixedLayout();
        Assertions.assertEquals(20, fixedLayout.getWidth());
        Assertions.assertEquals(10, fixedLayout.getHeight());
        Assertions.assertEquals(2, fixedLayout.size());
        FixedLayout.Offset offsetB = fixedLayout.getOffset(b);
        Assertions.assertEquals(15, offsetB.getDx());
        Assertions.assertEquals(2, offsetB.getDy());
        Assertions.assertEquals(BoundingBox.of(15, 2, 20, 5), offsetB.placeAt(0, 0));
    }

    @Test
    public void testCopyIsIndependent() {
        Cell a = new Cell("a", "metal1");
        Cell b = new Cell("b", "poly");
        Cell block = new Cell("block");
        block.constrain(a, "sx2+5<ox1", b);
        block.setBox(BoundingBox.of(0, 0, 30, 10));

        Cell copy = block.copy();
        Assertions.assertNotEquals(block.getId(), copy.getId());
        Assertions.assertTrue(copy.getName().startsWith("block_c"));
        Assertions.assertEquals(2, copy.getChildCount());
        Assertions.assertNotSame(a, copy.getChildren().get(0));
        Assertions.assertEquals("a", copy.getChildren().get(0).getName());
        Assertions.assertNull(copy.getBox());

        Constraint copied = copy.getConstraints().get(0);
        Assertions.assertSame(copy, copied.getOwner());
        Assertions.assertSame(copy.getChildren().get(0), copied.getSubject());
        Assertions.assertSame(copy.getChildren().get(1), copied.getObject());

        copy.addChild(new Cell("extra", "via"));
        copy.constrain("x1=0");
        Assertions.assertEquals(2, block.getChildCount());
        Assertions.assertEquals(1, block.getConstraints().size());
    }

    @Test
    public void testCopyNaming() {
        Cell cell = new Cell("uniqueCopyName");
        Assertions.assertEquals("uniqueCopyName_c1", cell.copy().getName());
        Assertions.assertEquals("uniqueCopyName_c2", cell.copy().getName());
        Assertions.assertEquals("explicit", cell.copy("explicit").getName());
    }

    @Test
    public void testCopyKeepsSharingInsideClone() {
        Cell shared = new Cell("shared", "metal1");
        Cell left = new Cell("left", shared);
        Cell right = new Cell("right", shared);
        Cell top = new Cell("top", left, right);

        Cell copy = top.copy();
        Cell copiedShared = copy.getChildren().get(0).getChildren().get(0);
        Assertions.assertSame(copiedShared, copy.getChildren().get(1).getChildren().get(0));
        Assertions.assertNotSame(shared, copiedShared);
    }

    @Test
    public void testCopyOfFrozenCellKeepsCachedLayout() {
        Cell a = new Cell("a", "metal1");
        Cell block = new Cell("block", a);
        a.setBox(BoundingBox.of(5, 5, 15, 15));
        block.setBox(BoundingBox.of(5, 5, 15, 15));
        block.freeze();

        Cell copy = block.copy();
        Assertions.assertTrue(copy.isFrozen());
        Assertions.assertEquals(block.getFrozenLayout().getFrozenBox(), copy.getFrozenLayout().getFrozenBox());
        Assertions.assertEquals(BoundingBox.of(5, 5, 15, 15), copy.getChildren().get(0).getBox());

        copy.unfreeze();
        Assertions.assertTrue(block.isFrozen());
    }

    @Test
    public void testCopyOfFixedCellRemapsOffsets() {
        Cell a = new Cell("a", "metal1");
        Cell block = new Cell("block", a);
        a.setBox(BoundingBox.of(3, 4, 13, 14));
        block.setBox(BoundingBox.of(3, 4, 13, 14));
        block.fix();

        Cell copy = block.copy();
        Cell copiedA = copy.getChildren().get(0);
        Assertions.assertTrue(copy.isFixed());
        Assertions.assertTrue(copy.getFixedLayout().hasOffset(copiedA));
        Assertions.assertFalse(copy.getFixedLayout().hasOffset(a));
        Assertions.assertEquals(block.getFixedLayout().getOffset(a), copy.getFixedLayout().getOffset(copiedA));
    }

    @Test
    public void testTreeString() {
        Cell a = new Cell("a", "metal1");
        Cell b = new Cell("b", "poly");
        Cell block = new Cell("block", a);
        Cell top = new Cell("top", block, b);
        a.setBox(BoundingBox.of(0, 0, 10, 10));
        block.setBox(BoundingBox.of(0, 0, 10, 10));
        block.freeze();

        String expected = "top\n"
            + "├── block [0, 0, 10, 10] [FROZEN]\n"
            + "│   └── a (metal1) [0, 0, 10, 10]\n"
            + "└── b (poly)\n";
        Assertions.assertEquals(expected, top.toTreeString());
    }
}
