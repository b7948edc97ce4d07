package com.rapidlayout.cell;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public final class CellCloner {

    private static final Map<String, AtomicInteger> name2CopyCount = new ConcurrentHashMap<>();

    private final Map<Cell, Cell> old2New = new IdentityHashMap<>();
    private final Map<Long, Long> oldId2NewId = new HashMap<>();
    private final List<Cell> visitOrder = new ArrayList<>();

    private CellCloner() {
    }

    public static Cell clone(Cell source, String newName) {
        CellCloner cloner = new CellCloner();
        Cell copy = cloner.cloneCell(source, false);
        cloner.rebindConstraints();
        cloner.restoreReuseStates();

        copy.setName(newName != null ? newName : nextCopyName(source.getName()));
        return copy;
    }

    static String nextCopyName(String name) {
        int copyNum = name2CopyCount.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        return name + "_c" + copyNum;
    }

    private Cell cloneCell(Cell cell, boolean insideReusedBlock) {
        Cell existing = old2New.get(cell);
        if (existing != null) {
            return existing;
        }

        Cell copy = cell.isLeaf() ? new Cell(cell.getName(), cell.getLayerName()) : new Cell(cell.getName());
        old2New.put(cell, copy);
        oldId2NewId.put(cell.getId(), copy.getId());
        visitOrder.add(cell);

        // geometry of a frozen or fixed block is its cached layout, everything else is solved again
        boolean keepBox = insideReusedBlock || cell.getReuseState() != ReuseState.PLAIN;
        if (keepBox && cell.getBox() != null) {
            copy.setBox(cell.getBox());
        }

        for (Cell child : cell.getChildren()) {
            copy.addClonedChild(cloneCell(child, keepBox));
        }
        return copy;
    }

    private void rebindConstraints() {
        for (Cell oldCell : visitOrder) {
            Cell newCell = old2New.get(oldCell);
            for (Constraint constraint : oldCell.getConstraints()) {
                Cell subject = mapped(constraint.getSubject());
                Cell object = constraint.getObject() == null ? null : mapped(constraint.getObject());
                newCell.addClonedConstraint(constraint.rebind(newCell, subject, object));
            }
        }
    }

    private void restoreReuseStates() {
        for (Cell oldCell : visitOrder) {
            switch (oldCell.getReuseState()) {
                case FROZEN:
                    old2New.get(oldCell).restoreReuseState(ReuseState.FROZEN, oldCell.getFrozenLayout(), null);
                    break;
                case FIXED:
                    FixedLayout fixedLayout = oldCell.getFixedLayout().remap(oldId2NewId);
                    old2New.get(oldCell).restoreReuseState(ReuseState.FIXED, null, fixedLayout);
                    break;
                default:
                    break;
            }
        }
    }

    private Cell mapped(Cell oldCell) {
        Cell newCell = old2New.get(oldCell);
        assert newCell != null : "Constraint references " + oldCell.getName() + " outside the cloned graph";
        return newCell;
    }
}
