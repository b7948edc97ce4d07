package com.rapidlayout.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.rapidlayout.cell.Cell;
import com.rapidlayout.constraint.Corner;

// assigns every cell of a solve a block of four consecutive variables, keyed by the cell id
public final class VariableTable {

    public static final int VARS_PER_CELL = 4;

    private final Map<Long, Integer> cellId2Base = new HashMap<>();
    private final List<Cell> cells = new ArrayList<>();

    public int register(Cell cell) {
        Integer base = cellId2Base.get(cell.getId());
        if (base != null) {
            return base;
        }
        int newBase = cells.size() * VARS_PER_CELL;
        cellId2Base.put(cell.getId(), newBase);
        cells.add(cell);
        return newBase;
    }

    public boolean contains(Cell cell) {
        return cellId2Base.containsKey(cell.getId());
    }

    public int getVar(Cell cell, Corner corner) {
        Integer base = cellId2Base.get(cell.getId());
        if (base == null) {
            throw new IllegalArgumentException("Cell '" + cell.getName() + "' has no variables in this solve");
        }
        return base + corner.getSlot();
    }

    public List<Cell> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public int getCellNum() {
        return cells.size();
    }

    public int getVarNum() {
        return cells.size() * VARS_PER_CELL;
    }

    public String getVarName(int var) {
        Cell cell = cells.get(var / VARS_PER_CELL);
        Corner corner = Corner.values()[var % VARS_PER_CELL];
        return cell.getName() + "_" + cell.getId() + "." + corner.getToken();
    }
}
