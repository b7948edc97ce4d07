package com.rapidlayout.cell;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class CellNamespace {

    private final Map<Long, String> id2ExportName;

    private CellNamespace(Map<Long, String> id2ExportName) {
        this.id2ExportName = id2ExportName;
    }

    public static CellNamespace of(Cell root) {
        List<Cell> cells = collectAll(root);

        Map<String, Integer> name2Count = new HashMap<>();
        for (Cell cell : cells) {
            name2Count.merge(cell.getName(), 1, Integer::sum);
        }

        Map<Long, String> id2ExportName = new HashMap<>();
        Set<String> usedNames = new HashSet<>();
        for (Cell cell : cells) {
            if (name2Count.get(cell.getName()) == 1) {
                id2ExportName.put(cell.getId(), cell.getName());
                usedNames.add(cell.getName());
            }
        }
        for (Cell cell : cells) {
            if (id2ExportName.containsKey(cell.getId())) continue;

            String exportName = cell.getName() + "_" + cell.getId();
            // a unique display name may already look like a disambiguated one
            while (usedNames.contains(exportName)) {
                exportName = exportName + "_" + cell.getId();
            }
            usedNames.add(exportName);
            id2ExportName.put(cell.getId(), exportName);
        }
        return new CellNamespace(id2ExportName);
    }

    // includes cells hidden below frozen boundaries, exporters write them too
    private static List<Cell> collectAll(Cell root) {
        List<Cell> cells = new ArrayList<>();
        collectAll(root, new HashSet<>(), cells);
        return cells;
    }

    private static void collectAll(Cell cell, Set<Long> visited, List<Cell> cells) {
        if (!visited.add(cell.getId())) {
            return;
        }
        cells.add(cell);
        for (Cell child : cell.getChildren()) {
            collectAll(child, visited, cells);
        }
    }

    public String getExportName(Cell cell) {
        String exportName = id2ExportName.get(cell.getId());
        if (exportName == null) {
            throw new IllegalArgumentException("Cell '" + cell.getName() + "' is not part of this namespace");
        }
        return exportName;
    }

    public boolean contains(Cell cell) {
        return id2ExportName.containsKey(cell.getId());
    }

    public int size() {
        return id2ExportName.size();
    }
}
