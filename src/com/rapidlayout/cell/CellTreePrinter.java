package com.rapidlayout.cell;

import java.util.List;

public final class CellTreePrinter {

    private CellTreePrinter() {
    }

    public static String print(Cell root) {
        StringBuilder sb = new StringBuilder();
        appendCell(sb, root, "", "");
        return sb.toString();
    }

    private static void appendCell(StringBuilder sb, Cell cell, String linePrefix, String childPrefix) {
        sb.append(linePrefix).append(describe(cell)).append('\n');

        List<Cell> children = cell.getChildren();
        for (int i = 0; i < children.size(); i++) {
            boolean isLast = i == children.size() - 1;
            String branch = isLast ? "└── " : "├── ";
            String continuation = isLast ? "    " : "│   ";
            appendCell(sb, children.get(i), childPrefix + branch, childPrefix + continuation);
        }
    }

    static String describe(Cell cell) {
        StringBuilder info = new StringBuilder(cell.getName());
        if (cell.isLeaf()) {
            info.append(" (").append(cell.getLayerName()).append(")");
        }
        if (cell.getBox() != null) {
            info.append(" ").append(cell.getBox());
        }
        if (cell.isFrozen()) {
            info.append(" [FROZEN]");
        } else if (cell.isFixed()) {
            info.append(" [FIXED]");
        }
        return info.toString();
    }
}
