package com.rapidlayout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.rapidlayout.cell.BoundingBox;
import com.rapidlayout.cell.Cell;
import com.rapidlayout.cell.CellNamespace;

public class LayoutJsonWriter {

    private static class CellJson {
        public String name;
        public String exportName;
        public long id;
        public String layer;
        public List<Integer> box;
        public String state;
        public List<CellJson> children;
    }

    private LayoutJsonWriter() {
    }

    public static String toJson(Cell root) {
        CellNamespace namespace = CellNamespace.of(root);
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(buildCellJson(root, namespace));
    }

    public static void write(Path jsonFilePath, Cell root) {
        try {
            Files.write(jsonFilePath, toJson(root).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to write layout of " + root.getName() + " to " + jsonFilePath, e);
        }
    }

    private static CellJson buildCellJson(Cell cell, CellNamespace namespace) {
        CellJson cellJson = new CellJson();
        cellJson.name = cell.getName();
        cellJson.exportName = namespace.getExportName(cell);
        cellJson.id = cell.getId();
        cellJson.layer = cell.getLayerName();
        cellJson.state = cell.getReuseState().name();

        BoundingBox box = cell.getBox();
        if (box != null) {
            cellJson.box = List.of(box.getX1(), box.getY1(), box.getX2(), box.getY2());
        }

        if (!cell.isLeaf()) {
            cellJson.children = new ArrayList<>();
            for (Cell child : cell.getChildren()) {
                cellJson.children.add(buildCellJson(child, namespace));
            }
        }
        return cellJson;
    }
}
