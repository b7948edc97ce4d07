package com.rapidlayout.solver;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.rapidlayout.LayoutException;
import com.rapidlayout.LayoutParams;
import com.rapidlayout.cell.Cell;
import com.rapidlayout.cell.CellVisitor;
import com.rapidlayout.cell.Constraint;
import com.rapidlayout.cell.FixedLayout;
import com.rapidlayout.constraint.CoordinateRef;
import com.rapidlayout.constraint.Corner;
import com.rapidlayout.constraint.GrammarException;
import com.rapidlayout.constraint.Relation;
import com.rapidlayout.constraint.RelationOperator;
import com.rapidlayout.constraint.RelationParser;
import com.rapidlayout.utils.HierarchicalLogger;

public class LayoutModelBuilder {

    private final HierarchicalLogger logger;
    private final LayoutParams params;

    private VariableTable varTable;
    private LayoutModel model;

    // fixed cells replayed from their cached layout, keyed by id, mapped to their anchor
    private Map<Long, Cell> replayed2Anchor;
    private Set<Long> anchorIds;
    // leaves whose width or height some relation constrains directly
    private Set<Long> widthSizedIds;
    private Set<Long> heightSizedIds;
    private int compiledRelationNum;
    private int skippedConstraintNum;

    public LayoutModelBuilder(HierarchicalLogger logger, LayoutParams params) {
        this.logger = logger;
        this.params = params;
    }

    public LayoutModel build(Cell root, boolean defaultFootprint) {
        logger.info("Start building layout model of " + root.getName());
        logger.newSubStep();

        varTable = new VariableTable();
        model = new LayoutModel(varTable, params.getCoordMin(), params.getCoordMax());
        replayed2Anchor = new HashMap<>();
        anchorIds = new HashSet<>();
        widthSizedIds = new HashSet<>();
        heightSizedIds = new HashSet<>();
        compiledRelationNum = 0;
        skippedConstraintNum = 0;

        for (Cell cell : root.collectReachable()) {
            varTable.register(cell);
        }
        logger.info("Num of cells: " + varTable.getCellNum());

        root.accept(new ConstraintCollector());

        for (Cell cell : varTable.getCells()) {
            buildStructuralConstraints(cell);
        }
        for (Cell cell : varTable.getCells()) {
            if (replayed2Anchor.containsKey(cell.getId())) {
                buildReplayConstraints(cell, replayed2Anchor.get(cell.getId()));
            } else if (cell.isFrozen()) {
                buildFrozenConstraints(cell);
            } else if (anchorIds.contains(cell.getId())) {
                buildAnchorConstraints(cell);
            }
        }
        for (Cell cell : varTable.getCells()) {
            if (needsEnclosure(cell)) {
                buildEnclosureConstraints(cell);
            }
        }
        if (defaultFootprint) {
            buildDefaultFootprints();
        }
        for (Cell cell : varTable.getCells()) {
            model.addObjectiveVar(varTable.getVar(cell, Corner.X2));
            model.addObjectiveVar(varTable.getVar(cell, Corner.Y2));
        }

        logger.info("Num of compiled relations: " + compiledRelationNum);
        if (skippedConstraintNum > 0) {
            logger.info("Num of constraints replaced by fixed layouts: " + skippedConstraintNum);
        }
        logger.info("Num of fixed anchors: " + anchorIds.size() + "  replayed cells: " + replayed2Anchor.size());
        logger.info(model.toString());
        if (params.isVerbose()) {
            for (LinearConstraint constraint : model.getLinearConstraints()) {
                logger.fine(constraint.toString());
            }
            for (AggregateConstraint constraint : model.getAggregateConstraints()) {
                logger.fine(constraint.toString());
            }
        }

        logger.endSubStep();
        logger.info("Complete building layout model of " + root.getName());
        return model;
    }

    public int getCompiledRelationNum() {
        return compiledRelationNum;
    }

    public boolean isReplayed(Cell cell) {
        return replayed2Anchor != null && replayed2Anchor.containsKey(cell.getId());
    }

    private class ConstraintCollector implements CellVisitor {
        private Cell anchor = null;

        @Override
        public boolean enterCell(Cell cell, int depth) {
            if (anchor == null) {
                if (cell.isFixed()) {
                    anchor = cell;
                    anchorIds.add(cell.getId());
                }
            } else if (anchor.getFixedLayout().hasOffset(cell)) {
                replayed2Anchor.put(cell.getId(), anchor);
            } else {
                logger.warning(String.format("Cell %s under fixed cell %s has no cached offset, it is solved freely",
                    cell.getName(), anchor.getName()));
            }
            // children of a frozen cell and its own constraints stay out of the model
            return !cell.isFrozen();
        }

        @Override
        public void visitConstraint(Cell owner, Constraint constraint) {
            if (anchorIds.contains(owner.getId()) || replayed2Anchor.containsKey(owner.getId())) {
                skippedConstraintNum++;
                return;
            }
            compileConstraint(owner, constraint);
        }

        @Override
        public void exitCell(Cell cell, int depth) {
            if (cell == anchor) {
                anchor = null;
            }
        }
    }

    private void compileConstraint(Cell owner, Constraint constraint) {
        Cell subject = constraint.getSubject();
        Cell object = constraint.getObject();
        checkVisible(owner, constraint, subject);
        if (object != null) {
            checkVisible(owner, constraint, object);
        }

        List<Relation> relations;
        try {
            relations = RelationParser.parse(constraint.getText(), constraint.getKind().hasObject());
        } catch (GrammarException e) {
            throw new GrammarException(String.format("Invalid constraint '%s' of cell %s: %s",
                constraint.getSourceText(), owner.getName(), e.getMessage()), e);
        }

        for (Relation relation : relations) {
            Map<Integer, Long> var2Coeff = new LinkedHashMap<>();
            Map<Cell, EnumSet<Corner>> cell2Corners = new HashMap<>();
            try {
                for (Map.Entry<CoordinateRef, Long> entry : relation.getCoefficients().entrySet()) {
                    CoordinateRef ref = entry.getKey();
                    Cell cell = ref.getRole() == CoordinateRef.Role.SUBJECT ? subject : object;
                    int var = varTable.getVar(cell, ref.getCorner());
                    var2Coeff.merge(var, entry.getValue(), Math::addExact);
                    cell2Corners.computeIfAbsent(cell, c -> EnumSet.noneOf(Corner.class)).add(ref.getCorner());
                }
            } catch (ArithmeticException e) {
                throw new GrammarException(String.format("Numeric overflow in constraint '%s' of cell %s",
                    constraint.getSourceText(), owner.getName()), e);
            }
            var2Coeff.values().removeIf(coeff -> coeff == 0);
            recordSizedAxes(cell2Corners);

            String label = owner.getName() + ": " + relation.getText();
            RelationOperator operator = relation.getCompiledOperator();
            long bound = relation.getCompiledBound();
            if (var2Coeff.isEmpty()) {
                if (!operator.evaluate(0, bound)) {
                    logger.warning("Relation can never hold: " + label);
                    model.markInfeasible("relation '" + relation.getText() + "' of cell " + owner.getName() + " can never hold");
                }
                continue;
            }

            int[] vars = new int[var2Coeff.size()];
            long[] coeffs = new long[var2Coeff.size()];
            int i = 0;
            for (Map.Entry<Integer, Long> entry : var2Coeff.entrySet()) {
                vars[i] = entry.getKey();
                coeffs[i] = entry.getValue();
                i++;
            }
            model.addLinear(vars, coeffs, operator, bound, label);
            compiledRelationNum++;
        }
    }

    // a relation over both corners of an axis sizes the cell along that axis
    private void recordSizedAxes(Map<Cell, EnumSet<Corner>> cell2Corners) {
        for (Map.Entry<Cell, EnumSet<Corner>> entry : cell2Corners.entrySet()) {
            EnumSet<Corner> corners = entry.getValue();
            if (corners.contains(Corner.X1) && corners.contains(Corner.X2)) {
                widthSizedIds.add(entry.getKey().getId());
            }
            if (corners.contains(Corner.Y1) && corners.contains(Corner.Y2)) {
                heightSizedIds.add(entry.getKey().getId());
            }
        }
    }

    private void checkVisible(Cell owner, Constraint constraint, Cell cell) {
        if (!varTable.contains(cell)) {
            throw new LayoutException(String.format(
                "Constraint '%s' of cell %s references cell %s, which is hidden below a frozen cell",
                constraint.getSourceText(), owner.getName(), cell.getName()));
        }
    }

    private void buildStructuralConstraints(Cell cell) {
        int x1 = varTable.getVar(cell, Corner.X1);
        int y1 = varTable.getVar(cell, Corner.Y1);
        int x2 = varTable.getVar(cell, Corner.X2);
        int y2 = varTable.getVar(cell, Corner.Y2);
        model.addDifference(x2, x1, RelationOperator.GE, 1, cell.getName() + ": x2>x1");
        model.addDifference(y2, y1, RelationOperator.GE, 1, cell.getName() + ": y2>y1");
    }

    private void buildFrozenConstraints(Cell cell) {
        int width = cell.getFrozenLayout().getWidth();
        int height = cell.getFrozenLayout().getHeight();
        pinSize(cell, width, height, "frozen");
    }

    private void buildAnchorConstraints(Cell anchor) {
        FixedLayout fixedLayout = anchor.getFixedLayout();
        pinSize(anchor, fixedLayout.getWidth(), fixedLayout.getHeight(), "fixed");
    }

    private void pinSize(Cell cell, int width, int height, String reason) {
        int x1 = varTable.getVar(cell, Corner.X1);
        int y1 = varTable.getVar(cell, Corner.Y1);
        int x2 = varTable.getVar(cell, Corner.X2);
        int y2 = varTable.getVar(cell, Corner.Y2);
        model.addDifference(x2, x1, RelationOperator.EQ, width, cell.getName() + ": " + reason + " width");
        model.addDifference(y2, y1, RelationOperator.EQ, height, cell.getName() + ": " + reason + " height");
    }

    private void buildReplayConstraints(Cell cell, Cell anchor) {
        FixedLayout.Offset offset = anchor.getFixedLayout().getOffset(cell);
        int anchorX1 = varTable.getVar(anchor, Corner.X1);
        int anchorY1 = varTable.getVar(anchor, Corner.Y1);
        String label = cell.getName() + ": replay in " + anchor.getName();

        model.addDifference(varTable.getVar(cell, Corner.X1), anchorX1, RelationOperator.EQ, offset.getDx(), label);
        model.addDifference(varTable.getVar(cell, Corner.Y1), anchorY1, RelationOperator.EQ, offset.getDy(), label);
        model.addDifference(varTable.getVar(cell, Corner.X2), anchorX1, RelationOperator.EQ,
            (long) offset.getDx() + offset.getWidth(), label);
        model.addDifference(varTable.getVar(cell, Corner.Y2), anchorY1, RelationOperator.EQ,
            (long) offset.getDy() + offset.getHeight(), label);
    }

    private boolean needsEnclosure(Cell cell) {
        return !cell.isLeaf()
            && cell.getChildCount() > 0
            && !cell.isFrozen()
            && !replayed2Anchor.containsKey(cell.getId());
    }

    private void buildEnclosureConstraints(Cell container) {
        List<Cell> children = container.getChildren();
        int[] childX1 = new int[children.size()];
        int[] childY1 = new int[children.size()];
        int[] childX2 = new int[children.size()];
        int[] childY2 = new int[children.size()];
        for (int i = 0; i < children.size(); i++) {
            Cell child = children.get(i);
            childX1[i] = varTable.getVar(child, Corner.X1);
            childY1[i] = varTable.getVar(child, Corner.Y1);
            childX2[i] = varTable.getVar(child, Corner.X2);
            childY2[i] = varTable.getVar(child, Corner.Y2);
        }
        String label = container.getName() + ": enclosure";
        model.addMinEquality(varTable.getVar(container, Corner.X1), childX1, label);
        model.addMinEquality(varTable.getVar(container, Corner.Y1), childY1, label);
        model.addMaxEquality(varTable.getVar(container, Corner.X2), childX2, label);
        model.addMaxEquality(varTable.getVar(container, Corner.Y2), childY2, label);
    }

    // positioned-only leaves still get the minimum size, sized axes keep what the relations say
    private void buildDefaultFootprints() {
        int footprintNum = 0;
        for (Cell leaf : varTable.getCells()) {
            if (!leaf.isLeaf() || leaf.isFrozen() || leaf.isFixed()) continue;
            if (replayed2Anchor.containsKey(leaf.getId())) continue;

            String label = leaf.getName() + ": default footprint";
            boolean added = false;
            if (!widthSizedIds.contains(leaf.getId())) {
                int x1 = varTable.getVar(leaf, Corner.X1);
                model.addBound(x1, RelationOperator.GE, 0, label);
                model.addDifference(varTable.getVar(leaf, Corner.X2), x1, RelationOperator.GE, params.getDefaultLeafWidth(), label);
                added = true;
            }
            if (!heightSizedIds.contains(leaf.getId())) {
                int y1 = varTable.getVar(leaf, Corner.Y1);
                model.addBound(y1, RelationOperator.GE, 0, label);
                model.addDifference(varTable.getVar(leaf, Corner.Y2), y1, RelationOperator.GE, params.getDefaultLeafHeight(), label);
                added = true;
            }
            if (added) {
                footprintNum++;
            }
        }
        if (footprintNum > 0) {
            logger.info("Num of leaves with default footprint: " + footprintNum);
        }
    }
}
