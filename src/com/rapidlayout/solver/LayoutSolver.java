package com.rapidlayout.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.rapidlayout.LayoutParams;
import com.rapidlayout.cell.BoundingBox;
import com.rapidlayout.cell.Cell;
import com.rapidlayout.cell.CellSolver;
import com.rapidlayout.constraint.Corner;
import com.rapidlayout.utils.HierarchicalLogger;

public class LayoutSolver implements CellSolver {

    private final HierarchicalLogger logger;
    private final LayoutParams params;
    private final SolverBackend backend;

    private SolveResult lastResult = null;

    public LayoutSolver(HierarchicalLogger logger, LayoutParams params, SolverBackend backend) {
        if (backend == null) {
            throw new SolverUnavailableException("No solver backend is configured");
        }
        this.logger = logger;
        this.params = params;
        this.backend = backend;
    }

    @Override
    public boolean solve(Cell root) {
        return solve(root, params.isDefaultFootprint());
    }

    public boolean solve(Cell root, boolean defaultFootprint) {
        logger.info("Start solving layout of " + root.getName());
        logger.newSubStep();

        LayoutModelBuilder modelBuilder = new LayoutModelBuilder(logger, params);
        LayoutModel model = modelBuilder.build(root, defaultFootprint);

        SolveResult result;
        if (model.isTriviallyInfeasible()) {
            result = SolveResult.failure(SolveStatus.INFEASIBLE, model.getInfeasibleReason());
        } else {
            logger.info("Launch " + backend.getName() + " solver");
            result = backend.solve(model, params);
            logger.info(String.format("Complete running %s solver in %.2f sec", backend.getName(), result.getWallTimeSec()));
        }
        lastResult = result;

        boolean success = result.isSuccess();
        if (success) {
            logger.info("Find solution with objective value: " + result.getObjectiveValue() + " status: " + result.getStatus());
            writeBack(model, result);
            if (params.isVerbose()) {
                logger.infoHeader("Layout of " + root.getName());
                logger.info("Resolved cells:\n" + root.toTreeString(), true);
            }
        } else {
            logger.warning("Fail to solve layout of " + root.getName() + ": " + result);
        }

        logger.endSubStep();
        logger.info("Complete solving layout of " + root.getName());
        return success;
    }

    public SolveResult getLastResult() {
        return lastResult;
    }

    public LayoutParams getParams() {
        return params;
    }

    private void writeBack(LayoutModel model, SolveResult result) {
        VariableTable varTable = model.getVarTable();
        List<Cell> cells = varTable.getCells();

        for (Cell cell : cells) {
            BoundingBox box = new BoundingBox(
                Math.toIntExact(result.getValue(varTable.getVar(cell, Corner.X1))),
                Math.toIntExact(result.getValue(varTable.getVar(cell, Corner.Y1))),
                Math.toIntExact(result.getValue(varTable.getVar(cell, Corner.X2))),
                Math.toIntExact(result.getValue(varTable.getVar(cell, Corner.Y2)))
            );

            if (cell.isFrozen()) {
                // hidden descendants follow the frozen cell
                BoundingBox oldBox = cell.getBox();
                assert oldBox != null;
                assert oldBox.getWidth() == box.getWidth() && oldBox.getHeight() == box.getHeight();
                cell.translate(box.getX1() - oldBox.getX1(), box.getY1() - oldBox.getY1());
            }
            cell.setBox(box);
        }

        tightenContainers(cells);
    }

    // bottom-up: descendants follow their ancestors in reachable order
    private void tightenContainers(List<Cell> cells) {
        List<Cell> reversed = new ArrayList<>(cells);
        Collections.reverse(reversed);
        int tightenedNum = 0;
        for (Cell cell : reversed) {
            if (cell.isLeaf() || cell.isFrozen() || cell.getChildCount() == 0) continue;

            List<BoundingBox> childBoxes = new ArrayList<>();
            for (Cell child : cell.getChildren()) {
                assert child.getBox() != null;
                childBoxes.add(child.getBox());
            }
            BoundingBox enclosing = BoundingBox.enclosing(childBoxes);
            if (!enclosing.equals(cell.getBox())) {
                cell.setBox(enclosing);
                tightenedNum++;
            }
        }
        if (tightenedNum > 0) {
            logger.info("Num of containers tightened to their children: " + tightenedNum);
        }
    }
}
