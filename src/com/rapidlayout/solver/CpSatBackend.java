package com.rapidlayout.solver;

import java.util.List;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.rapidlayout.LayoutParams;

public class CpSatBackend implements SolverBackend {

    private static boolean nativeLibrariesLoaded = false;

    private static synchronized void loadNativeLibraries() {
        if (nativeLibrariesLoaded) {
            return;
        }
        try {
            Loader.loadNativeLibraries();
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            throw new SolverUnavailableException("Fail to load OR-Tools native libraries", e);
        }
        nativeLibrariesLoaded = true;
    }

    @Override
    public String getName() {
        return "CP-SAT";
    }

    @Override
    public SolveResult solve(LayoutModel layoutModel, LayoutParams params) {
        loadNativeLibraries();

        CpModel model = new CpModel();

        // create variables
        VariableTable varTable = layoutModel.getVarTable();
        IntVar[] vars = new IntVar[layoutModel.getVarNum()];
        for (int varId = 0; varId < vars.length; varId++) {
            vars[varId] = model.newIntVar(layoutModel.getLowerBound(), layoutModel.getUpperBound(), varTable.getVarName(varId));
        }

        // linear constraints
        for (LinearConstraint constraint : layoutModel.getLinearConstraints()) {
            LinearExprBuilder expr = LinearExpr.newBuilder();
            int[] constraintVars = constraint.getVars();
            long[] coeffs = constraint.getCoeffs();
            for (int i = 0; i < constraintVars.length; i++) {
                expr.addTerm(vars[constraintVars[i]], coeffs[i]);
            }
            switch (constraint.getOperator()) {
                case LE:
                    model.addLessOrEqual(expr, constraint.getRhs());
                    break;
                case GE:
                    model.addGreaterOrEqual(expr, constraint.getRhs());
                    break;
                case EQ:
                    model.addEquality(expr, constraint.getRhs());
                    break;
                default:
                    assert false : "Strict operator reached the backend: " + constraint;
            }
        }

        // enclosure of children
        for (AggregateConstraint constraint : layoutModel.getAggregateConstraints()) {
            int[] aggVars = constraint.getVars();
            IntVar[] operands = new IntVar[aggVars.length];
            for (int i = 0; i < aggVars.length; i++) {
                operands[i] = vars[aggVars[i]];
            }
            if (constraint.getType() == AggregateConstraint.Type.MIN) {
                model.addMinEquality(vars[constraint.getTarget()], operands);
            } else {
                model.addMaxEquality(vars[constraint.getTarget()], operands);
            }
        }

        // objective
        LinearExprBuilder objective = LinearExpr.newBuilder();
        List<Integer> objectiveVars = layoutModel.getObjectiveVars();
        for (int varId : objectiveVars) {
            objective.addTerm(vars[varId], 1);
        }
        model.minimize(objective);

        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(params.getTimeLimitSec());
        solver.getParameters().setRandomSeed(params.getRandomSeed());
        solver.getParameters().setLogSearchProgress(params.isLogSearchProgress());
        if (params.getNumWorkers() > 0) {
            solver.getParameters().setNumWorkers(params.getNumWorkers());
        }

        CpSolverStatus resultStatus = solver.solve(model);
        SolveStatus status = convertStatus(resultStatus);

        if (!status.hasSolution()) {
            String message = resultStatus.toString();
            if (status == SolveStatus.MODEL_INVALID) {
                message = model.validate();
            } else if (status == SolveStatus.UNKNOWN) {
                message = String.format("no solution found within %.1f sec", params.getTimeLimitSec());
            }
            return new SolveResult(status, null, Double.NaN, solver.wallTime(), message);
        }

        long[] values = new long[vars.length];
        for (int varId = 0; varId < vars.length; varId++) {
            values[varId] = solver.value(vars[varId]);
        }
        return new SolveResult(status, values, solver.objectiveValue(), solver.wallTime(), resultStatus.toString());
    }

    private static SolveStatus convertStatus(CpSolverStatus status) {
        switch (status) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case FEASIBLE:
                return SolveStatus.FEASIBLE;
            case INFEASIBLE:
                return SolveStatus.INFEASIBLE;
            case MODEL_INVALID:
                return SolveStatus.MODEL_INVALID;
            default:
                return SolveStatus.UNKNOWN;
        }
    }
}
