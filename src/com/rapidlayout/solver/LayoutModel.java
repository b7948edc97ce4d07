package com.rapidlayout.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.rapidlayout.constraint.RelationOperator;

public final class LayoutModel {

    private final VariableTable varTable;
    private final long lowerBound;
    private final long upperBound;

    private final List<LinearConstraint> linearConstraints = new ArrayList<>();
    private final List<AggregateConstraint> aggregateConstraints = new ArrayList<>();
    private final List<Integer> objectiveVars = new ArrayList<>();

    // set when a relation without variables evaluates to false
    private String infeasibleReason = null;

    public LayoutModel(VariableTable varTable, long lowerBound, long upperBound) {
        assert lowerBound < upperBound;
        this.varTable = varTable;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public void addLinear(int[] vars, long[] coeffs, RelationOperator operator, long rhs, String label) {
        linearConstraints.add(new LinearConstraint(vars, coeffs, operator, rhs, label));
    }

    // var1 - var2 OP rhs
    public void addDifference(int var1, int var2, RelationOperator operator, long rhs, String label) {
        addLinear(new int[] {var1, var2}, new long[] {1, -1}, operator, rhs, label);
    }

    public void addBound(int var, RelationOperator operator, long rhs, String label) {
        addLinear(new int[] {var}, new long[] {1}, operator, rhs, label);
    }

    public void addMinEquality(int target, int[] vars, String label) {
        aggregateConstraints.add(new AggregateConstraint(AggregateConstraint.Type.MIN, target, vars, label));
    }

    public void addMaxEquality(int target, int[] vars, String label) {
        aggregateConstraints.add(new AggregateConstraint(AggregateConstraint.Type.MAX, target, vars, label));
    }

    public void addObjectiveVar(int var) {
        objectiveVars.add(var);
    }

    public void markInfeasible(String reason) {
        if (infeasibleReason == null) {
            infeasibleReason = reason;
        }
    }

    public boolean isTriviallyInfeasible() {
        return infeasibleReason != null;
    }

    public String getInfeasibleReason() {
        return infeasibleReason;
    }

    public VariableTable getVarTable() {
        return varTable;
    }

    public int getVarNum() {
        return varTable.getVarNum();
    }

    public long getLowerBound() {
        return lowerBound;
    }

    public long getUpperBound() {
        return upperBound;
    }

    public List<LinearConstraint> getLinearConstraints() {
        return Collections.unmodifiableList(linearConstraints);
    }

    public List<AggregateConstraint> getAggregateConstraints() {
        return Collections.unmodifiableList(aggregateConstraints);
    }

    public List<Integer> getObjectiveVars() {
        return Collections.unmodifiableList(objectiveVars);
    }

    // checks an assignment against bounds and every constraint
    public boolean isSatisfiedBy(long[] values) {
        if (values.length != getVarNum()) {
            return false;
        }
        for (long value : values) {
            if (value < lowerBound || value > upperBound) {
                return false;
            }
        }
        for (LinearConstraint constraint : linearConstraints) {
            if (!constraint.isSatisfiedBy(values)) {
                return false;
            }
        }
        for (AggregateConstraint constraint : aggregateConstraints) {
            if (!constraint.isSatisfiedBy(values)) {
                return false;
            }
        }
        return true;
    }

    public long evaluateObjective(long[] values) {
        long sum = 0;
        for (int var : objectiveVars) {
            sum += values[var];
        }
        return sum;
    }

    @Override
    public String toString() {
        return String.format("LayoutModel(cells=%d, vars=%d, linear=%d, aggregate=%d)",
            varTable.getCellNum(), getVarNum(), linearConstraints.size(), aggregateConstraints.size());
    }
}
