package com.rapidlayout.solver;

import java.util.Arrays;

// target = min(vars) or target = max(vars)
public final class AggregateConstraint {

    public enum Type {
        MIN,
        MAX
    }

    private final Type type;
    private final int target;
    private final int[] vars;
    private final String label;

    public AggregateConstraint(Type type, int target, int[] vars, String label) {
        assert vars.length > 0;
        this.type = type;
        this.target = target;
        this.vars = vars;
        this.label = label;
    }

    public Type getType() {
        return type;
    }

    public int getTarget() {
        return target;
    }

    public int[] getVars() {
        return vars;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSatisfiedBy(long[] values) {
        long aggregate = values[vars[0]];
        for (int var : vars) {
            aggregate = type == Type.MIN ? Math.min(aggregate, values[var]) : Math.max(aggregate, values[var]);
        }
        return values[target] == aggregate;
    }

    @Override
    public String toString() {
        return String.format("v%d = %s%s  [%s]", target, type.name().toLowerCase(), Arrays.toString(vars), label);
    }
}
