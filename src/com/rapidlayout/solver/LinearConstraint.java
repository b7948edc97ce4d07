package com.rapidlayout.solver;

import com.rapidlayout.constraint.RelationOperator;

// sum(coeffs[i] * var[vars[i]]) OP rhs with OP one of LE, GE, EQ
public final class LinearConstraint {

    private final int[] vars;
    private final long[] coeffs;
    private final RelationOperator operator;
    private final long rhs;
    private final String label;

    public LinearConstraint(int[] vars, long[] coeffs, RelationOperator operator, long rhs, String label) {
        assert vars.length == coeffs.length;
        assert !operator.isStrict();
        this.vars = vars;
        this.coeffs = coeffs;
        this.operator = operator;
        this.rhs = rhs;
        this.label = label;
    }

    public int[] getVars() {
        return vars;
    }

    public long[] getCoeffs() {
        return coeffs;
    }

    public RelationOperator getOperator() {
        return operator;
    }

    public long getRhs() {
        return rhs;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSatisfiedBy(long[] values) {
        long lhs = 0;
        for (int i = 0; i < vars.length; i++) {
            lhs += coeffs[i] * values[vars[i]];
        }
        return operator.evaluate(lhs, rhs);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < vars.length; i++) {
            if (i > 0) {
                sb.append(coeffs[i] < 0 ? " - " : " + ");
            } else if (coeffs[i] < 0) {
                sb.append('-');
            }
            if (Math.abs(coeffs[i]) != 1) {
                sb.append(Math.abs(coeffs[i])).append('*');
            }
            sb.append('v').append(vars[i]);
        }
        return String.format("%s %s %d  [%s]", sb, operator.getSymbol(), rhs, label);
    }
}
