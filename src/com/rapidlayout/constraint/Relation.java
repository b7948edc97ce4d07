package com.rapidlayout.constraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// one compiled relation sum(coeff_i * v_i) OP bound with integer coefficients
public final class Relation {

    private final String text;
    private final Map<CoordinateRef, Long> ref2Coeff;
    private final RelationOperator operator;
    private final long bound;

    Relation(String text, Map<CoordinateRef, Long> ref2Coeff, RelationOperator operator, long bound) {
        this.text = text;
        this.ref2Coeff = Collections.unmodifiableMap(new LinkedHashMap<>(ref2Coeff));
        this.operator = operator;
        this.bound = bound;
    }

    // moves everything to the left side and clears the denominator
    static Relation of(String text, LinearExpression left, RelationOperator operator, LinearExpression right) {
        LinearExpression diff = left.subtract(right);
        return new Relation(text, diff.getCoefficients(), operator, Math.negateExact(diff.getConstant()));
    }

    public String getText() {
        return text;
    }

    public Map<CoordinateRef, Long> getCoefficients() {
        return ref2Coeff;
    }

    public RelationOperator getOperator() {
        return operator;
    }

    public long getBound() {
        return bound;
    }

    public boolean isConstant() {
        return ref2Coeff.isEmpty();
    }

    public boolean evaluateConstant() {
        assert isConstant();
        return operator.evaluate(0, bound);
    }

    public RelationOperator getCompiledOperator() {
        switch (operator) {
            case LT:
                return RelationOperator.LE;
            case GT:
                return RelationOperator.GE;
            default:
                return operator;
        }
    }

    public long getCompiledBound() {
        switch (operator) {
            case LT:
                return Math.subtractExact(bound, 1);
            case GT:
                return Math.addExact(bound, 1);
            default:
                return bound;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<CoordinateRef, Long> entry : ref2Coeff.entrySet()) {
            long coeff = entry.getValue();
            if (sb.length() > 0) {
                sb.append(coeff < 0 ? " - " : " + ");
            } else if (coeff < 0) {
                sb.append("-");
            }
            if (Math.abs(coeff) != 1) {
                sb.append(Math.abs(coeff)).append('*');
            }
            sb.append(entry.getKey());
        }
        if (sb.length() == 0) {
            sb.append('0');
        }
        return sb + " " + operator.getSymbol() + " " + bound;
    }
}
