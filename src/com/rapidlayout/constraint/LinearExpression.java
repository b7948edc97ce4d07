package com.rapidlayout.constraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// integer numerators over one shared positive denominator
public final class LinearExpression {

    private final Map<CoordinateRef, Long> ref2Coeff;
    private final long constant;
    private final long denominator;

    private LinearExpression(Map<CoordinateRef, Long> ref2Coeff, long constant, long denominator) {
        assert denominator > 0;
        this.ref2Coeff = ref2Coeff;
        this.constant = constant;
        this.denominator = denominator;
    }

    public static LinearExpression constant(long numerator, long denominator) {
        if (denominator == 0) {
            throw new ArithmeticException("Zero denominator");
        }
        if (denominator < 0) {
            numerator = Math.negateExact(numerator);
            denominator = Math.negateExact(denominator);
        }
        return normalize(new LinkedHashMap<>(), numerator, denominator);
    }

    public static LinearExpression constant(long value) {
        return constant(value, 1);
    }

    public static LinearExpression variable(CoordinateRef ref) {
        Map<CoordinateRef, Long> ref2Coeff = new LinkedHashMap<>();
        ref2Coeff.put(ref, 1L);
        return new LinearExpression(ref2Coeff, 0, 1);
    }

    private static LinearExpression normalize(Map<CoordinateRef, Long> ref2Coeff, long constant, long denominator) {
        ref2Coeff.values().removeIf(coeff -> coeff == 0);

        long g = gcd(denominator, constant);
        for (long coeff : ref2Coeff.values()) {
            g = gcd(g, coeff);
        }
        if (g > 1) {
            for (Map.Entry<CoordinateRef, Long> entry : ref2Coeff.entrySet()) {
                entry.setValue(entry.getValue() / g);
            }
            constant /= g;
            denominator /= g;
        }
        return new LinearExpression(ref2Coeff, constant, denominator);
    }

    static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    public LinearExpression add(LinearExpression other) {
        long g = gcd(denominator, other.denominator);
        long thisScale = other.denominator / g;
        long otherScale = denominator / g;
        long newDenominator = Math.multiplyExact(denominator, thisScale);

        Map<CoordinateRef, Long> newRef2Coeff = new LinkedHashMap<>();
        for (Map.Entry<CoordinateRef, Long> entry : ref2Coeff.entrySet()) {
            newRef2Coeff.put(entry.getKey(), Math.multiplyExact(entry.getValue(), thisScale));
        }
        for (Map.Entry<CoordinateRef, Long> entry : other.ref2Coeff.entrySet()) {
            long scaled = Math.multiplyExact(entry.getValue(), otherScale);
            newRef2Coeff.merge(entry.getKey(), scaled, Math::addExact);
        }
        long newConstant = Math.addExact(
            Math.multiplyExact(constant, thisScale),
            Math.multiplyExact(other.constant, otherScale)
        );
        return normalize(newRef2Coeff, newConstant, newDenominator);
    }

    public LinearExpression negate() {
        Map<CoordinateRef, Long> newRef2Coeff = new LinkedHashMap<>();
        for (Map.Entry<CoordinateRef, Long> entry : ref2Coeff.entrySet()) {
            newRef2Coeff.put(entry.getKey(), Math.negateExact(entry.getValue()));
        }
        return new LinearExpression(newRef2Coeff, Math.negateExact(constant), denominator);
    }

    public LinearExpression subtract(LinearExpression other) {
        return add(other.negate());
    }

    public LinearExpression multiply(LinearExpression other) {
        if (other.isConstant()) {
            return scale(other.constant, other.denominator);
        }
        if (isConstant()) {
            return other.scale(constant, denominator);
        }
        throw new GrammarException(String.format("Non-linear product of (%s) and (%s)", this, other));
    }

    public LinearExpression divide(LinearExpression divisor) {
        if (!divisor.isConstant()) {
            throw new GrammarException(String.format("Division by non-constant expression (%s)", divisor));
        }
        if (divisor.constant == 0) {
            throw new GrammarException("Division by zero");
        }
        if (divisor.constant < 0) {
            return scale(Math.negateExact(divisor.denominator), Math.negateExact(divisor.constant));
        }
        return scale(divisor.denominator, divisor.constant);
    }

    // multiplies by numerator / denominator, denominator > 0
    private LinearExpression scale(long numerator, long scaleDenominator) {
        Map<CoordinateRef, Long> newRef2Coeff = new LinkedHashMap<>();
        for (Map.Entry<CoordinateRef, Long> entry : ref2Coeff.entrySet()) {
            newRef2Coeff.put(entry.getKey(), Math.multiplyExact(entry.getValue(), numerator));
        }
        long newConstant = Math.multiplyExact(constant, numerator);
        long newDenominator = Math.multiplyExact(denominator, scaleDenominator);
        return normalize(newRef2Coeff, newConstant, newDenominator);
    }

    public boolean isConstant() {
        return ref2Coeff.isEmpty();
    }

    public Map<CoordinateRef, Long> getCoefficients() {
        return Collections.unmodifiableMap(ref2Coeff);
    }

    public long getCoefficient(CoordinateRef ref) {
        return ref2Coeff.getOrDefault(ref, 0L);
    }

    public long getConstant() {
        return constant;
    }

    public long getDenominator() {
        return denominator;
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
            long absCoeff = Math.abs(coeff);
            if (absCoeff != 1) {
                sb.append(absCoeff).append('*');
            }
            sb.append(entry.getKey());
        }
        if (constant != 0 || sb.length() == 0) {
            if (sb.length() > 0) {
                sb.append(constant < 0 ? " - " : " + ").append(Math.abs(constant));
            } else {
                sb.append(constant);
            }
        }
        if (denominator != 1) {
            return "(" + sb + ")/" + denominator;
        }
        return sb.toString();
    }
}
