package com.rapidlayout.constraint;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestLinearExpression {

    private static final CoordinateRef X1 = CoordinateRef.subject(Corner.X1);

    @Test
    public void testNormalizedFractions() {
        LinearExpression half = LinearExpression.constant(2, 4);
        Assertions.assertEquals(1, half.getConstant());
        Assertions.assertEquals(2, half.getDenominator());

        LinearExpression negative = LinearExpression.constant(3, -6);
        Assertions.assertEquals(-1, negative.getConstant());
        Assertions.assertEquals(2, negative.getDenominator());
    }

    @Test
    public void testAddWithDifferentDenominators() {
        LinearExpression x = LinearExpression.variable(X1).divide(LinearExpression.constant(3));
        LinearExpression sum = x.add(LinearExpression.constant(1, 2));
        // x/3 + 1/2 = (2x + 3)/6
        Assertions.assertEquals(2, sum.getCoefficient(X1));
        Assertions.assertEquals(3, sum.getConstant());
        Assertions.assertEquals(6, sum.getDenominator());
    }

    @Test
    public void testDivideByNegativeConstant() {
        LinearExpression x = LinearExpression.variable(X1).divide(LinearExpression.constant(-2));
        Assertions.assertEquals(-1, x.getCoefficient(X1));
        Assertions.assertEquals(2, x.getDenominator());
    }

    @Test
    public void testNonLinearRejected() {
        LinearExpression x = LinearExpression.variable(X1);
        Assertions.assertThrows(GrammarException.class, () -> x.multiply(x));
        Assertions.assertThrows(GrammarException.class, () -> x.divide(x));
        Assertions.assertThrows(GrammarException.class, () -> x.divide(LinearExpression.constant(0)));
    }

    @Test
    public void testSubtractToZero() {
        LinearExpression x = LinearExpression.variable(X1);
        LinearExpression zero = x.subtract(x);
        Assertions.assertTrue(zero.isConstant());
        Assertions.assertEquals(0, zero.getConstant());
        Assertions.assertEquals(1, zero.getDenominator());
    }
}
