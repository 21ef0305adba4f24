/**
 * Copyright (C) 2010 Orbeon, Inc.
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the
 * GNU Lesser General Public License as published by the Free Software Foundation; either version
 * 2.1 of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY;
 * without even the implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU Lesser General Public License for more details.
 *
 * The full text of the license is available at http://www.gnu.org/copyleft/lesser.html
 */
package org.orbeon.xpath.expr;

import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.value.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Arithmetic over numeric values: <code>BigInteger</code> for integers, <code>BigDecimal</code> for decimals and
 * <code>Double</code> for doubles. The result has the type of the wider operand.
 */
public class NumericOperations {

    private NumericOperations() {}

    public static boolean isExact(Object value) {
        return value instanceof BigInteger || value instanceof BigDecimal;
    }

    public static Object add(Object a, Object b) {
        if (a instanceof BigInteger && b instanceof BigInteger)
            return ((BigInteger) a).add((BigInteger) b);
        else if (isExact(a) && isExact(b))
            return Values.toDecimal(a).add(Values.toDecimal(b));
        return Values.toDouble(a) + Values.toDouble(b);
    }

    public static Object subtract(Object a, Object b) {
        if (a instanceof BigInteger && b instanceof BigInteger)
            return ((BigInteger) a).subtract((BigInteger) b);
        else if (isExact(a) && isExact(b))
            return Values.toDecimal(a).subtract(Values.toDecimal(b));
        return Values.toDouble(a) - Values.toDouble(b);
    }

    public static Object multiply(Object a, Object b) {
        if (a instanceof BigInteger && b instanceof BigInteger)
            return ((BigInteger) a).multiply((BigInteger) b);
        else if (isExact(a) && isExact(b))
            return Values.toDecimal(a).multiply(Values.toDecimal(b));
        return Values.toDouble(a) * Values.toDouble(b);
    }

    /**
     * Division. Exact operands give a decimal, and a zero divisor raises FOAR0001 unless the operation is done with
     * XPath 1.0 semantics, where every division is a floating point one.
     */
    public static Object divide(Object a, Object b, boolean compatibility, XPathToken token) {
        if (!compatibility && isExact(a) && isExact(b)) {
            final BigDecimal divisor = Values.toDecimal(b);
            if (divisor.signum() == 0)
                throw ErrorCode.FOAR0001.createException(token);
            return Values.toDecimal(a).divide(divisor, MathContext.DECIMAL128);
        }
        return Values.toDouble(a) / Values.toDouble(b);
    }

    /**
     * Remainder of a truncating division, with the sign of the dividend.
     */
    public static Object mod(Object a, Object b, boolean compatibility, XPathToken token) {
        if (isExact(a) && isExact(b)) {
            if (Values.toDecimal(b).signum() == 0) {
                if (compatibility)
                    return Double.NaN;
                throw ErrorCode.FOAR0001.createException(token);
            }
            if (a instanceof BigInteger && b instanceof BigInteger)
                return ((BigInteger) a).remainder((BigInteger) b);
            return Values.toDecimal(a).remainder(Values.toDecimal(b));
        }
        return Values.toDouble(a) % Values.toDouble(b);
    }

    public static BigInteger integerDivide(Object a, Object b, XPathToken token) {
        if (isExact(a) && isExact(b)) {
            final BigDecimal divisor = Values.toDecimal(b);
            if (divisor.signum() == 0)
                throw ErrorCode.FOAR0001.createException(token);
            return Values.toDecimal(a).divide(divisor, 0, RoundingMode.DOWN).toBigInteger();
        }
        final double dividend = Values.toDouble(a);
        final double divisor = Values.toDouble(b);
        if (divisor == 0)
            throw ErrorCode.FOAR0001.createException(token);
        if (Double.isNaN(dividend) || Double.isNaN(divisor) || Double.isInfinite(dividend))
            throw ErrorCode.FOAR0002.createException(token);
        final double quotient = dividend / divisor;
        if (Double.isInfinite(quotient))
            throw ErrorCode.FOAR0002.createException(token);
        return new BigDecimal(quotient).toBigInteger();
    }

    public static Object negate(Object a) {
        if (a instanceof BigInteger)
            return ((BigInteger) a).negate();
        else if (a instanceof BigDecimal)
            return ((BigDecimal) a).negate();
        return -Values.toDouble(a);
    }

    /**
     * Compare two numbers, exactly when both are exact. Returns null when a double operand is NaN.
     */
    public static Integer compare(Object a, Object b) {
        if (isExact(a) && isExact(b))
            return Values.toDecimal(a).compareTo(Values.toDecimal(b));
        final double x = Values.toDouble(a);
        final double y = Values.toDouble(b);
        if (Double.isNaN(x) || Double.isNaN(y))
            return null;
        return x < y ? -1 : (x == y ? 0 : 1);
    }

    // XPath rounding: halves go towards positive infinity
    public static Object round(Object value) {
        if (value instanceof BigInteger) {
            return value;
        } else if (value instanceof BigDecimal) {
            final BigDecimal decimal = (BigDecimal) value;
            return decimal.setScale(0, decimal.signum() >= 0 ? RoundingMode.HALF_UP : RoundingMode.HALF_DOWN);
        }
        return round(Values.toDouble(value));
    }

    public static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return value;
        if (value < 0 && value >= -0.5)
            return -0.0;
        return Math.floor(value + 0.5);
    }

    public static Object floor(Object value) {
        if (value instanceof BigInteger)
            return value;
        else if (value instanceof BigDecimal)
            return ((BigDecimal) value).setScale(0, RoundingMode.FLOOR);
        return Math.floor(Values.toDouble(value));
    }

    public static Object ceiling(Object value) {
        if (value instanceof BigInteger)
            return value;
        else if (value instanceof BigDecimal)
            return ((BigDecimal) value).setScale(0, RoundingMode.CEILING);
        return Math.ceil(Values.toDouble(value));
    }
}
