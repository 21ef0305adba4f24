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
package org.orbeon.xpath.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Conversions between the atomic value classes used by the engine: <code>String</code>, <code>Boolean</code>,
 * <code>BigInteger</code> (xs:integer), <code>BigDecimal</code> (xs:decimal), <code>Double</code> (xs:double)
 * and {@link UntypedAtomic}.
 */
public class Values {

    private static final Pattern XPATH1_NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern XPATH2_NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {}

    /**
     * Map host Java values (Integer, Long, Float, Character...) to the engine's atomic classes.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
            return BigInteger.valueOf(((Number) value).longValue());
        else if (value instanceof Float)
            return Double.valueOf(((Float) value).doubleValue());
        else if (value instanceof Character || value instanceof CharSequence && !(value instanceof String))
            return value.toString();
        else
            return value;
    }

    public static boolean isNumeric(Object value) {
        return value instanceof BigInteger || value instanceof BigDecimal || value instanceof Double;
    }

    public static boolean isStringLike(Object value) {
        return value instanceof String || value instanceof UntypedAtomic;
    }

    public static boolean isAtomic(Object value) {
        return isNumeric(value) || isStringLike(value) || value instanceof Boolean;
    }

    public static double toDouble(Object numeric) {
        return ((Number) numeric).doubleValue();
    }

    public static BigDecimal toDecimal(Object numeric) {
        if (numeric instanceof BigDecimal)
            return (BigDecimal) numeric;
        else if (numeric instanceof BigInteger)
            return new BigDecimal((BigInteger) numeric);
        else
            return BigDecimal.valueOf(((Number) numeric).doubleValue());
    }

    /**
     * Parse the lexical form of a number. XPath 1.0 only knows optional minus, digits and an optional fraction;
     * XPath 2.0 also accepts a leading plus, exponents, <code>INF</code> and <code>NaN</code>. Whitespace around
     * the number is ignored. Anything else is NaN.
     */
    public static double parseDouble(String text, boolean compatibility) {
        final String trimmed = trimWhitespace(text);
        if (compatibility) {
            if (XPATH1_NUMBER.matcher(trimmed).matches())
                return Double.parseDouble(trimmed);
        } else {
            if (XPATH2_NUMBER.matcher(trimmed).matches())
                return Double.parseDouble(trimmed);
            else if ("INF".equals(trimmed) || "+INF".equals(trimmed))
                return Double.POSITIVE_INFINITY;
            else if ("-INF".equals(trimmed))
                return Double.NEGATIVE_INFINITY;
        }
        return Double.NaN;
    }

    public static String stringValue(Object atomic, boolean compatibility) {
        if (atomic instanceof Double)
            return formatDouble((Double) atomic, compatibility);
        else if (atomic instanceof BigDecimal)
            return formatDecimal((BigDecimal) atomic);
        else if (atomic instanceof Boolean)
            return ((Boolean) atomic) ? "true" : "false";
        else
            return String.valueOf(atomic);
    }

    public static String formatDecimal(BigDecimal value) {
        if (value.signum() == 0)
            return "0";
        return value.stripTrailingZeros().toPlainString();
    }

    /**
     * XPath 1.0 prints numbers without exponent; XPath 2.0 uses the canonical xs:double form, with an exponent
     * outside of [1e-6, 1e6).
     */
    public static String formatDouble(double value, boolean compatibility) {
        if (Double.isNaN(value))
            return "NaN";
        else if (Double.isInfinite(value))
            return value > 0 ? (compatibility ? "Infinity" : "INF") : (compatibility ? "-Infinity" : "-INF");
        else if (value == 0)
            return (compatibility || 1 / value > 0) ? "0" : "-0";

        final BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        final double abs = Math.abs(value);
        if (compatibility || (abs >= 1e-6 && abs < 1e6))
            return decimal.toPlainString();

        final String digits = decimal.unscaledValue().abs().toString();
        final int exponent = digits.length() - 1 - decimal.scale();
        final StringBuilder sb = new StringBuilder();
        if (value < 0)
            sb.append('-');
        sb.append(digits.charAt(0)).append('.');
        sb.append(digits.length() > 1 ? digits.substring(1) : "0");
        sb.append('E').append(exponent);
        return sb.toString();
    }

    public static boolean isXmlWhitespace(char c) {
        return c == ' ' || c == '\n' || c == '\r' || c == '\t';
    }

    public static String trimWhitespace(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isXmlWhitespace(text.charAt(start)))
            start++;
        while (end > start && isXmlWhitespace(text.charAt(end - 1)))
            end--;
        return text.substring(start, end);
    }
}
