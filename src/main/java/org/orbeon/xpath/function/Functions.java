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
package org.orbeon.xpath.function;

import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.Comparisons;
import org.orbeon.xpath.expr.FunctionToken;
import org.orbeon.xpath.value.UntypedAtomic;
import org.orbeon.xpath.value.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the functions.
 */
public class Functions {

    private Functions() {}

    /**
     * Collation given as argument, or the default collation of the context.
     */
    public static String getCollation(FunctionToken token, XPathContext context, int index) {
        if (token.hasArgument(index))
            return token.getStringArgument(context, index);
        return context != null ? context.getDefaultCollation() : null;
    }

    public static List<Integer> codePoints(String text) {
        final List<Integer> result = new ArrayList<Integer>(text.length());
        for (int i = 0; i < text.length();) {
            final int codePoint = text.codePointAt(i);
            result.add(codePoint);
            i += Character.charCount(codePoint);
        }
        return result;
    }

    /**
     * XPath rounding of a position: halves go up, NaN and infinities are kept.
     */
    public static double roundPosition(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return value;
        return Math.floor(value + 0.5);
    }

    /**
     * Atomic number of an argument for the rounding functions, null if empty.
     */
    public static Object getNumericArgument(FunctionToken token, XPathContext context) {
        if (token.getParser() != null && token.getParser().isCompatibilityMode())
            return token.getNumberArgument(context, 0);
        final Object value = token.getAtomicArgument(context, 0);
        if (value == null || Values.isNumeric(value))
            return value;
        else if (value instanceof UntypedAtomic)
            return Comparisons.castToDouble(token, value.toString());
        throw token.wrongType("function '" + token.getSymbol() + "' requires a numeric argument");
    }
}
