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

import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.function.CollationManager;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.value.UntypedAtomic;
import org.orbeon.xpath.value.Values;

import java.util.List;

/**
 * Comparison rules shared by general comparisons, value comparisons and the functions comparing values.
 */
public class Comparisons {

    private Comparisons() {}

    /**
     * Apply a comparison operator to the result of a three-way comparison. A null comparison, as with NaN, only
     * satisfies <code>!=</code>.
     */
    public static boolean apply(String operator, Integer comparison) {
        if (comparison == null)
            return "!=".equals(operator) || "ne".equals(operator);
        final int c = comparison;
        if ("=".equals(operator) || "eq".equals(operator))
            return c == 0;
        else if ("!=".equals(operator) || "ne".equals(operator))
            return c != 0;
        else if ("<".equals(operator) || "lt".equals(operator))
            return c < 0;
        else if ("<=".equals(operator) || "le".equals(operator))
            return c <= 0;
        else if (">".equals(operator) || "gt".equals(operator))
            return c > 0;
        else
            return c >= 0;
    }

    public static boolean isEquality(String operator) {
        return "=".equals(operator) || "!=".equals(operator) || "eq".equals(operator) || "ne".equals(operator);
    }

    /**
     * XPath 2.0 general comparison: true if some pair of atomized items satisfies the operator.
     */
    public static boolean generalCompare(XPathToken token, XPathContext context, String operator, List<Object> left,
                                         List<Object> right) {
        for (Object l : left) {
            final Object a = atomize(l);
            for (Object r : right) {
                final Object b = atomize(r);
                if (apply(operator, compareAtomics(token, context, operator, castUntyped(token, a, b), castUntyped(token, b, a))))
                    return true;
            }
        }
        return false;
    }

    /**
     * XPath 1.0 comparison of two evaluated operands.
     */
    public static boolean compatibilityCompare(XPathToken token, XPathContext context, String operator,
                                               List<Object> left, List<Object> right) {
        final boolean equality = isEquality(operator);
        if (isSingleBoolean(left) || isSingleBoolean(right)) {
            final boolean a = token.booleanValue(left);
            final boolean b = token.booleanValue(right);
            if (equality)
                return apply(operator, Boolean.valueOf(a).compareTo(b));
            return apply(operator, NumericOperations.compare(a ? 1.0 : 0.0, b ? 1.0 : 0.0));
        }
        for (Object l : left) {
            final Object a = atomize(l);
            for (Object r : right) {
                final Object b = atomize(r);
                final Integer comparison;
                if (!equality || Values.isNumeric(a) || Values.isNumeric(b))
                    comparison = NumericOperations.compare(token.numberValue(a), token.numberValue(b));
                else
                    comparison = compareStrings(token, context, token.stringValue(a), token.stringValue(b));
                if (apply(operator, comparison))
                    return true;
            }
        }
        return false;
    }

    /**
     * Compare two atomic values of comparable types. Untyped values compare as strings.
     */
    public static Integer compareAtomics(XPathToken token, XPathContext context, String operator, Object a, Object b) {
        if (Values.isNumeric(a) && Values.isNumeric(b)) {
            return NumericOperations.compare(a, b);
        } else if (Values.isStringLike(a) && Values.isStringLike(b)) {
            return compareStrings(token, context, a.toString(), b.toString());
        } else if (a instanceof Boolean && b instanceof Boolean) {
            return ((Boolean) a).compareTo((Boolean) b);
        }
        throw token.wrongType("cannot compare " + typeName(a) + " with " + typeName(b));
    }

    public static int compareStrings(XPathToken token, XPathContext context, String a, String b) {
        final String collation = context != null ? context.getDefaultCollation() : null;
        if (CollationManager.isCodepoint(collation)) {
            return CollationManager.compareCodepoints(a, b);
        }
        final CollationManager manager = new CollationManager(collation, token);
        try {
            return manager.compare(a, b);
        } finally {
            manager.close();
        }
    }

    /**
     * Cast an untyped value to the type it is compared with: double against numbers, boolean against booleans,
     * string otherwise.
     */
    public static Object castUntyped(XPathToken token, Object value, Object other) {
        if (!(value instanceof UntypedAtomic))
            return value;
        final String text = ((UntypedAtomic) value).getValue();
        if (Values.isNumeric(other)) {
            return castToDouble(token, text);
        } else if (other instanceof Boolean) {
            final String trimmed = Values.trimWhitespace(text);
            if ("true".equals(trimmed) || "1".equals(trimmed))
                return Boolean.TRUE;
            else if ("false".equals(trimmed) || "0".equals(trimmed))
                return Boolean.FALSE;
            throw token.wrongValue("invalid value '" + text + "' for xs:boolean");
        }
        return text;
    }

    public static Double castToDouble(XPathToken token, String text) {
        final double result = Values.parseDouble(text, false);
        if (Double.isNaN(result) && !"NaN".equals(Values.trimWhitespace(text)))
            throw token.wrongValue("invalid value '" + text + "' for xs:double");
        return result;
    }

    /**
     * Equality used by functions such as <code>distinct-values</code>: values of incomparable types are
     * different, and NaN equals itself.
     */
    public static boolean sameValue(XPathToken token, XPathContext context, Object a, Object b) {
        if (Values.isNumeric(a) && Values.isNumeric(b)) {
            final Integer comparison = NumericOperations.compare(a, b);
            if (comparison == null)
                return Double.isNaN(Values.toDouble(a)) && Double.isNaN(Values.toDouble(b));
            return comparison == 0;
        } else if (Values.isStringLike(a) && Values.isStringLike(b)) {
            return compareStrings(token, context, a.toString(), b.toString()) == 0;
        }
        return a.equals(b);
    }

    private static boolean isSingleBoolean(List<Object> values) {
        return values.size() == 1 && values.get(0) instanceof Boolean;
    }

    private static Object atomize(Object item) {
        return item instanceof XPathNode ? ((XPathNode) item).getTypedValue() : item;
    }

    static String typeName(Object value) {
        if (value instanceof UntypedAtomic)
            return "xs:untypedAtomic";
        else if (value instanceof String)
            return "xs:string";
        else if (value instanceof Boolean)
            return "xs:boolean";
        else if (value instanceof Double)
            return "xs:double";
        else if (value instanceof java.math.BigDecimal)
            return "xs:decimal";
        else if (value instanceof java.math.BigInteger)
            return "xs:integer";
        else if (value == null)
            return "empty-sequence()";
        return value.getClass().getSimpleName();
    }
}
