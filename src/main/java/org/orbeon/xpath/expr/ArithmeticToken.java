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
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.value.UntypedAtomic;
import org.orbeon.xpath.value.Values;

import java.util.Collections;
import java.util.List;

/**
 * Arithmetic operators: unary and binary <code>+</code> and <code>-</code>, <code>*</code>, <code>div</code>,
 * <code>mod</code> and <code>idiv</code>.
 */
public class ArithmeticToken extends XPathToken {

    private static final int UNARY_BINDING_POWER = 70;

    public ArithmeticToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        final String symbol = getSymbol();
        if ("+".equals(symbol) || "-".equals(symbol)) {
            items.add(parser.expression(UNARY_BINDING_POWER));
            return this;
        } else if (Character.isLetter(symbol.charAt(0))) {
            return asName();
        }
        return super.nud();
    }

    @Override
    public XPathToken led(XPathToken left) {
        items.add(left);
        items.add(parser.expression(getRbp()));
        return this;
    }

    @Override
    public Object evaluate(XPathContext context) {
        final boolean compatibility = isCompatibilityMode();
        try {
            if (items.size() == 1) {
                final Object operand = getOperand(context, 0);
                if (operand == null)
                    return compatibility ? (Object) Double.NaN : Collections.emptyList();
                return "-".equals(getSymbol()) ? NumericOperations.negate(operand) : operand;
            }

            final Object a = getOperand(context, 0);
            final Object b = getOperand(context, 1);
            if (a == null || b == null)
                return compatibility ? (Object) Double.NaN : Collections.emptyList();

            final String symbol = getSymbol();
            if ("+".equals(symbol))
                return NumericOperations.add(a, b);
            else if ("-".equals(symbol))
                return NumericOperations.subtract(a, b);
            else if ("*".equals(symbol))
                return NumericOperations.multiply(a, b);
            else if ("div".equals(symbol))
                return NumericOperations.divide(a, b, compatibility, this);
            else if ("mod".equals(symbol))
                return NumericOperations.mod(a, b, compatibility, this);
            else
                return NumericOperations.integerDivide(a, b, this);
        } catch (XPathException e) {
            // Against a schema, operands only carry sample values of their types
            if (context != null && context.isSchema()
                    && (e.getCode() == ErrorCode.XPTY0004 || e.getCode() == ErrorCode.FORG0001))
                return Collections.emptyList();
            throw e;
        }
    }

    /**
     * Numeric value of an operand, null if the operand is empty. XPath 1.0 converts any value to a number, XPath 2.0
     * only casts untyped values.
     */
    private Object getOperand(XPathContext context, int index) {
        if (isCompatibilityMode()) {
            final List<Object> values = toList(items.get(index).select(copy(context)));
            if (values.isEmpty())
                return null;
            final Object first = dataValue(values.get(0));
            return Values.isNumeric(first) ? first : (Object) numberValue(first);
        }
        final Object operand = getAtomicArgument(context, index);
        if (operand instanceof UntypedAtomic)
            return Comparisons.castToDouble(this, operand.toString());
        else if (operand != null && !Values.isNumeric(operand))
            throw wrongType("unsupported operand type " + Comparisons.typeName(operand) + " for '" + getSymbol() + "'");
        return operand;
    }
}
