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

import java.util.List;

/**
 * General comparisons: <code>=</code>, <code>!=</code>, <code>&lt;</code>, <code>&lt;=</code>, <code>&gt;</code>
 * and <code>&gt;=</code>, which hold when some pair of items taken from the two operands compares true.
 */
public class ComparisonToken extends XPathToken {

    public ComparisonToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken led(XPathToken left) {
        checkNotChained(left);
        items.add(left);
        items.add(parser.expression(getRbp()));
        return this;
    }

    /**
     * XPath 2.0 comparisons are not associative: <code>a = b = c</code> needs parentheses.
     */
    protected void checkNotChained(XPathToken left) {
        if (!isCompatibilityMode() && (left instanceof ComparisonToken || left instanceof ValueComparisonToken
                || left instanceof NodeComparisonToken))
            throw wrongSyntax("comparison operators cannot be chained");
    }

    @Override
    public Object evaluate(XPathContext context) {
        final List<Object> left = toList(items.get(0).select(copy(context)));
        final List<Object> right = toList(items.get(1).select(copy(context)));
        try {
            if (isCompatibilityMode())
                return Comparisons.compatibilityCompare(this, context, getSymbol(), left, right);
            return Comparisons.generalCompare(this, context, getSymbol(), left, right);
        } catch (XPathException e) {
            if (context != null && context.isSchema()
                    && (e.getCode() == ErrorCode.XPTY0004 || e.getCode() == ErrorCode.FORG0001))
                return Boolean.FALSE;
            throw e;
        }
    }
}
