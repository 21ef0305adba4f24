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
import org.orbeon.xpath.om.DocumentOrder;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

import java.util.Collections;

/**
 * Node comparisons: identity with <code>is</code>, document order with <code>&lt;&lt;</code> and
 * <code>&gt;&gt;</code>.
 */
public class NodeComparisonToken extends ComparisonToken {

    public NodeComparisonToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        if ("is".equals(getSymbol()))
            return asName();
        return super.nud();
    }

    @Override
    public Object evaluate(XPathContext context) {
        final Object a = getArgument(context, 0);
        final Object b = getArgument(context, 1);
        if (a == null || b == null)
            return Collections.emptyList();
        if (!(a instanceof XPathNode) || !(b instanceof XPathNode))
            throw wrongType("operands of '" + getSymbol() + "' must be nodes");

        final String symbol = getSymbol();
        if ("is".equals(symbol))
            return a.equals(b);
        final int comparison = DocumentOrder.INSTANCE.compare((XPathNode) a, (XPathNode) b);
        return "<<".equals(symbol) ? comparison < 0 : comparison > 0;
    }
}
