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
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

import java.util.Iterator;

/**
 * Function call. Arguments are parsed as single expressions separated by commas; their number is checked
 * against the arity of the function when parsing.
 */
public class FunctionToken extends XPathToken {

    public FunctionToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        parser.advance("(");
        if (!")".equals(parser.getNextToken().getSymbol())) {
            while (true) {
                items.add(parser.expression(5));
                if (!",".equals(parser.getNextToken().getSymbol()))
                    break;
                parser.advance(",");
            }
        }
        parser.advance(")");

        final int min = definition.getMinArguments();
        final int max = definition.getMaxArguments();
        if (items.size() < min || (max >= 0 && items.size() > max))
            throw error(ErrorCode.XPST0017, "wrong number of arguments for function '" + getSymbol() + "': expected "
                    + (min == max ? String.valueOf(min) : max < 0 ? "at least " + min : min + " to " + max)
                    + ", found " + items.size());
        return this;
    }

    @Override
    public Object evaluate(XPathContext context) {
        return definition.getFunction().call(this, context);
    }

    @Override
    public Iterator<Object> select(XPathContext context) {
        return iterate(evaluate(context));
    }

    public boolean hasArgument(int index) {
        return index < items.size();
    }

    /**
     * Single item of an argument. XPath 1.0 takes the first item of a node-set where XPath 2.0 requires at most
     * one item.
     */
    public Object getItemArgument(XPathContext context, int index) {
        if (isCompatibilityMode()) {
            final Iterator<Object> values = items.get(index).select(copy(context));
            return values.hasNext() ? values.next() : null;
        }
        return getArgument(context, index);
    }

    public String getStringArgument(XPathContext context, int index) {
        return stringValue(getItemArgument(context, index));
    }

    public double getNumberArgument(XPathContext context, int index) {
        return numberValue(getItemArgument(context, index));
    }

    /**
     * Node argument, or the context node when the argument is omitted. Null for an empty argument.
     */
    public XPathNode getNodeArgument(XPathContext context, int index) {
        final Object item = hasArgument(index) ? getItemArgument(context, index) : getContextItem(context);
        if (item == null || item instanceof XPathNode)
            return (XPathNode) item;
        throw wrongType("an argument of function '" + getSymbol() + "' is not a node");
    }

    /**
     * Context item, the root element standing for the implicit document above it.
     */
    public Object getContextItem(XPathContext context) {
        if (context == null)
            throw missingContext();
        final Object item = context.getItem();
        if (item == null) {
            if (context.getRoot() == null)
                throw missingContext();
            return context.getRoot();
        }
        return item;
    }

    @Override
    public String toString() {
        return "'" + getSymbol() + "' function";
    }
}
