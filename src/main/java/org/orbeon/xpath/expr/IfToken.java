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
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

import java.util.Iterator;

/**
 * Conditional expression <code>if (test) then a else b</code>.
 */
public class IfToken extends XPathToken {

    public IfToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        if (!"(".equals(parser.getNextToken().getSymbol()))
            return asName();
        parser.advance("(");
        items.add(parser.expression(0));
        parser.advance(")");
        parser.advance("then");
        items.add(parser.expression(5));
        parser.advance("else");
        items.add(parser.expression(5));
        return this;
    }

    @Override
    public Object evaluate(XPathContext context) {
        return booleanValue(items.get(0).select(copy(context)))
                ? items.get(1).evaluate(context) : items.get(2).evaluate(context);
    }

    @Override
    public Iterator<Object> select(XPathContext context) {
        return booleanValue(items.get(0).select(copy(context)))
                ? items.get(1).select(context) : items.get(2).select(context);
    }
}
