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

/**
 * <code>and</code> and <code>or</code>. The right operand is only evaluated when it decides the result.
 */
public class LogicalToken extends XPathToken {

    public LogicalToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        return asName();
    }

    @Override
    public XPathToken led(XPathToken left) {
        items.add(left);
        items.add(parser.expression(getRbp()));
        return this;
    }

    @Override
    public Object evaluate(XPathContext context) {
        final boolean left = booleanValue(items.get(0).select(copy(context)));
        if ("and".equals(getSymbol()))
            return left && booleanValue(items.get(1).select(copy(context)));
        else
            return left || booleanValue(items.get(1).select(copy(context)));
    }
}
