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
 * <code>*</code>: a wildcard name test when it starts an expression, the multiplication operator otherwise.
 */
public class WildcardToken extends ArithmeticToken {

    public WildcardToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        return this;
    }

    public boolean isNameTest() {
        return items.isEmpty();
    }

    @Override
    public Object evaluate(XPathContext context) {
        return isNameTest() ? toList(select(context)) : super.evaluate(context);
    }

    @Override
    public Iterator<Object> select(XPathContext context) {
        if (isNameTest()) {
            checkNodeFocus(context);
            return context.iterMatchingNodes("*");
        }
        return super.select(context);
    }

    @Override
    public boolean isDocumentOrdered() {
        return isNameTest();
    }

    @Override
    public boolean isNodeTest() {
        return isNameTest();
    }
}
