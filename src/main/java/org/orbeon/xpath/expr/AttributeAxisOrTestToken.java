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

import org.apache.commons.collections.Predicate;
import org.apache.commons.collections.iterators.FilterIterator;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.AttributeNode;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

import java.util.Iterator;

/**
 * XPath 2 <code>attribute</code>: the attribute axis when followed by <code>::</code>, the
 * <code>attribute([name])</code> kind test when followed by a parenthesis.
 */
public class AttributeAxisOrTestToken extends AxisToken {

    private boolean kindTest;

    public AttributeAxisOrTestToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        if ("::".equals(parser.getNextToken().getSymbol()))
            return super.nud();

        kindTest = true;
        parser.advance("(");
        if (!")".equals(parser.getNextToken().getSymbol())) {
            final XPathToken name = parser.expression(5);
            if (!(name instanceof NameToken || (name instanceof WildcardToken && name.isNodeTest())))
                throw name.wrongSyntax("unexpected " + name + ", expected an attribute name");
            items.add(name);
        }
        parser.advance(")");
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Object> select(XPathContext context) {
        if (!kindTest)
            return super.select(context);

        checkNodeFocus(context);
        final String nameTest = getNameTest(context);
        // Without an explicit axis the test applies to the attribute axis
        final Iterator<Object> candidates = context.getAxis() == null ? context.iterAttributes() : context.iterChildrenOrSelf();
        return new FilterIterator(candidates, new Predicate() {
            public boolean evaluate(Object candidate) {
                return candidate instanceof AttributeNode
                        && (nameTest == null || ((AttributeNode) candidate).matchesName(nameTest));
            }
        });
    }

    private String getNameTest(XPathContext context) {
        if (items.isEmpty())
            return null;
        final XPathToken name = items.get(0);
        if (name instanceof WildcardToken)
            return "*";
        // Unprefixed attribute names are in no namespace
        return name.getClass() == NameToken.class ? (String) name.getValue() : ((NameToken) name).getNameTest(context);
    }

    @Override
    public boolean isDocumentOrdered() {
        return true;
    }

    @Override
    public boolean isNodeTest() {
        return kindTest;
    }
}
