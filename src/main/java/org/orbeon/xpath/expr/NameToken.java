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
 * Name test of a step. Without an explicit axis, selects the child elements of the context node with that name.
 */
public class NameToken extends XPathToken {

    public NameToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        return this;
    }

    @Override
    public Iterator<Object> select(XPathContext context) {
        checkNodeFocus(context);
        return context.iterMatchingNodes(getNameTest(context));
    }

    @Override
    public boolean isDocumentOrdered() {
        return true;
    }

    /**
     * Name test in the notation understood by {@link org.orbeon.xpath.om.XPathNode#matchesName(String)}. An
     * unprefixed name is in the default element namespace, except on the attribute and namespace axes.
     */
    public String getNameTest(XPathContext context) {
        final String name = (String) value;
        final String defaultNamespace = parser != null ? parser.getDefaultNamespace() : null;
        if (defaultNamespace == null || defaultNamespace.length() == 0)
            return name;
        final String axis = context.getAxis();
        if (XPathContext.ATTRIBUTE.equals(axis) || XPathContext.NAMESPACE.equals(axis))
            return name;
        return "{" + defaultNamespace + "}" + name;
    }

    @Override
    public boolean isNodeTest() {
        return true;
    }
}
