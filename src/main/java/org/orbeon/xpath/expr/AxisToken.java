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
 * Explicit axis step <code>axis::test</code>. Nodes are yielded in the order of the axis, so reverse axes yield
 * the nearest node first.
 */
public class AxisToken extends XPathToken {

    public AxisToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        parser.advance("::");
        final XPathToken test = parser.expression(getRbp());
        if (!test.isNodeTest())
            throw test.wrongSyntax("unexpected " + test + ", expected a name test or a kind test");
        items.add(test);
        return this;
    }

    @Override
    public Iterator<Object> select(final XPathContext context) {
        checkNodeFocus(context);
        final XPathToken test = items.get(0);
        return new StepIterator(iterAxis(context)) {
            protected Iterator<Object> step(Object item) {
                return test.select(context);
            }
        };
    }

    protected Iterator<Object> iterAxis(XPathContext context) {
        final String axis = getSymbol();
        if (XPathContext.CHILD.equals(axis))
            return context.iterChildren();
        else if (XPathContext.SELF.equals(axis))
            return context.iterSelf();
        else if (XPathContext.ATTRIBUTE.equals(axis))
            return context.iterAttributes();
        else if (XPathContext.PARENT.equals(axis))
            return context.iterParent();
        else if (XPathContext.DESCENDANT.equals(axis) || XPathContext.DESCENDANT_OR_SELF.equals(axis))
            return context.iterDescendants(axis);
        else if (XPathContext.ANCESTOR.equals(axis) || XPathContext.ANCESTOR_OR_SELF.equals(axis))
            return context.iterAncestors(axis);
        else if (XPathContext.FOLLOWING_SIBLING.equals(axis) || XPathContext.PRECEDING_SIBLING.equals(axis))
            return context.iterSiblings(axis);
        else if (XPathContext.FOLLOWING.equals(axis))
            return context.iterFollowings();
        else if (XPathContext.PRECEDING.equals(axis))
            return context.iterPreceding();
        else if (XPathContext.NAMESPACE.equals(axis))
            return context.iterNamespaces();
        throw wrongSyntax("unknown axis '" + axis + "'");
    }

    public boolean isReverse() {
        return definition.isReverseAxis();
    }

    @Override
    public boolean isDocumentOrdered() {
        return !isReverse();
    }
}
