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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Union of two node sequences, <code>|</code> or <code>union</code>, in document order without duplicates.
 */
public class UnionToken extends XPathToken {

    public UnionToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        if (Character.isLetter(getSymbol().charAt(0)))
            return asName();
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
        final List<Object> left = getNodes(context, 0);
        final List<Object> right = getNodes(context, 1);

        // Operands already sorted are merged, others go through a set and a sort
        if (items.get(0).isDocumentOrdered() && items.get(1).isDocumentOrdered())
            return DocumentOrder.merge(left, right);

        final LinkedHashSet<Object> nodes = new LinkedHashSet<Object>(left);
        nodes.addAll(right);
        final List<Object> result = new ArrayList<Object>(nodes);
        DocumentOrder.sort(result);
        return result;
    }

    /**
     * Nodes of an operand, raising a type error for atomic values.
     */
    protected List<Object> getNodes(XPathContext context, int index) {
        final List<Object> result = new ArrayList<Object>();
        for (Object item : toList(items.get(index).select(copy(context)))) {
            if (item instanceof XPathNode)
                result.add(item);
            else if (item != null)
                throw wrongType("operands of '" + getSymbol() + "' must be node sequences, found "
                        + Comparisons.typeName(item));
        }
        return result;
    }

    @Override
    public boolean isDocumentOrdered() {
        return true;
    }
}
