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
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class IntersectExceptToken extends UnionToken {

    public IntersectExceptToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public Object evaluate(XPathContext context) {
        final List<Object> left = getNodes(context, 0);
        final Set<Object> right = new HashSet<Object>(getNodes(context, 1));
        final boolean intersect = "intersect".equals(getSymbol());

        final Set<Object> nodes = new LinkedHashSet<Object>();
        for (Object node : left) {
            if (right.contains(node) == intersect)
                nodes.add(node);
        }
        final List<Object> result = new ArrayList<Object>(nodes);
        DocumentOrder.sort(result);
        return result;
    }
}
