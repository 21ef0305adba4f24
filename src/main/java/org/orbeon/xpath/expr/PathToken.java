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
import org.orbeon.xpath.om.DocumentOrder;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The <code>/</code> operator. Alone it selects the root of the tree; as a prefix it starts a path from the root;
 * between two steps it evaluates the right step for each node selected by the left one.
 *
 * Results are in document order without duplicates. When the left step selects a single node and the right step
 * already yields nodes in document order, results are streamed; otherwise they are collected and sorted.
 */
public class PathToken extends XPathToken {

    public PathToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        if (parser.isPathStep(parser.getNextToken()))
            items.add(parser.expression(getRbp()));
        return this;
    }

    @Override
    public XPathToken led(XPathToken left) {
        items.add(left);
        items.add(parser.expression(getRbp()));
        return this;
    }

    @Override
    public Iterator<Object> select(XPathContext context) {
        if (items.isEmpty()) {
            checkRoot(context);
            final XPathNode root = context.getDocument() != null ? context.getDocument() : context.getRoot();
            return Collections.<Object>singletonList(root).iterator();
        } else if (items.size() == 1) {
            checkRoot(context);
            // A null item stands for the implicit document above a root element
            return selectSteps(context, Collections.<Object>singletonList(context.getDocument()), items.get(0));
        } else {
            return selectSteps(context, toList(items.get(0).select(context)), items.get(1));
        }
    }

    private Iterator<Object> selectSteps(final XPathContext context, List<Object> leftItems, final XPathToken right) {
        final Iterator<Object> results = new StepIterator(context.iterFocus(leftItems)) {
            protected Iterator<Object> step(Object item) {
                if (item != null && !(item instanceof XPathNode))
                    throw error(ErrorCode.XPTY0019, "an intermediate step of a path contains an atomic value");
                return right.select(context);
            }
        };
        if (leftItems.size() == 1 && right.isDocumentOrdered())
            return results;
        return sortResults(results);
    }

    protected void checkRoot(XPathContext context) {
        if (context == null || context.getRoot() == null)
            throw missingContext();
    }

    /**
     * Collect path results: nodes are deduplicated and sorted in document order, atomic values are kept as they
     * are. A mix of both is an error.
     */
    protected Iterator<Object> sortResults(Iterator<Object> results) {
        final Set<Object> nodes = new LinkedHashSet<Object>();
        final List<Object> atomics = new ArrayList<Object>();
        while (results.hasNext()) {
            final Object item = results.next();
            if (item instanceof XPathNode)
                nodes.add(item);
            else if (item != null)
                atomics.add(item);
        }
        if (!atomics.isEmpty()) {
            if (!nodes.isEmpty())
                throw error(ErrorCode.XPTY0018, "the result of a path mixes nodes and atomic values");
            return atomics.iterator();
        }
        final List<Object> sorted = new ArrayList<Object>(nodes);
        DocumentOrder.sort(sorted);
        return sorted.iterator();
    }

    @Override
    public boolean isDocumentOrdered() {
        return true;
    }
}
