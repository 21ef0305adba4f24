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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The <code>//</code> operator: the right step is evaluated for the left nodes, or the root, and for all of
 * their descendants.
 */
public class DescendantPathToken extends PathToken {

    public DescendantPathToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        items.add(parser.expression(getRbp()));
        return this;
    }

    @Override
    public Iterator<Object> select(final XPathContext context) {
        final List<Object> start;
        if (items.size() == 1) {
            checkRoot(context);
            start = Collections.<Object>singletonList(context.getDocument());
        } else {
            start = toList(items.get(0).select(context));
        }
        final XPathToken right = items.get(items.size() - 1);

        final Iterator<Object> descendants = new StepIterator(context.iterFocus(start)) {
            protected Iterator<Object> step(Object item) {
                if (item != null && !(item instanceof XPathNode))
                    throw error(ErrorCode.XPTY0019, "an intermediate step of a path contains an atomic value");
                return context.iterDescendants(null);
            }
        };
        return sortResults(new StepIterator(descendants) {
            protected Iterator<Object> step(Object item) {
                return right.select(context);
            }
        });
    }
}
