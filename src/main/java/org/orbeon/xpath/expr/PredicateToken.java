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
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.value.Values;

import java.util.Iterator;

/**
 * Filter <code>[...]</code>. A predicate whose value is a single number keeps the item at that position, any
 * other predicate keeps the items for which its effective boolean value is true.
 */
public class PredicateToken extends XPathToken {

    public PredicateToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken led(XPathToken left) {
        items.add(left);
        items.add(parser.expression(0));
        parser.advance("]");
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Object> select(final XPathContext context) {
        if (context == null)
            throw missingContext();
        final XPathToken predicate = items.get(1);
        return new FilterIterator(context.innerFocusSelect(items.get(0)), new Predicate() {
            public boolean evaluate(Object item) {
                return accepts(predicate, context);
            }
        });
    }

    private boolean accepts(XPathToken predicate, XPathContext context) {
        final Iterator<Object> values = predicate.select(context.copy());
        if (!values.hasNext())
            return false;
        final Object first = values.next();
        if (first == null || first instanceof XPathNode)
            return true;
        if (values.hasNext())
            throw error(ErrorCode.FORG0006, "effective boolean value is not defined for a sequence of two or more "
                    + "items starting with " + Comparisons.typeName(first));
        if (Values.isNumeric(first))
            return Values.toDouble(first) == context.getPosition();
        return booleanValue(first);
    }

    @Override
    public boolean isDocumentOrdered() {
        return items.get(0).isDocumentOrdered();
    }
}
