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
 * Abbreviated attribute step <code>@test</code>.
 */
public class AttributeToken extends XPathToken {

    public AttributeToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
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
        return new StepIterator(context.iterAttributes()) {
            protected Iterator<Object> step(Object item) {
                return test.select(context);
            }
        };
    }

    @Override
    public boolean isDocumentOrdered() {
        return true;
    }
}
