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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class ForToken extends VariableBindingToken {

    public ForToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    protected String getBodyKeyword() {
        return "return";
    }

    @Override
    public Object evaluate(XPathContext context) {
        if (context == null)
            throw missingContext();
        final List<Object> results = new ArrayList<Object>();
        final XPathToken body = getBody();
        bind(context, 0, new BindingVisitor() {
            public boolean visit(XPathContext bound) {
                for (Iterator<Object> i = body.select(bound); i.hasNext();)
                    results.add(i.next());
                return true;
            }
        });
        return results;
    }
}
