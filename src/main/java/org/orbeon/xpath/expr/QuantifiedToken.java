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

/**
 * <code>some</code> and <code>every</code>. Evaluation stops at the first binding deciding the result.
 */
public class QuantifiedToken extends VariableBindingToken {

    public QuantifiedToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    protected String getBodyKeyword() {
        return "satisfies";
    }

    @Override
    public Object evaluate(XPathContext context) {
        if (context == null)
            throw missingContext();
        final boolean some = "some".equals(getSymbol());
        final XPathToken body = getBody();
        final boolean completed = bind(context, 0, new BindingVisitor() {
            public boolean visit(XPathContext bound) {
                return booleanValue(body.select(bound)) != some;
            }
        });
        // Visiting all the bindings means no witness for some, no counterexample for every
        return some != completed;
    }
}
