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
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.parser.XPathParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Base of the expressions binding range variables: <code>for $a in A, $b in B return E</code> and the
 * quantified expressions. Items hold the binding sequences followed by the body.
 */
public abstract class VariableBindingToken extends XPathToken {

    protected final List<String> variableNames = new ArrayList<String>();

    protected VariableBindingToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    /**
     * Keyword introducing the body: <code>return</code> or <code>satisfies</code>.
     */
    protected abstract String getBodyKeyword();

    @Override
    public XPathToken nud() {
        if (!"$".equals(parser.getNextToken().getSymbol()))
            return asName();
        final XPath2Parser scope = parser instanceof XPath2Parser ? (XPath2Parser) parser : null;
        try {
            while (true) {
                parser.advance("$");
                final String name = parser.advanceName();
                parser.advance("in");
                items.add(parser.expression(5));
                variableNames.add(name);
                if (scope != null)
                    scope.bindRangeVariable(name);
                if (!",".equals(parser.getNextToken().getSymbol()))
                    break;
                parser.advance(",");
            }
            parser.advance(getBodyKeyword());
            items.add(parser.expression(5));
        } finally {
            if (scope != null) {
                for (String name : variableNames)
                    scope.unbindRangeVariable(name);
            }
        }
        return this;
    }

    public List<String> getVariableNames() {
        return Collections.unmodifiableList(variableNames);
    }

    protected XPathToken getBody() {
        return items.get(items.size() - 1);
    }

    /**
     * Visit every combination of bindings, in order, until the visitor returns false.
     *
     * @return false if the visit was stopped
     */
    protected boolean bind(XPathContext context, int index, BindingVisitor visitor) {
        if (index == variableNames.size())
            return visitor.visit(context);
        for (Iterator<Object> i = items.get(index).select(copy(context)); i.hasNext();) {
            final Object item = i.next();
            final XPathContext bound = context.copy();
            bound.setVariable(variableNames.get(index), item);
            if (!bind(bound, index + 1, visitor))
                return false;
        }
        return true;
    }

    protected interface BindingVisitor {
        boolean visit(XPathContext context);
    }

    @Override
    public String getTree() {
        final StringBuilder sb = new StringBuilder("(").append(getSymbol());
        for (int i = 0; i < variableNames.size(); i++)
            sb.append(" ($ (").append(variableNames.get(i)).append(")) ").append(items.get(i).getTree());
        return sb.append(' ').append(getBody().getTree()).append(')').toString();
    }
}
