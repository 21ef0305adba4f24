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

import java.util.Collections;

/**
 * Variable reference <code>$name</code> or <code>$prefix:name</code>.
 */
public class VariableToken extends XPathToken {

    public VariableToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        String name = parser.advanceName();
        final XPathToken next = parser.getNextToken();
        if (":".equals(next.getSymbol()) && !next.isSpaced()) {
            parser.advance(":");
            if (parser.getNextToken().isSpaced())
                throw wrongSyntax("a QName cannot contain whitespace");
            name = name + ":" + parser.advanceName();
        }
        value = name;
        return this;
    }

    public String getName() {
        return (String) value;
    }

    @Override
    public Object evaluate(XPathContext context) {
        if (context == null)
            throw missingContext();
        final String name = getName();
        if (!context.hasVariable(name)) {
            // Static evaluation against a schema has no variable values
            if (context.isSchema())
                return Collections.emptyList();
            throw missingName("unknown variable '" + name + "'");
        }
        return context.getVariable(name);
    }

    @Override
    public String getTree() {
        return "($ (" + value + "))";
    }
}
