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

import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.parser.XPathParser;

/**
 * Variable reference checked when parsing against the in-scope variables declared to an XPath 2 parser.
 */
public class VariableReferenceToken extends VariableToken {

    public VariableReferenceToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        super.nud();
        if (parser instanceof XPath2Parser && !((XPath2Parser) parser).isVariableInScope(getName()))
            throw missingName("unknown variable '" + getName() + "'");
        return this;
    }
}
