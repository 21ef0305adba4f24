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
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

/**
 * Names with a braced URI: <code>Q{uri}name</code>, or the <code>{uri}name</code> form accepted outside of strict
 * mode. The token value is the URI found by the lexer, replaced by the name test once parsed.
 */
public class BracedNameToken extends NameToken {

    public BracedNameToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        if (parser.isStrict() && "{".equals(getSymbol()))
            throw wrongSyntax("'{uri}name' names are not allowed in strict mode");

        final String uri = (String) value;
        final XPathToken next = parser.getNextToken();
        if (next.isSpaced())
            throw wrongSyntax("a braced name cannot contain whitespace");

        if (TokenDefinition.LABEL_FUNCTION.equals(next.getLabel())) {
            if (!XPathParser.XPATH_FUNCTIONS_NAMESPACE.equals(uri))
                throw error(ErrorCode.XPST0017, "unknown function '{" + uri + "}" + next.getSymbol() + "'");
            parser.advance();
            return next.nud();
        }

        final String localName;
        if ("*".equals(next.getSymbol()))
            localName = "*";
        else if (next.isNameLike())
            localName = next.getNameValue();
        else
            throw wrongSyntax("unexpected " + next + " after braced URI");
        parser.advance();
        value = "{" + uri + "}" + localName;
        return this;
    }

    @Override
    public String getNameTest(XPathContext context) {
        return (String) value;
    }
}
