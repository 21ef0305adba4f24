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
 * The colon of a prefixed name: <code>p:name</code>, <code>p:*</code>, <code>*:name</code>, or a function call
 * such as <code>fn:count(...)</code>. The prefix is resolved when parsing.
 */
public class PrefixedNameToken extends NameToken {

    public PrefixedNameToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        throw wrongSyntax("unexpected " + this);
    }

    @Override
    public XPathToken led(XPathToken left) {
        final XPathToken next = parser.getNextToken();
        if (isSpaced() || next.isSpaced())
            throw wrongSyntax("a QName cannot contain whitespace");

        final String prefix;
        if ("*".equals(left.getSymbol()) && left.size() == 0)
            prefix = "*";
        else if ("(name)".equals(left.getSymbol()))
            prefix = (String) left.getValue();
        else
            throw wrongSyntax("unexpected " + left + " before ':'");

        if (TokenDefinition.LABEL_FUNCTION.equals(next.getLabel())) {
            if ("*".equals(prefix) || !XPathParser.XPATH_FUNCTIONS_NAMESPACE.equals(resolvePrefix(prefix)))
                throw error(ErrorCode.XPST0017, "unknown function '" + prefix + ":" + next.getSymbol() + "'");
            parser.advance();
            return next.nud();
        }

        final String localName;
        if ("*".equals(next.getSymbol())) {
            if ("*".equals(prefix))
                throw wrongSyntax("invalid name test '*:*'");
            localName = "*";
        } else if (next.isNameLike()) {
            localName = next.getNameValue();
        } else {
            throw wrongSyntax("unexpected " + next + " after ':'");
        }
        parser.advance();
        items.add(left);
        items.add(parser.getToken());

        if ("*".equals(prefix)) {
            value = "*:" + localName;
        } else {
            final String uri = resolvePrefix(prefix);
            value = uri.length() == 0 ? localName : "{" + uri + "}" + localName;
        }
        return this;
    }

    private String resolvePrefix(String prefix) {
        final String uri = parser.getNamespaceUri(prefix);
        if (uri == null)
            throw error(ErrorCode.XPST0081, "unknown namespace prefix '" + prefix + "'");
        return uri;
    }

    @Override
    public String getNameTest(XPathContext context) {
        return (String) value;
    }
}
