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
package org.orbeon.xpath.function;

import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.FunctionToken;
import org.orbeon.xpath.om.AttributeNode;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.XPathParser;

import java.util.Locale;

/**
 * <code>lang(language)</code>: whether the nearest <code>xml:lang</code> attribute of the context node or its
 * ancestors is the given language or one of its sub-languages, ignoring case.
 */
public class LangFunction implements Function {

    private static final String XML_LANG = "{" + XPathParser.XML_NAMESPACE + "}lang";

    public Object call(FunctionToken token, XPathContext context) {
        final String language = token.getStringArgument(context, 0).toLowerCase(Locale.ROOT);
        final Object item = token.getContextItem(context);
        if (!(item instanceof XPathNode))
            throw token.wrongType("the context item of 'lang' is not a node");

        for (XPathNode node = (XPathNode) item; node != null; node = node.getParent()) {
            if (node instanceof ElementNode) {
                final AttributeNode attribute = ((ElementNode) node).getAttribute(XML_LANG);
                if (attribute != null) {
                    final String value = attribute.getStringValue().trim().toLowerCase(Locale.ROOT);
                    return value.equals(language) || value.startsWith(language + "-");
                }
            }
        }
        return Boolean.FALSE;
    }
}
