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

import org.apache.commons.lang3.StringUtils;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.FunctionToken;
import org.orbeon.xpath.om.AttributeNode;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.XPathParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * <code>id(ids)</code>: elements of the context tree whose <code>id</code> or <code>xml:id</code> attribute is
 * one of the whitespace-separated identifiers. Without DTD information, these are the attributes taken as IDs.
 */
public class IdFunction implements Function {

    private static final String XML_ID = "{" + XPathParser.XML_NAMESPACE + "}id";

    public Object call(FunctionToken token, XPathContext context) {
        final Set<String> ids = new HashSet<String>();
        for (Iterator<Object> i = token.get(0).select(context != null ? context.copy() : null); i.hasNext();) {
            for (String id : StringUtils.split(token.stringValue(i.next())))
                ids.add(id);
        }

        final Object item = token.getContextItem(context);
        if (!(item instanceof XPathNode))
            throw token.wrongType("the context item of 'id' is not a node");

        final List<Object> result = new ArrayList<Object>();
        for (XPathNode node : ((XPathNode) item).getTree().getNodes()) {
            if (node instanceof ElementNode) {
                final ElementNode element = (ElementNode) node;
                if (matches(element.getAttribute("id"), ids) || matches(element.getAttribute(XML_ID), ids))
                    result.add(element);
            }
        }
        return result;
    }

    private static boolean matches(AttributeNode attribute, Set<String> ids) {
        return attribute != null && ids.contains(attribute.getStringValue().trim());
    }
}
