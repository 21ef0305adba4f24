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
 * The context item <code>.</code>, which may also be an atomic value.
 */
public class ContextItemToken extends XPathToken {

    public ContextItemToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        return this;
    }

    @Override
    public Iterator<Object> select(XPathContext context) {
        if (context == null || (context.getItem() == null && context.getRoot() == null))
            throw missingContext();
        return context.iterSelf();
    }

    @Override
    public boolean isDocumentOrdered() {
        return true;
    }
}
