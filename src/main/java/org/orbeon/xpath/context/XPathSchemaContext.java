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
package org.orbeon.xpath.context;

import java.util.Collections;
import java.util.Iterator;

/**
 * Context for the static evaluation of an expression against the node tree of a schema graph. Evaluation in this
 * context finds type errors without instance documents: comparisons that cannot be decided give false, arithmetic
 * type errors give the empty sequence, and functions doing I/O give neutral results.
 */
public class XPathSchemaContext extends XPathContext {

    public XPathSchemaContext(Object schemaRoot) {
        super(schemaRoot);
    }

    protected XPathSchemaContext(XPathSchemaContext other) {
        super(other);
    }

    @Override
    public XPathContext copy() {
        return new XPathSchemaContext(this);
    }

    @Override
    public boolean isSchema() {
        return true;
    }

    @Override
    public Iterator<Object> iterNamespaces() {
        return Collections.emptyList().iterator();
    }
}
