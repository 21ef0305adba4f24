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
package org.orbeon.xpath.om;

import org.dom4j.Namespace;

/**
 * Namespace node: one in-scope namespace of an element. Its name is the prefix and its value the URI.
 */
public class NamespaceNode extends XPathNode {

    private final Namespace namespace;

    public NamespaceNode(ElementNode parent, int position, Namespace namespace) {
        super(parent.getTree(), parent, position);
        this.namespace = namespace;
    }

    public NodeKind getKind() {
        return NodeKind.NAMESPACE;
    }

    public Object getNativeNode() {
        return namespace;
    }

    public String getPrefix() {
        return namespace.getPrefix();
    }

    public String getUri() {
        return namespace.getURI();
    }

    @Override
    public String getLocalName() {
        return namespace.getPrefix();
    }

    public String getStringValue() {
        return namespace.getURI();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other)
            return true;
        if (!(other instanceof NamespaceNode))
            return false;
        final NamespaceNode otherNamespace = (NamespaceNode) other;
        return parent == otherNamespace.parent && getPrefix().equals(otherNamespace.getPrefix());
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(parent) * 31 + getPrefix().hashCode();
    }
}
