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

/**
 * Attribute node. Two attribute nodes are equal when they belong to the same element and have the same name.
 */
public class AttributeNode extends XPathNode {

    private final String localName;
    private final String namespaceUri;
    private final String prefix;
    private final String value;
    private final Object nativeAttribute;

    public AttributeNode(ElementNode parent, int position, String localName, String namespaceUri, String prefix,
                         String value, Object nativeAttribute) {
        super(parent.getTree(), parent, position);
        this.localName = localName;
        this.namespaceUri = namespaceUri != null ? namespaceUri : "";
        this.prefix = prefix != null ? prefix : "";
        this.value = value != null ? value : "";
        this.nativeAttribute = nativeAttribute;
    }

    public NodeKind getKind() {
        return NodeKind.ATTRIBUTE;
    }

    public Object getNativeNode() {
        return nativeAttribute;
    }

    @Override
    public String getLocalName() {
        return localName;
    }

    @Override
    public String getNamespaceUri() {
        return namespaceUri;
    }

    @Override
    public String getPrefixedName() {
        return prefix.length() == 0 ? localName : prefix + ":" + localName;
    }

    public String getStringValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other)
            return true;
        if (!(other instanceof AttributeNode))
            return false;
        final AttributeNode otherAttribute = (AttributeNode) other;
        return parent == otherAttribute.parent && getExpandedName().equals(otherAttribute.getExpandedName());
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(parent) * 31 + getExpandedName().hashCode();
    }
}
