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

import org.dom4j.Attribute;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.dom4j.tree.DefaultNamespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Element node wrapping a dom4j element.
 */
public class Dom4jElementNode extends ElementNode {

    private final Element element;

    public Dom4jElementNode(NodeTree tree, XPathNode parent, int position, Element element, Map<String, String> namespaces) {
        super(tree, parent, position, element.getName(), element.getNamespaceURI(), element.getNamespacePrefix(), namespaces);
        this.element = element;
    }

    public Object getNativeNode() {
        return element;
    }

    public Element getElement() {
        return element;
    }

    public int getAttributeCount() {
        return element.attributeCount();
    }

    /**
     * Namespaces carry their element, so that they can be resolved back to their node.
     */
    @Override
    protected Namespace createNamespace(String prefix, String uri) {
        return new DefaultNamespace(element, prefix, uri);
    }

    protected List<AttributeNode> createAttributeNodes(int firstPosition) {
        final List<AttributeNode> result = new ArrayList<AttributeNode>(element.attributeCount());
        int current = firstPosition;
        for (Attribute attribute : element.attributes()) {
            result.add(new AttributeNode(this, current++, attribute.getName(), attribute.getNamespaceURI(),
                    attribute.getNamespacePrefix(), attribute.getValue(), attribute));
        }
        return result;
    }
}
