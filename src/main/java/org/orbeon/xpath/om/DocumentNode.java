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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Document node: a dom4j document, the synthetic document around a root element with document-level siblings, or
 * the root of a schema graph.
 */
public class DocumentNode extends XPathNode {

    private final Object document;
    private final List<XPathNode> children = new ArrayList<XPathNode>();

    public DocumentNode(NodeTree tree, Object document, int position) {
        super(tree, null, position);
        this.document = document;
    }

    public NodeKind getKind() {
        return NodeKind.DOCUMENT;
    }

    public Object getNativeNode() {
        return document;
    }

    public String getDocumentUri() {
        return tree.getUri();
    }

    @Override
    public List<XPathNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(XPathNode child) {
        children.add(child);
    }

    /**
     * The first element child, or null for an empty document.
     */
    public ElementNode getDocumentElement() {
        for (XPathNode child : children) {
            if (child instanceof ElementNode)
                return (ElementNode) child;
        }
        return null;
    }

    public String getStringValue() {
        final ElementNode documentElement = getDocumentElement();
        return documentElement != null ? documentElement.getStringValue() : "";
    }
}
