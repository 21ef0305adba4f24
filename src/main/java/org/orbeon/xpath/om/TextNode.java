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
 * Text node. Adjacent native text and CDATA nodes are merged into a single text node, which wraps the first one.
 */
public class TextNode extends XPathNode {

    private final String value;
    private final Object nativeText;

    public TextNode(NodeTree tree, XPathNode parent, int position, String value, Object nativeText) {
        super(tree, parent, position);
        this.value = value;
        this.nativeText = nativeText;
    }

    public NodeKind getKind() {
        return NodeKind.TEXT;
    }

    public Object getNativeNode() {
        return nativeText;
    }

    public String getStringValue() {
        return value;
    }
}
