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

import org.orbeon.xpath.value.UntypedAtomic;

import java.util.Collections;
import java.util.List;

/**
 * A node of a node tree. Each node wraps an object of the native tree it was built from and has a position which
 * encodes document order within its tree.
 */
public abstract class XPathNode {

    protected final NodeTree tree;
    protected final XPathNode parent;
    protected final int position;

    protected XPathNode(NodeTree tree, XPathNode parent, int position) {
        this.tree = tree;
        this.parent = parent;
        this.position = position;
    }

    public abstract NodeKind getKind();

    /**
     * Object of the native tree this node stands for: a dom4j node, a Xerces declaration, or null.
     */
    public abstract Object getNativeNode();

    public abstract String getStringValue();

    public Object getTypedValue() {
        return new UntypedAtomic(getStringValue());
    }

    public NodeTree getTree() {
        return tree;
    }

    public XPathNode getParent() {
        return parent;
    }

    public int getPosition() {
        return position;
    }

    public List<XPathNode> getChildren() {
        return Collections.emptyList();
    }

    public String getLocalName() {
        return null;
    }

    public String getNamespaceUri() {
        return "";
    }

    /**
     * Name as written in the source, with its prefix if any.
     */
    public String getPrefixedName() {
        return getLocalName();
    }

    /**
     * Name in <code>{uri}local</code> notation, or just the local name when not in a namespace.
     */
    public String getExpandedName() {
        final String localName = getLocalName();
        if (localName == null)
            return null;
        final String uri = getNamespaceUri();
        return (uri == null || uri.length() == 0) ? localName : "{" + uri + "}" + localName;
    }

    /**
     * Whether this node matches a resolved name test: <code>*</code>, <code>local</code>,
     * <code>{uri}local</code>, <code>{uri}*</code> or <code>*:local</code>.
     */
    public boolean matchesName(String nameTest) {
        final String localName = getLocalName();
        if (localName == null)
            return false;
        if ("*".equals(nameTest))
            return true;
        if (nameTest.startsWith("*:"))
            return localName.equals(nameTest.substring(2));

        final String uri = getNamespaceUri() == null ? "" : getNamespaceUri();
        if (nameTest.startsWith("{")) {
            final int close = nameTest.indexOf('}');
            final String testUri = nameTest.substring(1, close);
            final String testLocal = nameTest.substring(close + 1);
            return testUri.equals(uri) && ("*".equals(testLocal) || testLocal.equals(localName));
        }
        return uri.length() == 0 && nameTest.equals(localName);
    }

    /**
     * Topmost ancestor of this node.
     */
    public XPathNode getRoot() {
        XPathNode current = this;
        while (current.parent != null)
            current = current.parent;
        return current;
    }

    public boolean isAncestorOf(XPathNode node) {
        for (XPathNode current = node.parent; current != null; current = current.parent) {
            if (current == this)
                return true;
        }
        return false;
    }

    @Override
    public String toString() {
        final String name = getPrefixedName();
        return getKind().getTestName() + "(" + (name != null ? name : "") + ")@" + position;
    }
}
