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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Stack;

/**
 * Element node. An element at position <code>p</code> reserves positions <code>p + 1</code> to
 * <code>p + n</code> for its <code>n</code> in-scope namespaces and the following ones for its attributes, so that
 * namespace and attribute nodes can be created lazily while keeping document order.
 */
public abstract class ElementNode extends XPathNode {

    protected final String localName;
    protected final String namespaceUri;
    protected final String prefix;
    protected final Map<String, String> namespaces;

    protected List<XPathNode> children = new ArrayList<XPathNode>();

    private List<NamespaceNode> namespaceNodes;
    private List<AttributeNode> attributeNodes;

    protected ElementNode(NodeTree tree, XPathNode parent, int position, String localName, String namespaceUri,
                          String prefix, Map<String, String> namespaces) {
        super(tree, parent, position);
        this.localName = localName;
        this.namespaceUri = namespaceUri != null ? namespaceUri : "";
        this.prefix = prefix != null ? prefix : "";
        this.namespaces = namespaces;
    }

    public NodeKind getKind() {
        return NodeKind.ELEMENT;
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

    /**
     * In-scope namespaces, prefix to URI. The empty prefix stands for the default namespace. Always contains the
     * <code>xml</code> prefix.
     */
    public Map<String, String> getNamespaces() {
        return Collections.unmodifiableMap(namespaces);
    }

    /**
     * Number of attributes of the native element, known before the attribute nodes are created.
     */
    public abstract int getAttributeCount();

    protected abstract List<AttributeNode> createAttributeNodes(int firstPosition);

    @Override
    public List<XPathNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(XPathNode child) {
        children.add(child);
    }

    /**
     * Number of positions this element takes, itself included.
     */
    public int getReservedPositions() {
        return 1 + namespaces.size() + getAttributeCount();
    }

    /**
     * Native object of a namespace node.
     */
    protected Namespace createNamespace(String prefix, String uri) {
        return Namespace.get(prefix, uri);
    }

    public synchronized List<NamespaceNode> getNamespaceNodes() {
        if (namespaceNodes == null) {
            final List<NamespaceNode> result = new ArrayList<NamespaceNode>(namespaces.size());
            int current = position + 1;
            for (Map.Entry<String, String> entry : namespaces.entrySet())
                result.add(new NamespaceNode(this, current++, createNamespace(entry.getKey(), entry.getValue())));
            namespaceNodes = Collections.unmodifiableList(result);
        }
        return namespaceNodes;
    }

    public synchronized List<AttributeNode> getAttributes() {
        if (attributeNodes == null)
            attributeNodes = Collections.unmodifiableList(createAttributeNodes(position + 1 + namespaces.size()));
        return attributeNodes;
    }

    public AttributeNode getAttribute(String expandedName) {
        for (AttributeNode attribute : getAttributes()) {
            if (expandedName.equals(attribute.getExpandedName()))
                return attribute;
        }
        return null;
    }

    public String getStringValue() {
        final StringBuilder sb = new StringBuilder();
        final Stack<XPathNode> stack = new Stack<XPathNode>();
        stack.push(this);
        while (!stack.isEmpty()) {
            final XPathNode current = stack.pop();
            if (current instanceof TextNode) {
                sb.append(current.getStringValue());
            } else if (current instanceof ElementNode) {
                final List<XPathNode> currentChildren = current.getChildren();
                for (int i = currentChildren.size() - 1; i >= 0; i--)
                    stack.push(currentChildren.get(i));
            }
        }
        return sb.toString();
    }
}
