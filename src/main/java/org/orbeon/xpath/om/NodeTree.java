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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Storage of one node tree build: the position counter, the map from native objects to nodes, and the nodes which
 * can be children (document, element, text, comment, processing instruction) in document order. Attribute and
 * namespace nodes live in the slots reserved by their element and are not listed.
 *
 * A tree is only modified by its builder. After the build it is read-only and can be shared.
 */
public class NodeTree {

    private static final AtomicInteger ordinals = new AtomicInteger();

    private final int ordinal = ordinals.incrementAndGet();
    private final String uri;
    private final boolean schema;

    private final Map<Object, XPathNode> nodeMap = new IdentityHashMap<Object, XPathNode>();
    private final List<XPathNode> nodes = new ArrayList<XPathNode>();
    private int nextPosition;
    private XPathNode root;

    public NodeTree(String uri, boolean schema, int firstPosition) {
        this.uri = uri;
        this.schema = schema;
        this.nextPosition = firstPosition;
    }

    /**
     * Reserve <code>count</code> consecutive positions and return the first one.
     */
    public int reserve(int count) {
        final int result = nextPosition;
        nextPosition += count;
        return result;
    }

    public int getNextPosition() {
        return nextPosition;
    }

    /**
     * Record a newly built node. Nodes must be added in increasing position order.
     */
    public void addNode(XPathNode node, Object nativeObject) {
        if (!nodes.isEmpty() && nodes.get(nodes.size() - 1).getPosition() >= node.getPosition())
            throw new IllegalStateException("Node added out of document order: " + node);
        nodes.add(node);
        if (nativeObject != null && !nodeMap.containsKey(nativeObject))
            nodeMap.put(nativeObject, node);
    }

    /**
     * Map one more native object to an existing node, as the pieces of a merged text node.
     */
    public void addAlias(Object nativeObject, XPathNode node) {
        if (nativeObject != null && !nodeMap.containsKey(nativeObject))
            nodeMap.put(nativeObject, node);
    }

    public void setRoot(XPathNode root) {
        this.root = root;
    }

    public XPathNode getRoot() {
        return root;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public String getUri() {
        return uri;
    }

    public boolean isSchema() {
        return schema;
    }

    /**
     * Node wrapping the given native object, or null. Attribute and namespace nodes are found through the node of
     * their parent element. A namespace without a parent element cannot be told apart from the same namespace
     * declared elsewhere and is not found.
     */
    public XPathNode getNode(Object nativeObject) {
        final XPathNode node = nodeMap.get(nativeObject);
        if (node != null)
            return node;

        if (nativeObject instanceof Attribute) {
            final XPathNode parent = getElementNode(((Attribute) nativeObject).getParent());
            if (parent != null) {
                for (AttributeNode attribute : ((ElementNode) parent).getAttributes()) {
                    if (attribute.getNativeNode() == nativeObject)
                        return attribute;
                }
            }
        } else if (nativeObject instanceof Namespace) {
            final Namespace namespace = (Namespace) nativeObject;
            final XPathNode parent = getElementNode(namespace.getParent());
            if (parent != null) {
                for (NamespaceNode namespaceNode : ((ElementNode) parent).getNamespaceNodes()) {
                    if (namespace.getPrefix().equals(namespaceNode.getPrefix())
                            && namespace.getURI().equals(namespaceNode.getUri()))
                        return namespaceNode;
                }
            }
        }
        return null;
    }

    private XPathNode getElementNode(Element element) {
        if (element == null)
            return null;
        final XPathNode node = nodeMap.get(element);
        return node instanceof ElementNode ? node : null;
    }

    public List<XPathNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Index in {@link #getNodes()} of the last node with a position lower than or equal to the given position,
     * or -1.
     */
    public int floorIndex(int position) {
        int low = 0;
        int high = nodes.size() - 1;
        int result = -1;
        while (low <= high) {
            final int middle = (low + high) >>> 1;
            if (nodes.get(middle).getPosition() <= position) {
                result = middle;
                low = middle + 1;
            } else {
                high = middle - 1;
            }
        }
        return result;
    }
}
