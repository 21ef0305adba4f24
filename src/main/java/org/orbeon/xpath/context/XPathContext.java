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

import org.apache.commons.collections.Predicate;
import org.apache.commons.collections.iterators.FilterIterator;
import org.dom4j.Node;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.om.AttributeNode;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.NamespaceNode;
import org.orbeon.xpath.om.NodeTree;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.tree.NodeTrees;
import org.orbeon.xpath.value.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Stack;
import java.util.TimeZone;

/**
 * Dynamic context of an evaluation: the node tree, the focus (context item, position and size), the current axis
 * and the variables.
 *
 * The focus is changed while sequences are produced: each axis iterator moves the context item to the node it
 * returns and restores the previous focus once exhausted. Code evaluating a sub-expression against another focus
 * works on a {@link #copy()}.
 *
 * A null context item under a root element which has no document node stands for the implicit document
 * containing that element.
 */
public class XPathContext {

    public static final String SELF = "self";
    public static final String CHILD = "child";
    public static final String PARENT = "parent";
    public static final String ATTRIBUTE = "attribute";
    public static final String NAMESPACE = "namespace";
    public static final String FOLLOWING_SIBLING = "following-sibling";
    public static final String PRECEDING_SIBLING = "preceding-sibling";
    public static final String FOLLOWING = "following";
    public static final String PRECEDING = "preceding";
    public static final String ANCESTOR = "ancestor";
    public static final String ANCESTOR_OR_SELF = "ancestor-or-self";
    public static final String DESCENDANT = "descendant";
    public static final String DESCENDANT_OR_SELF = "descendant-or-self";

    private final XPathNode root;
    private final DocumentNode document;

    private Object item;
    private int position;
    private int size;
    private String axis;

    private Map<String, Object> variables;
    private boolean variablesShared;
    private final Map<String, XPathNode> documents;

    private String defaultCollation;
    private TimeZone timezone;

    public XPathContext(Object root) {
        this(root, null, null, null, null, false);
    }

    public XPathContext(Object root, Map<String, Object> variables) {
        this(root, null, variables, null, null, false);
    }

    /**
     * @param root          native root of the document, or node, or null for evaluations without a tree
     * @param item          initial context item (node, native node of the tree, or atomic value), null for the
     *                      node of the root
     * @param variables     variable values, may be null
     * @param namespaces    namespace hints passed to the tree builder, may be null
     * @param uri           document URI passed to the tree builder, may be null
     * @param fragment      build a plain tree even if the root belongs to a document
     */
    public XPathContext(Object root, Object item, Map<String, Object> variables, Map<String, String> namespaces,
                        String uri, boolean fragment) {
        if (root != null) {
            final XPathNode rootNode = NodeTrees.getNodeTree(root, namespaces, uri, fragment);
            final XPathNode treeRoot = rootNode.getTree().getRoot();
            this.root = treeRoot != null ? treeRoot : rootNode.getRoot();
            this.document = (this.root instanceof DocumentNode) ? (DocumentNode) this.root : null;
            if (item == null) {
                this.item = rootNode;
            } else if (item instanceof XPathNode || Values.isAtomic(Values.normalize(item))) {
                this.item = Values.normalize(item);
            } else {
                final XPathNode itemNode = rootNode.getTree().getNode(item);
                if (itemNode == null)
                    throw ErrorCode.XPTY0004.createException("context item is not a node of the tree: " + item, null);
                this.item = itemNode;
            }
        } else {
            this.root = null;
            this.document = null;
            this.item = Values.normalize(item);
        }
        this.position = 1;
        this.size = 1;

        this.variables = new HashMap<String, Object>();
        if (variables != null) {
            for (Map.Entry<String, Object> entry : variables.entrySet())
                this.variables.put(entry.getKey(), normalizeVariable(entry.getValue()));
        }
        this.documents = new HashMap<String, XPathNode>();
        this.timezone = TimeZone.getDefault();
    }

    protected XPathContext(XPathContext other) {
        this.root = other.root;
        this.document = other.document;
        this.item = other.item;
        this.position = other.position;
        this.size = other.size;
        this.axis = other.axis;
        this.variables = other.variables;
        this.variablesShared = true;
        other.variablesShared = true;
        this.documents = other.documents;
        this.defaultCollation = other.defaultCollation;
        this.timezone = other.timezone;
    }

    /**
     * Copy sharing the tree and the variables, with an independent focus.
     */
    public XPathContext copy() {
        return new XPathContext(this);
    }

    public boolean isSchema() {
        return false;
    }

    public XPathNode getRoot() {
        return root;
    }

    /**
     * Document node of the tree, null when the tree is rooted at an element.
     */
    public DocumentNode getDocument() {
        return document;
    }

    public Object getItem() {
        return item;
    }

    public void setItem(Object item) {
        this.item = item;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public String getAxis() {
        return axis;
    }

    public void setAxis(String axis) {
        this.axis = axis;
    }

    /**
     * Whether the context item is the implicit document above a root element.
     */
    public boolean isAtImplicitDocument() {
        return item == null && root != null && document == null;
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Object getVariable(String name) {
        return variables.get(name);
    }

    /**
     * Bind a variable. The variable map is copied first if other contexts share it.
     */
    public void setVariable(String name, Object value) {
        if (variablesShared) {
            variables = new HashMap<String, Object>(variables);
            variablesShared = false;
        }
        variables.put(name, normalizeVariable(value));
    }

    public Map<String, Object> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<String, XPathNode> getDocuments() {
        return documents;
    }

    public String getDefaultCollation() {
        return defaultCollation;
    }

    public void setDefaultCollation(String defaultCollation) {
        this.defaultCollation = defaultCollation;
    }

    public TimeZone getTimezone() {
        return timezone;
    }

    public void setTimezone(TimeZone timezone) {
        this.timezone = timezone;
    }

    /**
     * Variable values: native nodes of this context's tree are replaced with their nodes and lists are copied.
     */
    private Object normalizeVariable(Object value) {
        if (value instanceof List) {
            final List<Object> result = new ArrayList<Object>();
            for (Object item : (List<?>) value)
                result.add(normalizeVariable(item));
            return result;
        } else if (value == null || value instanceof XPathNode) {
            return value;
        } else {
            final Object normalized = Values.normalize(value);
            if (!Values.isAtomic(normalized) && root != null) {
                final XPathNode node = root.getTree().getNode(value);
                if (node != null)
                    return node;
            }
            if (value instanceof Node)
                throw ErrorCode.XPTY0004.createException("variable value is not a node of the tree: " + value, null);
            return normalized;
        }
    }

    // ---------------------------------------------------------------------------------------------------------
    // Axes

    public Iterator<Object> iterSelf() {
        if (item == null)
            return Collections.emptyList().iterator();
        return new FocusIterator(Collections.singletonList(item), SELF);
    }

    public Iterator<Object> iterAttributes() {
        if (item instanceof ElementNode)
            return new FocusIterator(((ElementNode) item).getAttributes(), ATTRIBUTE);
        return Collections.emptyList().iterator();
    }

    public Iterator<Object> iterNamespaces() {
        if (item instanceof ElementNode)
            return new FocusIterator(((ElementNode) item).getNamespaceNodes(), NAMESPACE);
        return Collections.emptyList().iterator();
    }

    /**
     * The context item itself if an axis is active, as the test following an explicit axis applies to the nodes
     * of that axis. Otherwise the children of the context item.
     */
    public Iterator<Object> iterChildrenOrSelf() {
        if (axis != null) {
            if (item == null)
                return Collections.emptyList().iterator();
            return Collections.singletonList(item).iterator();
        }
        return iterChildren();
    }

    public Iterator<Object> iterChildren() {
        if (isAtImplicitDocument())
            return new FocusIterator(Collections.singletonList(root), CHILD);
        else if (item instanceof DocumentNode || item instanceof ElementNode)
            return new FocusIterator(((XPathNode) item).getChildren(), CHILD);
        return Collections.emptyList().iterator();
    }

    public Iterator<Object> iterParent() {
        if (item instanceof XPathNode) {
            final XPathNode parent = ((XPathNode) item).getParent();
            if (parent != null)
                return new FocusIterator(Collections.singletonList(parent), PARENT);
        }
        return Collections.emptyList().iterator();
    }

    public Iterator<Object> iterSiblings(String axisName) {
        if (!(item instanceof XPathNode) || item instanceof AttributeNode || item instanceof NamespaceNode)
            return Collections.emptyList().iterator();

        final XPathNode node = (XPathNode) item;
        final XPathNode parent = node.getParent();
        if (parent == null)
            return Collections.emptyList().iterator();

        final List<XPathNode> siblings = parent.getChildren();
        final int index = indexOfIdentity(siblings, node);
        final List<XPathNode> result = new ArrayList<XPathNode>();
        if (PRECEDING_SIBLING.equals(axisName)) {
            for (int i = index - 1; i >= 0; i--)
                result.add(siblings.get(i));
        } else {
            for (int i = index + 1; i < siblings.size(); i++)
                result.add(siblings.get(i));
        }
        return new FocusIterator(result, axisName);
    }

    /**
     * Descendants in document order, the context item first unless the axis is <code>descendant</code>. With a
     * null axis name, the axis is left unset so that a following step applies to the children of each node.
     */
    public Iterator<Object> iterDescendants(String axisName) {
        final boolean withSelf = !DESCENDANT.equals(axisName);
        final List<Object> result = new ArrayList<Object>();
        if (isAtImplicitDocument()) {
            if (withSelf && axisName == null)
                result.add(null);
            collectDescendants(root, true, result);
        } else if (item instanceof XPathNode) {
            collectDescendants((XPathNode) item, withSelf, result);
        }
        return new FocusIterator(result, axisName);
    }

    private void collectDescendants(XPathNode node, boolean withSelf, List<Object> result) {
        final Set<XPathNode> visited = node.getTree().isSchema()
                ? Collections.newSetFromMap(new IdentityHashMap<XPathNode, Boolean>()) : null;
        final Stack<XPathNode> stack = new Stack<XPathNode>();
        if (withSelf) {
            stack.push(node);
        } else {
            pushChildren(stack, node);
        }
        while (!stack.isEmpty()) {
            final XPathNode current = stack.pop();
            if (visited != null && !visited.add(current))
                continue;
            result.add(current);
            pushChildren(stack, current);
        }
    }

    private static void pushChildren(Stack<XPathNode> stack, XPathNode node) {
        final List<XPathNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--)
            stack.push(children.get(i));
    }

    /**
     * Ancestors from the parent up to the root, preceded by the context item for <code>ancestor-or-self</code>.
     */
    public Iterator<Object> iterAncestors(String axisName) {
        final List<Object> result = new ArrayList<Object>();
        if (item instanceof XPathNode) {
            final XPathNode node = (XPathNode) item;
            if (ANCESTOR_OR_SELF.equals(axisName))
                result.add(node);
            for (XPathNode current = node.getParent(); current != null; current = current.getParent())
                result.add(current);
        }
        return new FocusIterator(result, axisName);
    }

    /**
     * Nodes before the context item in document order, ancestors excluded, nearest first.
     */
    public Iterator<Object> iterPreceding() {
        final List<Object> result = new ArrayList<Object>();
        if (item instanceof XPathNode) {
            final XPathNode node = (XPathNode) item;
            final Set<XPathNode> ancestors = Collections.newSetFromMap(new IdentityHashMap<XPathNode, Boolean>());
            for (XPathNode current = node.getParent(); current != null; current = current.getParent())
                ancestors.add(current);

            final NodeTree tree = node.getTree();
            final List<XPathNode> nodes = tree.getNodes();
            for (int i = tree.floorIndex(node.getPosition()); i >= 0; i--) {
                final XPathNode candidate = nodes.get(i);
                if (candidate != node && !ancestors.contains(candidate))
                    result.add(candidate);
            }
        }
        return new FocusIterator(result, PRECEDING);
    }

    /**
     * Nodes after the context item in document order, descendants excluded.
     */
    public Iterator<Object> iterFollowings() {
        final List<Object> result = new ArrayList<Object>();
        if (item instanceof XPathNode && !(item instanceof DocumentNode)) {
            final XPathNode node = (XPathNode) item;
            final NodeTree tree = node.getTree();
            final List<XPathNode> nodes = tree.getNodes();
            int start = tree.floorIndex(node.getPosition()) + 1;
            if (!(node instanceof AttributeNode || node instanceof NamespaceNode)) {
                while (start < nodes.size() && node.isAncestorOf(nodes.get(start)))
                    start++;
            }
            for (int i = start; i < nodes.size(); i++)
                result.add(nodes.get(i));
        }
        return new FocusIterator(result, FOLLOWING);
    }

    /**
     * Nodes of the current axis, the child axis by default, of its principal node kind and matching a name test.
     */
    @SuppressWarnings("unchecked")
    public Iterator<Object> iterMatchingNodes(final String nameTest) {
        final String currentAxis = axis;
        final Class<?> principalKind = ATTRIBUTE.equals(currentAxis) ? AttributeNode.class
                : NAMESPACE.equals(currentAxis) ? NamespaceNode.class : ElementNode.class;
        return new FilterIterator(iterChildrenOrSelf(), new Predicate() {
            public boolean evaluate(Object candidate) {
                return principalKind.isInstance(candidate) && ((XPathNode) candidate).matchesName(nameTest);
            }
        });
    }

    /**
     * Evaluate a token entirely, then focus on each of its items in turn.
     */
    public Iterator<Object> innerFocusSelect(XPathToken token) {
        final List<Object> results = new ArrayList<Object>();
        for (Iterator<Object> i = token.select(this); i.hasNext();)
            results.add(i.next());
        return new FocusIterator(results, null);
    }

    /**
     * Focus on each of the given items in turn, with no axis.
     */
    public Iterator<Object> iterFocus(List<?> items) {
        return new FocusIterator(items, null);
    }

    private static int indexOfIdentity(List<XPathNode> nodes, XPathNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node)
                return i;
        }
        return -1;
    }

    /**
     * Sets the focus on each item it returns and restores the focus found at creation once exhausted.
     */
    private class FocusIterator implements Iterator<Object> {

        private final List<?> items;
        private final String axisName;
        private int index;

        private final Object savedItem;
        private final int savedPosition;
        private final int savedSize;
        private final String savedAxis;
        private boolean restored;

        public FocusIterator(List<?> items, String axisName) {
            this.items = items;
            this.axisName = axisName;
            this.savedItem = item;
            this.savedPosition = position;
            this.savedSize = size;
            this.savedAxis = axis;
        }

        public boolean hasNext() {
            if (index < items.size())
                return true;
            if (!restored) {
                item = savedItem;
                position = savedPosition;
                size = savedSize;
                axis = savedAxis;
                restored = true;
            }
            return false;
        }

        public Object next() {
            if (!hasNext())
                throw new NoSuchElementException();
            final Object result = items.get(index++);
            item = result;
            position = index;
            size = items.size();
            axis = axisName;
            return result;
        }

        public void remove() {
            throw new UnsupportedOperationException();
        }
    }
}
