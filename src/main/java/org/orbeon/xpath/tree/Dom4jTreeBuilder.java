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
package org.orbeon.xpath.tree;

import org.dom4j.Comment;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.dom4j.Node;
import org.dom4j.ProcessingInstruction;
import org.dom4j.Attribute;
import org.orbeon.xpath.om.CommentNode;
import org.orbeon.xpath.om.Dom4jElementNode;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.NodeTree;
import org.orbeon.xpath.om.ProcessingInstructionNode;
import org.orbeon.xpath.om.TextNode;
import org.orbeon.xpath.om.XPathNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

/**
 * Common traversal of dom4j element content. The traversal is iterative: a stack of (node, content iterator)
 * frames stands for the call stack, so deep documents do not exhaust the Java stack.
 */
abstract class Dom4jTreeBuilder {

    public static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";

    protected final NodeTree tree;

    protected Dom4jTreeBuilder(NodeTree tree) {
        this.tree = tree;
    }

    protected static Map<String, String> createRootNamespaces(Map<String, String> hints) {
        final Map<String, String> result = new LinkedHashMap<String, String>();
        result.put("xml", XML_NAMESPACE);
        if (hints != null) {
            for (Map.Entry<String, String> entry : hints.entrySet()) {
                if (entry.getValue() != null && !"xml".equals(entry.getKey()))
                    result.put(entry.getKey() == null ? "" : entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Build the node of an element and of all its content.
     */
    protected ElementNode buildElement(Element rootElement, XPathNode parent, Map<String, String> inheritedNamespaces) {
        final ElementNode rootNode = createElementNode(rootElement, parent, inheritedNamespaces);

        final Stack<Frame> stack = new Stack<Frame>();
        stack.push(new Frame(rootNode, rootElement));
        while (!stack.isEmpty()) {
            final Frame frame = stack.peek();
            if (!frame.content.hasNext()) {
                frame.flushText();
                stack.pop();
                continue;
            }

            final Node child = frame.content.next();
            switch (child.getNodeType()) {
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                case Node.ENTITY_REFERENCE_NODE:
                    frame.appendText(child);
                    break;
                case Node.ELEMENT_NODE: {
                    frame.flushText();
                    final Element childElement = (Element) child;
                    final ElementNode childNode = createElementNode(childElement, frame.node, frame.node.getNamespaces());
                    frame.node.addChild(childNode);
                    stack.push(new Frame(childNode, childElement));
                    break;
                }
                case Node.COMMENT_NODE:
                    frame.flushText();
                    frame.node.addChild(createCommentNode((Comment) child, frame.node));
                    break;
                case Node.PROCESSING_INSTRUCTION_NODE:
                    frame.flushText();
                    frame.node.addChild(createProcessingInstructionNode((ProcessingInstruction) child, frame.node));
                    break;
                default:
                    // namespace declarations are part of the content list in dom4j
                    break;
            }
        }
        return rootNode;
    }

    protected ElementNode createElementNode(Element element, XPathNode parent, Map<String, String> inheritedNamespaces) {
        final Map<String, String> namespaces = getNamespaces(element, inheritedNamespaces);
        final int position = tree.reserve(1 + namespaces.size() + element.attributeCount());
        final ElementNode node = new Dom4jElementNode(tree, parent, position, element, namespaces);
        tree.addNode(node, element);
        return node;
    }

    protected CommentNode createCommentNode(Comment comment, XPathNode parent) {
        final CommentNode node = new CommentNode(tree, parent, tree.reserve(1), comment);
        tree.addNode(node, comment);
        return node;
    }

    protected ProcessingInstructionNode createProcessingInstructionNode(ProcessingInstruction processingInstruction, XPathNode parent) {
        final ProcessingInstructionNode node = new ProcessingInstructionNode(tree, parent, tree.reserve(1), processingInstruction);
        tree.addNode(node, processingInstruction);
        return node;
    }

    /**
     * In-scope namespaces of an element: the inherited ones plus the ones declared or used on the element. The
     * inherited map is returned as is when the element adds nothing.
     */
    private static Map<String, String> getNamespaces(Element element, Map<String, String> inherited) {
        Map<String, String> result = inherited;
        for (Namespace namespace : element.declaredNamespaces())
            result = addNamespace(result, inherited, namespace.getPrefix(), namespace.getURI());
        result = addNamespace(result, inherited, element.getNamespacePrefix(), element.getNamespaceURI());
        for (Attribute attribute : element.attributes()) {
            final String uri = attribute.getNamespaceURI();
            if (uri != null && uri.length() > 0)
                result = addNamespace(result, inherited, attribute.getNamespacePrefix(), uri);
        }
        return result;
    }

    private static Map<String, String> addNamespace(Map<String, String> current, Map<String, String> inherited,
                                                    String prefix, String uri) {
        final String key = prefix == null ? "" : prefix;
        final String value = uri == null ? "" : uri;
        if ("xml".equals(key))
            return current;
        if (value.length() == 0) {
            // Only the default namespace can be undeclared
            if (key.length() > 0 || !current.containsKey(""))
                return current;
            final Map<String, String> result = (current == inherited) ? new LinkedHashMap<String, String>(current) : current;
            result.remove("");
            return result;
        }
        if (value.equals(current.get(key)))
            return current;
        final Map<String, String> result = (current == inherited) ? new LinkedHashMap<String, String>(current) : current;
        result.put(key, value);
        return result;
    }

    private class Frame {
        public final ElementNode node;
        public final Iterator<Node> content;

        private StringBuilder pendingText;
        private List<Node> textPieces;

        public Frame(ElementNode node, Element element) {
            this.node = node;
            this.content = element.content().iterator();
        }

        public void appendText(Node text) {
            if (pendingText == null) {
                pendingText = new StringBuilder();
                textPieces = new ArrayList<Node>();
            }
            pendingText.append(text.getText());
            textPieces.add(text);
        }

        public void flushText() {
            if (pendingText != null) {
                final Node firstText = textPieces.get(0);
                final TextNode textNode = new TextNode(tree, node, tree.reserve(1), pendingText.toString(), firstText);
                tree.addNode(textNode, firstText);
                for (int i = 1; i < textPieces.size(); i++)
                    tree.addAlias(textPieces.get(i), textNode);
                node.addChild(textNode);
                pendingText = null;
                textPieces = null;
            }
        }
    }
}
