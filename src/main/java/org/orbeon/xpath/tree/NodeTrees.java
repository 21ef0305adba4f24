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

import org.apache.log4j.Logger;
import org.apache.xerces.xs.XSElementDeclaration;
import org.apache.xerces.xs.XSModel;
import org.dom4j.Document;
import org.dom4j.Element;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.util.IndentedLogger;
import org.orbeon.xpath.util.LoggerFactory;

import java.util.Map;

/**
 * Entry point of the tree builders: picks the builder matching the kind of native root.
 */
public class NodeTrees {

    private static final Logger logger = LoggerFactory.createLogger(NodeTrees.class);

    private NodeTrees() {}

    public static XPathNode getNodeTree(Object root) {
        return getNodeTree(root, null, null, false);
    }

    /**
     * Return a node tree for a native root.
     *
     * @param root          dom4j document or element, Xerces schema model or element declaration, or a node
     * @param namespaces    namespaces in scope of the root element, may be null
     * @param uri           URI of the document, may be null
     * @param fragment      build a plain tree from the root element of a document, ignoring the document
     * @return              the node of the root, whose tree is the whole build
     */
    public static XPathNode getNodeTree(Object root, Map<String, String> namespaces, String uri, boolean fragment) {
        if (root instanceof XPathNode)
            return (XPathNode) root;

        final IndentedLogger indentedLogger = LoggerFactory.createIndentedLogger(logger, "tree");
        if (indentedLogger.isDebugEnabled())
            indentedLogger.startHandleOperation("build", "node tree", "root", String.valueOf(root), "uri", uri);
        XPathNode result = null;
        try {
            result = build(root, namespaces, uri, fragment);
        } finally {
            if (indentedLogger.isDebugEnabled())
                indentedLogger.endHandleOperation("nodes", result != null ? Integer.toString(result.getTree().size()) : null);
        }
        return result;
    }

    private static XPathNode build(Object root, Map<String, String> namespaces, String uri, boolean fragment) {
        final XPathNode result;
        if (root instanceof Document) {
            final Document document = (Document) root;
            if (fragment && document.getRootElement() != null)
                result = new ElementTreeBuilder(namespaces, uri).build(document.getRootElement());
            else
                result = DocumentTreeBuilder.build(document, namespaces, uri);
        } else if (root instanceof Element) {
            final Element element = (Element) root;
            if (element.getDocument() != null && !fragment)
                result = DocumentTreeBuilder.build(element, namespaces, uri);
            else
                result = new ElementTreeBuilder(namespaces, uri).build(element);
        } else if (root instanceof XSModel) {
            result = SchemaTreeBuilder.build((XSModel) root, uri);
        } else if (root instanceof XSElementDeclaration) {
            result = SchemaTreeBuilder.build((XSElementDeclaration) root, uri);
        } else {
            throw ErrorCode.XPTY0004.createException("invalid root for a node tree: "
                    + (root == null ? "null" : root.getClass().getName()), null);
        }
        return result;
    }

    public static DocumentNode getDocumentTree(Document document, String uri) {
        return (DocumentNode) getNodeTree(document, null, uri, false);
    }
}
