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
import org.dom4j.Document;
import org.dom4j.Element;
import org.dom4j.Node;
import org.dom4j.ProcessingInstruction;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.NodeTree;
import org.orbeon.xpath.om.XPathNode;

import java.util.Map;

/**
 * Builds a node tree from a dom4j document, including the comments and processing instructions found before and
 * after the root element.
 */
public class DocumentTreeBuilder extends Dom4jTreeBuilder {

    private final Map<String, String> namespaces;

    private DocumentTreeBuilder(Map<String, String> namespaces, String uri, int firstPosition) {
        super(new NodeTree(uri, false, firstPosition));
        this.namespaces = namespaces;
    }

    public static DocumentNode build(Document document, Map<String, String> namespaces, String uri) {
        final DocumentTreeBuilder builder = new DocumentTreeBuilder(namespaces, uri, 1);
        return builder.buildDocument(document);
    }

    /**
     * Build the tree of the document an element belongs to and return the node of that element. The document
     * node is synthetic here: it is kept only when the root element has document-level siblings, otherwise the
     * root element is the root of the tree.
     */
    public static XPathNode build(Element element, Map<String, String> namespaces, String uri) {
        final Document document = element.getDocument();
        if (document == null)
            throw ErrorCode.XPTY0004.createException("element '" + element.getQualifiedName() + "' is not attached to a document", null);

        final XPathNode result;
        if (hasSiblings(document)) {
            final DocumentTreeBuilder builder = new DocumentTreeBuilder(namespaces, uri, 0);
            result = builder.buildDocument(document).getTree().getNode(element);
        } else {
            final DocumentTreeBuilder builder = new DocumentTreeBuilder(namespaces, uri, 1);
            final ElementNode rootNode = builder.buildElement(document.getRootElement(), null, createRootNamespaces(namespaces));
            builder.tree.setRoot(rootNode);
            result = builder.tree.getNode(element);
        }
        return result;
    }

    private static boolean hasSiblings(Document document) {
        for (Node node : document.content()) {
            if (node instanceof Comment || node instanceof ProcessingInstruction)
                return true;
        }
        return false;
    }

    private DocumentNode buildDocument(Document document) {
        final DocumentNode documentNode = new DocumentNode(tree, document, tree.reserve(1));
        tree.addNode(documentNode, document);
        tree.setRoot(documentNode);

        for (Node node : document.content()) {
            switch (node.getNodeType()) {
                case Node.ELEMENT_NODE:
                    documentNode.addChild(buildElement((Element) node, documentNode, createRootNamespaces(namespaces)));
                    break;
                case Node.COMMENT_NODE:
                    documentNode.addChild(createCommentNode((Comment) node, documentNode));
                    break;
                case Node.PROCESSING_INSTRUCTION_NODE:
                    documentNode.addChild(createProcessingInstructionNode((ProcessingInstruction) node, documentNode));
                    break;
                default:
                    break;
            }
        }
        return documentNode;
    }
}
