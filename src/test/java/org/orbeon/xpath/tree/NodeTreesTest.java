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

import org.dom4j.Document;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.om.DocumentOrder;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.NodeKind;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.util.Dom4jUtils;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class NodeTreesTest {

    private static final String SAMPLE = "<root><item/><item/><child><item/></child></root>";

    @Test
    public void testDocumentPositions() {
        final Document document = Dom4jUtils.readDom4j(SAMPLE);
        final XPathNode documentNode = NodeTrees.getNodeTree(document);

        assertTrue(documentNode instanceof DocumentNode);
        assertEquals(1, documentNode.getPosition());

        // Each element reserves positions for itself and its namespace nodes
        final ElementNode root = ((DocumentNode) documentNode).getDocumentElement();
        assertEquals(2, root.getPosition());
        final List<XPathNode> children = root.getChildren();
        assertEquals(3, children.size());
        assertEquals(4, children.get(0).getPosition());
        assertEquals(6, children.get(1).getPosition());
        assertEquals(8, children.get(2).getPosition());
        assertEquals(10, children.get(2).getChildren().get(0).getPosition());
    }

    @Test
    public void testPositionsIncrease() {
        final Document document = Dom4jUtils.readDom4j(
                "<a x='1' xmlns:p='urn:p'><!-- c -->text<b p:y='2'>b<?pi data?></b>tail<c/></a>");
        final List<XPathNode> nodes = NodeTrees.getNodeTree(document).getTree().getNodes();
        for (int i = 1; i < nodes.size(); i++)
            assertTrue(nodes.get(i - 1).getPosition() < nodes.get(i).getPosition());
        assertTrue(DocumentOrder.isSorted(nodes));
    }

    @Test
    public void testNodeIdentity() {
        final Document document = Dom4jUtils.readDom4j(SAMPLE);
        final XPathNode documentNode = NodeTrees.getNodeTree(document);
        final Element child = document.getRootElement().element("child");

        final XPathNode childNode = documentNode.getTree().getNode(child);
        assertNotNull(childNode);
        assertSame(child, childNode.getNativeNode());
        assertSame(childNode, documentNode.getTree().getNode(child));
        assertSame(documentNode, NodeTrees.getNodeTree(documentNode));
    }

    @Test
    public void testTextCoalescing() {
        final Element element = DocumentHelper.createElement("a");
        element.addText("x");
        element.addCDATA("y");
        element.addElement("b");
        element.addText("z");

        final XPathNode node = NodeTrees.getNodeTree(element);
        final List<XPathNode> children = node.getChildren();
        assertEquals(3, children.size());
        assertEquals(NodeKind.TEXT, children.get(0).getKind());
        assertEquals("xy", children.get(0).getStringValue());
        assertEquals(NodeKind.ELEMENT, children.get(1).getKind());
        assertEquals("z", children.get(2).getStringValue());
        assertEquals("xyz", node.getStringValue());

        // Every merged piece resolves to the merged node
        assertSame(children.get(0), node.getTree().getNode(element.content().get(0)));
        assertSame(children.get(0), node.getTree().getNode(element.content().get(1)));
        assertSame(children.get(2), node.getTree().getNode(element.content().get(3)));
    }

    @Test
    public void testWalkReproducesBuild() {
        final Document document = Dom4jUtils.readDom4j(
                "<a x='1' xmlns:p='urn:p'><!-- c -->text<b p:y='2'>b<?pi data?><d/></b>tail<c><e/>f</c></a>");
        final XPathNode documentNode = NodeTrees.getNodeTree(document);

        final List<XPathNode> walked = new ArrayList<XPathNode>();
        walk(new XPathContext(document), documentNode, walked);
        assertEquals(documentNode.getTree().getNodes(), walked);

        // A second build of the same document gives the same positions
        final List<XPathNode> rebuilt = NodeTrees.getNodeTree(document).getTree().getNodes();
        assertEquals(walked.size(), rebuilt.size());
        for (int i = 0; i < walked.size(); i++) {
            assertEquals(walked.get(i).getPosition(), rebuilt.get(i).getPosition());
            assertEquals(walked.get(i).getKind(), rebuilt.get(i).getKind());
            assertSame(walked.get(i).getNativeNode(), rebuilt.get(i).getNativeNode());
        }
    }

    // Pre-order walk going down with the child axis and across with the following-sibling axis
    private static void walk(XPathContext context, XPathNode node, List<XPathNode> result) {
        result.add(node);
        context.setItem(node);
        final Iterator<Object> children = context.iterChildren();
        if (!children.hasNext())
            return;
        XPathNode child = (XPathNode) children.next();
        while (child != null) {
            walk(context, child, result);
            context.setItem(child);
            final Iterator<Object> siblings = context.iterSiblings(XPathContext.FOLLOWING_SIBLING);
            child = siblings.hasNext() ? (XPathNode) siblings.next() : null;
        }
    }

    @Test
    public void testAttachedElementWithoutSiblings() {
        final Document document = Dom4jUtils.readDom4j(SAMPLE);
        final XPathNode node = NodeTrees.getNodeTree(document.getRootElement());

        assertEquals(NodeKind.ELEMENT, node.getKind());
        assertNull(node.getParent());
        assertSame(node, node.getTree().getRoot());
    }

    @Test
    public void testAttachedElementWithSiblings() {
        final Document document = Dom4jUtils.readDom4j("<!-- before --><root><item/></root><?after?>");
        final XPathNode node = NodeTrees.getNodeTree(document.getRootElement());

        assertEquals(NodeKind.ELEMENT, node.getKind());
        final XPathNode root = node.getTree().getRoot();
        assertEquals(NodeKind.DOCUMENT, root.getKind());
        assertSame(root, node.getParent());
        assertEquals(3, root.getChildren().size());
        assertEquals(NodeKind.COMMENT, root.getChildren().get(0).getKind());
        assertEquals(NodeKind.PROCESSING_INSTRUCTION, root.getChildren().get(2).getKind());
    }

    @Test
    public void testFragment() {
        final Document document = Dom4jUtils.readDom4j("<!-- before --><root><item/></root>");
        final XPathNode node = NodeTrees.getNodeTree(document, null, null, true);

        assertEquals(NodeKind.ELEMENT, node.getKind());
        assertEquals("root", node.getLocalName());
        assertNull(node.getParent());
    }

    @Test
    public void testDetachedElement() {
        final Element element = DocumentHelper.createElement("detached");
        final XPathNode node = NodeTrees.getNodeTree(element);

        assertEquals(NodeKind.ELEMENT, node.getKind());
        assertEquals(1, node.getPosition());
        assertSame(node, node.getTree().getRoot());
    }

    @Test
    public void testEmptyDocument() {
        final Document document = DocumentHelper.createDocument();
        final XPathNode node = NodeTrees.getNodeTree(document);

        assertEquals(NodeKind.DOCUMENT, node.getKind());
        assertTrue(node.getChildren().isEmpty());
        assertNull(((DocumentNode) node).getDocumentElement());
    }

    @Test
    public void testInvalidRoot() {
        try {
            NodeTrees.getNodeTree("not a tree");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0004, e.getCode());
        }
    }

    @Test
    public void testNamespaces() {
        final Document document = Dom4jUtils.readDom4j("<a xmlns='urn:a' xmlns:p='urn:p'><p:b/></a>");
        final ElementNode root = ((DocumentNode) NodeTrees.getNodeTree(document)).getDocumentElement();

        assertEquals("urn:a", root.getNamespaceUri());
        assertEquals("{urn:a}a", root.getExpandedName());
        assertEquals("urn:p", root.getNamespaces().get("p"));
        assertEquals("urn:a", root.getNamespaces().get(""));

        final XPathNode b = root.getChildren().get(0);
        assertEquals("{urn:p}b", b.getExpandedName());
        assertTrue(b.matchesName("{urn:p}b"));
        assertTrue(b.matchesName("*:b"));
        assertFalse(b.matchesName("b"));
    }
}
