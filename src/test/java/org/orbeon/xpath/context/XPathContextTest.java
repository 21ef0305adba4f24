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

import org.dom4j.Attribute;
import org.dom4j.Document;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.junit.Before;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.NamespaceNode;
import org.orbeon.xpath.om.NodeKind;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.util.Dom4jUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class XPathContextTest {

    private Document document;
    private XPathContext context;

    @Before
    public void setUp() {
        document = Dom4jUtils.readDom4j("<root><a id='1'/><b id='2'><c/><d/></b><e/></root>");
        context = new XPathContext(document);
    }

    @Test
    public void testInitialFocus() {
        assertTrue(context.getRoot() instanceof DocumentNode);
        assertSame(context.getRoot(), context.getDocument());
        assertSame(context.getRoot(), context.getItem());
        assertEquals(1, context.getPosition());
        assertEquals(1, context.getSize());
        assertNull(context.getAxis());
        assertFalse(context.isAtImplicitDocument());
    }

    @Test
    public void testFocusIsSetAndRestored() {
        final Object initialItem = context.getItem();
        final XPathNode root = ((DocumentNode) context.getRoot()).getDocumentElement();
        context.setItem(root);

        final Iterator<Object> children = context.iterChildren();
        assertTrue(children.hasNext());
        final Object first = children.next();
        assertSame(first, context.getItem());
        assertEquals(1, context.getPosition());
        assertEquals(3, context.getSize());
        assertEquals(XPathContext.CHILD, context.getAxis());

        children.next();
        assertEquals(2, context.getPosition());
        children.next();
        assertEquals(3, context.getPosition());

        assertFalse(children.hasNext());
        assertSame(root, context.getItem());
        assertEquals(1, context.getPosition());
        assertEquals(1, context.getSize());
        assertNull(context.getAxis());

        context.setItem(initialItem);
    }

    @Test
    public void testCopyHasIndependentFocus() {
        final XPathContext copy = context.copy();
        copy.setItem("x");
        copy.setPosition(5);
        assertSame(context.getRoot(), context.getItem());
        assertEquals(1, context.getPosition());
        assertSame(context.getRoot(), copy.getRoot());
    }

    @Test
    public void testVariablesAreCopiedOnWrite() {
        final Map<String, Object> variables = new HashMap<String, Object>();
        variables.put("n", 3);
        final XPathContext withVariables = new XPathContext(document, variables);
        final XPathContext copy = withVariables.copy();
        copy.setVariable("m", "x");

        assertTrue(copy.hasVariable("m"));
        assertFalse(withVariables.hasVariable("m"));
        assertEquals(java.math.BigInteger.valueOf(3), withVariables.getVariable("n"));
        assertEquals(java.math.BigInteger.valueOf(3), copy.getVariable("n"));
    }

    @Test
    public void testNativeNodeVariables() {
        final Element b = document.getRootElement().element("b");
        final Map<String, Object> variables = new HashMap<String, Object>();
        variables.put("node", b);
        variables.put("nodes", Arrays.asList(b, "text"));
        final XPathContext withVariables = new XPathContext(document, variables);

        final XPathNode node = (XPathNode) withVariables.getVariable("node");
        assertSame(b, node.getNativeNode());
        final List<?> nodes = (List<?>) withVariables.getVariable("nodes");
        assertSame(node, nodes.get(0));
        assertEquals("text", nodes.get(1));
    }

    @Test
    public void testNativeContextItem() {
        final Element c = document.getRootElement().element("b").element("c");
        final XPathContext itemContext = new XPathContext(document, c, null, null, null, false);
        assertSame(c, ((XPathNode) itemContext.getItem()).getNativeNode());
        assertEquals(Collections.singletonList("b"), names(select(itemContext, "..")));
    }

    @Test
    public void testForeignContextItem() {
        try {
            new XPathContext(document, DocumentHelper.createElement("foreign"), null, null, null, false);
            fail("Expected XPTY0004");
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0004, e.getCode());
        }
    }

    @Test
    public void testForeignNodeVariable() {
        try {
            new XPathContext(document, Collections.<String, Object>singletonMap("v", DocumentHelper.createElement("foreign")));
            fail("Expected XPTY0004");
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0004, e.getCode());
        }
    }

    @Test
    public void testNativeAttributeItem() {
        final Attribute id = document.getRootElement().element("b").attribute("id");
        final XPathContext itemContext = new XPathContext(document, id, null, null, null, false);
        final XPathNode node = (XPathNode) itemContext.getItem();
        assertEquals(NodeKind.ATTRIBUTE, node.getKind());
        assertSame(id, node.getNativeNode());
        assertEquals(Collections.singletonList("b"), names(select(itemContext, "..")));

        final XPathContext withVariable = new XPathContext(document, Collections.<String, Object>singletonMap("a", id));
        final XPathNode variable = (XPathNode) withVariable.getVariable("a");
        assertEquals(NodeKind.ATTRIBUTE, variable.getKind());
        assertSame(id, variable.getNativeNode());
        assertEquals(Collections.singletonList("b"), names(select(withVariable, "$a/..")));
    }

    @Test
    public void testNativeNamespaceItem() {
        final Document withNamespace = Dom4jUtils.readDom4j("<root xmlns:p='urn:p'><p:child/></root>");
        final XPathContext documentContext = new XPathContext(withNamespace);
        final ElementNode child = (ElementNode) documentContext.getDocument().getDocumentElement().getChildren().get(0);
        Object nativeNamespace = null;
        for (NamespaceNode namespaceNode : child.getNamespaceNodes()) {
            if ("p".equals(namespaceNode.getPrefix()))
                nativeNamespace = namespaceNode.getNativeNode();
        }
        assertTrue(nativeNamespace instanceof Namespace);

        final XPathContext itemContext = new XPathContext(withNamespace, nativeNamespace, null, null, null, false);
        final XPathNode node = (XPathNode) itemContext.getItem();
        assertEquals(NodeKind.NAMESPACE, node.getKind());
        assertEquals("urn:p", node.getStringValue());
        assertEquals(Collections.singletonList("child"), names(select(itemContext, "..")));

        // A namespace without its element is ambiguous
        try {
            new XPathContext(withNamespace, Namespace.get("p", "urn:p"), null, null, null, false);
            fail("Expected XPTY0004");
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0004, e.getCode());
        }
    }

    @Test
    public void testReverseAxesMirrorForwardAxes() {
        final List<XPathNode> nodes = ((XPathNode) context.getRoot()).getTree().getNodes();
        for (XPathNode node : nodes) {
            assertMirrored(node, nodes, context.copy(), XPathContext.PRECEDING, XPathContext.FOLLOWING);
            assertMirrored(node, nodes, context.copy(), XPathContext.PRECEDING_SIBLING, XPathContext.FOLLOWING_SIBLING);
        }
    }

    // The reverse axis from a node yields, in reverse document order, the nodes whose forward axis contains it
    private static void assertMirrored(XPathNode node, List<XPathNode> nodes, XPathContext context,
                                       String reverseAxis, String forwardAxis) {
        final List<Object> expected = new ArrayList<Object>();
        for (XPathNode other : nodes) {
            if (axis(context, other, forwardAxis).contains(node))
                expected.add(other);
        }
        Collections.reverse(expected);
        assertEquals(reverseAxis + " of " + node, expected, axis(context, node, reverseAxis));
    }

    private static List<Object> axis(XPathContext context, XPathNode node, String axisName) {
        context.setItem(node);
        final Iterator<Object> i;
        if (XPathContext.PRECEDING.equals(axisName))
            i = context.iterPreceding();
        else if (XPathContext.FOLLOWING.equals(axisName))
            i = context.iterFollowings();
        else
            i = context.iterSiblings(axisName);
        final List<Object> result = new ArrayList<Object>();
        while (i.hasNext())
            result.add(i.next());
        return result;
    }

    @Test
    public void testForwardAxes() {
        assertEquals(Arrays.asList("c", "d"), names(select(context, "root/b/child::*")));
        assertEquals(Arrays.asList("b", "c", "d"), names(select(context, "root/b/descendant-or-self::*")));
        assertEquals(Arrays.asList("c", "d"), names(select(context, "root/b/descendant::*")));
        assertEquals(Arrays.asList("b", "c", "d", "e"), names(select(context, "root/a/following::*")));
        assertEquals(Arrays.asList("d"), names(select(context, "root/b/c/following-sibling::*")));
        assertEquals(Arrays.asList("b"), names(select(context, "root/b/c/self::c/parent::*")));
        assertEquals(Arrays.asList("2"), values(select(context, "root/b/d/../@id")));
    }

    @Test
    public void testReverseAxesInDocumentOrder() {
        // Paths sort their result whatever the direction of the axis
        assertEquals(Arrays.asList("a", "b"), names(select(context, "root/e/preceding-sibling::*")));
        assertEquals(Arrays.asList("root", "b"), names(select(context, "root/b/c/ancestor::*")));
        assertEquals(Arrays.asList("root", "b", "c"), names(select(context, "root/b/c/ancestor-or-self::*")));
        assertEquals(Arrays.asList("a"), names(select(context, "root/b/c/preceding::*")));
    }

    @Test
    public void testReverseAxisPositions() {
        assertEquals(Arrays.asList("b"), names(select(context, "root/e/preceding-sibling::*[1]")));
        assertEquals(Arrays.asList("a"), names(select(context, "root/e/preceding-sibling::*[last()]")));
        assertEquals(Arrays.asList("b"), names(select(context, "root/b/c/ancestor::*[1]")));
        assertEquals(Arrays.asList("root"), names(select(context, "root/b/c/ancestor::*[2]")));
    }

    @Test
    public void testImplicitDocument() {
        final Element root = DocumentHelper.createElement("root");
        root.addElement("child");
        final XPathContext elementContext = new XPathContext(root);

        assertNull(elementContext.getDocument());
        assertEquals(Arrays.asList("root"), names(select(elementContext, "/")));
        assertEquals(Arrays.asList("root"), names(select(elementContext, "/root")));
        assertEquals(Arrays.asList("child"), names(select(elementContext, "/root/child")));
        assertEquals(Arrays.asList("child"), names(select(elementContext, "child")));
    }

    @Test
    public void testAtomicContextItem() {
        final XPathContext atomicContext = new XPathContext(null, "value", null, null, null, false);
        assertEquals(Arrays.<Object>asList("value"), select(atomicContext, "."));
        try {
            select(atomicContext, "child::*");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0020, e.getCode());
        }
    }

    @Test
    public void testMissingContext() {
        try {
            new XPath1Parser().parse("a").select(null);
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPDY0002, e.getCode());
        }
    }

    private static List<Object> select(XPathContext context, String expression) {
        final List<Object> result = new ArrayList<Object>();
        for (Iterator<Object> i = new XPath1Parser().parse(expression).select(context); i.hasNext();)
            result.add(i.next());
        return result;
    }

    private static List<String> names(List<Object> nodes) {
        final List<String> result = new ArrayList<String>();
        for (Object node : nodes)
            result.add(((XPathNode) node).getLocalName());
        return result;
    }

    private static List<String> values(List<Object> nodes) {
        final List<String> result = new ArrayList<String>();
        for (Object node : nodes)
            result.add(((XPathNode) node).getStringValue());
        return result;
    }
}
