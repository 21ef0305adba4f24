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
package org.orbeon.xpath.expr;

import org.dom4j.Document;
import org.junit.Before;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.DocumentOrder;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.util.Dom4jUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class PathExpressionsTest {

    private Document document;
    private XPathContext context;

    @Before
    public void setUp() {
        document = Dom4jUtils.readDom4j("<root><item n='1'/><item n='2'/><child><item n='3'/></child></root>");
        context = new XPathContext(document);
    }

    @Test
    public void testDescendants() {
        assertEquals(BigInteger.valueOf(3), single(new XPath1Parser(), "count(//item)"));
        assertEquals(Arrays.asList("1", "2", "3"), attributes(select(new XPath1Parser(), "//item")));
        assertEquals(Arrays.asList("3"), attributes(select(new XPath1Parser(), "root//child//item")));
    }

    @Test
    public void testDescendantPredicateAppliesPerParent() {
        // //item[2] is the second item child of its parent, (//item)[2] the second item of the document
        assertEquals(Arrays.asList("2"), attributes(select(new XPath1Parser(), "//item[2]")));
        assertEquals(Arrays.asList("1", "3"), attributes(select(new XPath1Parser(), "//item[1]")));
        assertEquals(Arrays.asList("3"), attributes(select(new XPath1Parser(), "(//item)[3]")));
    }

    @Test
    public void testResultsAreSortedWithoutDuplicates() {
        final List<Object> nodes = select(new XPath1Parser(), "//item/../item");
        assertEquals(Arrays.asList("1", "2", "3"), attributes(nodes));
        assertTrue(DocumentOrder.isSorted(nodes));

        assertEquals(1, select(new XPath1Parser(), "root/item/..").size());
    }

    @Test
    public void testUnion() {
        final List<Object> forward = select(new XPath1Parser(), "root/item | root/child");
        final List<Object> backward = select(new XPath1Parser(), "root/child | root/item");
        assertEquals(3, forward.size());
        assertEquals(forward, backward);
        assertEquals("child", ((XPathNode) forward.get(2)).getLocalName());

        assertEquals(3, select(new XPath1Parser(), "//item | root/item").size());
        assertEquals(3, select(new XPath2Parser(), "//item union root/item").size());
    }

    @Test
    public void testIntersectExcept() {
        assertEquals(Arrays.asList("3"), attributes(select(new XPath2Parser(), "//item intersect root/child/item")));
        assertEquals(Arrays.asList("1", "2"), attributes(select(new XPath2Parser(), "//item except root/child/item")));
    }

    @Test
    public void testUnionOfAtomicValues() {
        try {
            select(new XPath2Parser(), "1 | 2");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0004, e.getCode());
        }
    }

    @Test
    public void testPredicates() {
        final XPath1Parser parser = new XPath1Parser();
        assertEquals(Arrays.asList("1"), attributes(select(parser, "root/item[1]")));
        assertEquals(Arrays.asList("2"), attributes(select(parser, "root/item[last()]")));
        assertEquals(Arrays.asList("2"), attributes(select(parser, "root/item[@n = 2]")));
        assertEquals(Arrays.asList("2"), attributes(select(parser, "root/item[position() > 1]")));
        assertEquals(Arrays.asList("1", "2"), attributes(select(parser, "root/item[@n]")));
        assertTrue(select(parser, "root/item[false()]").isEmpty());
        assertTrue(select(parser, "root/item[1.5]").isEmpty());
        assertTrue(select(parser, "root/item[3]").isEmpty());
        assertEquals(1, select(parser, "root/*[item]").size());
    }

    @Test
    public void testChainedPredicates() {
        // The second predicate sees the positions left by the first one
        assertEquals(Arrays.asList("2"), attributes(select(new XPath1Parser(), "root/item[@n > 0][2]")));
        assertEquals(Arrays.asList("2", "3"), attributes(select(new XPath1Parser(), "//item[@n > 1][1]")));
    }

    @Test
    public void testPredicateOnSequence() {
        assertEquals(Arrays.<Object>asList(BigInteger.valueOf(20)), select(new XPath2Parser(), "(10, 20, 30)[2]"));
        assertEquals(Arrays.<Object>asList(BigInteger.valueOf(30)), select(new XPath2Parser(), "(10, 20, 30)[. > 25]"));
    }

    @Test
    public void testAtomicLastStep() {
        assertEquals(Arrays.<Object>asList("item", "item"), select(new XPath2Parser(), "root/item/name()"));
    }

    @Test
    public void testAtomicIntermediateStep() {
        try {
            select(new XPath2Parser(), "(1, 2)/item");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0019, e.getCode());
        }
    }

    @Test
    public void testMixedPathResult() {
        try {
            select(new XPath2Parser(), "root/(item, 'x')");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0018, e.getCode());
        }
    }

    @Test
    public void testAttributeSteps() {
        assertEquals(Arrays.asList("1", "2", "3"), values(select(new XPath1Parser(), "//item/@n")));
        assertEquals(Arrays.asList("1", "2", "3"), values(select(new XPath1Parser(), "//item/attribute::n")));
        assertEquals(Arrays.asList("1", "2", "3"), values(select(new XPath2Parser(), "//item/attribute(n)")));
    }

    @Test
    public void testKindTests() {
        final XPathContext textContext = new XPathContext(Dom4jUtils.readDom4j("<a>x<!--c--><b/>y</a>"));
        assertEquals(4, select(new XPath1Parser(), textContext, "a/node()").size());
        assertEquals(Arrays.asList("x", "y"), values(select(new XPath1Parser(), textContext, "a/text()")));
        assertEquals(Arrays.asList("c"), values(select(new XPath1Parser(), textContext, "a/comment()")));
        assertEquals(1, select(new XPath2Parser(), textContext, "a/element()").size());
        assertEquals(1, select(new XPath2Parser(), textContext, "self::document-node()").size());
    }

    private List<Object> select(XPathParser parser, String expression) {
        return select(parser, context, expression);
    }

    private static List<Object> select(XPathParser parser, XPathContext context, String expression) {
        final List<Object> result = new ArrayList<Object>();
        for (Iterator<Object> i = parser.parse(expression).select(context); i.hasNext();)
            result.add(i.next());
        return result;
    }

    private Object single(XPathParser parser, String expression) {
        final List<Object> result = select(parser, expression);
        assertEquals(1, result.size());
        return result.get(0);
    }

    private static List<String> attributes(List<Object> nodes) {
        final List<String> result = new ArrayList<String>();
        for (Object node : nodes)
            result.add(((ElementNode) node).getAttribute("n").getStringValue());
        return result;
    }

    private static List<String> values(List<Object> nodes) {
        final List<String> result = new ArrayList<String>();
        for (Object node : nodes)
            result.add(((XPathNode) node).getStringValue());
        return result;
    }
}
