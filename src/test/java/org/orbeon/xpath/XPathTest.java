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
package org.orbeon.xpath;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.WriterAppender;
import org.dom4j.Attribute;
import org.dom4j.Document;
import org.dom4j.Element;
import org.junit.Before;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.util.Dom4jUtils;

import java.io.StringWriter;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class XPathTest {

    private Document document;

    @Before
    public void setUp() {
        document = Dom4jUtils.readDom4j("<root xmlns:p='urn:p'><a n='1'>x</a><a n='2'>y</a><p:b/></root>");
    }

    @Test
    public void testStaticSelect() {
        final List<Object> result = XPath.select(document, "root/a");
        assertEquals(2, result.size());
        final List<?> expected = document.getRootElement().elements("a");
        assertSame(expected.get(0), result.get(0));
        assertSame(expected.get(1), result.get(1));

        final List<Object> attributes = XPath.select(document, "root/a/@n");
        assertTrue(attributes.get(0) instanceof Attribute);
        assertEquals("2", ((Attribute) attributes.get(1)).getValue());

        assertEquals(1, XPath.select(document, "root/q:b", Collections.singletonMap("q", "urn:p")).size());
        assertEquals(Arrays.<Object>asList("x"), XPath.select(document, "string(root/a)"));
    }

    @Test
    public void testSelectFromElement() {
        final Element root = document.getRootElement();
        final List<Object> result = new XPath("a[2]", new XPath1Parser()).selectNodes(root);
        assertEquals(1, result.size());
        assertEquals("y", ((Element) result.get(0)).getText());
    }

    @Test
    public void testConfiguredVersion() {
        final XPath xpath = new XPath("1 + 2");
        assertEquals("2.0", xpath.getParser().getVersion());
        assertEquals("(+ (1) (2))", xpath.getRootToken().getTree());
        assertEquals("1 + 2", xpath.toString());
        assertEquals("1 + 2", xpath.getExpression());
        assertEquals(Arrays.<Object>asList(BigInteger.valueOf(3)), xpath.selectNodes(null));
    }

    @Test
    public void testEvaluate() {
        assertEquals(BigInteger.valueOf(2), new XPath("count(root/a)").evaluate(document));

        final Map<String, Object> variables = new HashMap<String, Object>();
        variables.put("x", 3);
        assertEquals(Arrays.<Object>asList(BigInteger.valueOf(6)), new XPath("$x * 2").selectNodes(null, variables));
        assertEquals(Arrays.<Object>asList("1"), new XPath("string(root/a[@n = $x - 2]/@n)").selectNodes(document, variables));
    }

    @Test
    public void testValueOf() {
        assertEquals("x", new XPath("root/a").stringValueOf(document));
        assertEquals("", new XPath("root/none").stringValueOf(document));
        assertEquals(2.0, new XPath("root/a[2]/@n").numberValueOf(document), 0);
        assertTrue(Double.isNaN(new XPath("root/none").numberValueOf(document)));
        assertTrue(new XPath("root/a").booleanValueOf(document));
        assertFalse(new XPath("root/none").booleanValueOf(document));
        assertTrue(new XPath("count(root/a) = 2").booleanValueOf(document));
        try {
            new XPath("(1, 2)").booleanValueOf(null);
            fail("Expected FORG0006");
        } catch (XPathException e) {
            assertEquals(ErrorCode.FORG0006, e.getCode());
        }
    }

    @Test
    public void testSingleNodeAndIteration() {
        final Object first = new XPath("root/a/@n").selectSingleNode(document);
        assertEquals("1", ((Attribute) first).getValue());
        assertNull(new XPath("root/none").selectSingleNode(document));

        final Iterator<Object> i = new XPath("root/*").iterSelect(document, null);
        assertEquals("a", ((Element) i.next()).getName());
        assertEquals("a", ((Element) i.next()).getName());
        assertEquals("b", ((Element) i.next()).getName());
        assertFalse(i.hasNext());
    }

    @Test
    public void testExistingContext() {
        final XPath xpath = new XPath("root/a");
        final XPathContext context = new XPathContext(document);
        assertSame(context, xpath.createContext(context, null));
        assertEquals(2, xpath.selectNodes(context).size());
    }

    @Test
    public void testSyntaxError() {
        try {
            new XPath("root/(");
            fail("Expected XPST0003");
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPST0003, e.getCode());
            assertEquals("root/(", e.getSource());
        }
    }

    @Test
    public void testOperationLoggingAfterErrors() {
        final Logger logger = Logger.getLogger(XPath.class.getName());
        final Level level = logger.getLevel();
        final boolean additivity = logger.getAdditivity();
        final StringWriter writer = new StringWriter();
        final WriterAppender appender = new WriterAppender(new PatternLayout("%m%n"), writer);
        logger.addAppender(appender);
        logger.setAdditivity(false);
        logger.setLevel(Level.DEBUG);
        try {
            try {
                new XPath("1 +", new XPath1Parser());
                fail();
            } catch (XPathException e) {
                assertEquals(ErrorCode.XPST0003, e.getCode());
            }
            final XPath xpath = new XPath("root/a", new XPath1Parser());
            try {
                xpath.selectNodes("not a node");
                fail();
            } catch (XPathException e) {
                assertEquals(ErrorCode.XPTY0004, e.getCode());
            }
            assertEquals(2, xpath.selectNodes(document).size());
        } finally {
            logger.removeAppender(appender);
            logger.setAdditivity(additivity);
            logger.setLevel(level);
        }

        final String[] lines = writer.toString().split("\\r?\\n");
        int starts = 0;
        int ends = 0;
        for (String line : lines) {
            // Each operation starts at the outermost level
            assertTrue(line, line.startsWith("xpath - compile - ") || line.startsWith("xpath - select - "));
            if (line.contains(" - start expression"))
                starts++;
            else if (line.contains(" - end expression"))
                ends++;
        }
        assertEquals(4, starts);
        assertEquals(starts, ends);
    }
}
