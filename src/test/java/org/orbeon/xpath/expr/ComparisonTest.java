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

import org.junit.Before;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.util.Dom4jUtils;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class ComparisonTest {

    private XPathContext context;

    @Before
    public void setUp() {
        context = new XPathContext(Dom4jUtils.readDom4j("<root><item n='1'/><item n='2'/><item n='3'/></root>"));
    }

    @Test
    public void testXPath1Comparisons() {
        assertTrue(xpath1("1 = 1.0"));
        assertTrue(xpath1("'abc' = 'abc'"));
        assertTrue(xpath1("1 = '1'"));
        assertFalse(xpath1("'2' > '10'"));
        assertFalse(xpath1("'a' < 'b'"));
        assertTrue(xpath1("true() = 1"));
        assertTrue(xpath1("1 = 1 = 1"));
        assertFalse(xpath1("0 div 0 = 0 div 0"));
        assertTrue(xpath1("0 div 0 != 0 div 0"));
    }

    @Test
    public void testXPath1NodeSetComparisons() {
        assertTrue(xpath1("root/item/@n = 3"));
        assertTrue(xpath1("root/item/@n != 3"));
        assertFalse(xpath1("root/item/@n = 4"));
        assertTrue(xpath1("root/item/@n > 2"));
        assertFalse(xpath1("root/nothing = root/nothing"));
        assertTrue(xpath1("root/item/@n = root/item[2]/@n"));
        assertTrue(xpath1("root/item = ''"));
    }

    @Test
    public void testGeneralComparisons() {
        assertTrue(xpath2("1 = (1, 2)"));
        assertFalse(xpath2("(1, 2) = (3, 4)"));
        assertTrue(xpath2("(1, 2) != (1, 2)"));
        assertTrue(xpath2("'a' < 'b'"));
        assertTrue(xpath2("'\uFF00' < '\uD800\uDC00'"));
        assertFalse(xpath2("'\uD800\uDC00' <= '\uFFFF'"));
        assertTrue(xpath2("root/item/@n = 3"));
        assertTrue(xpath2("root/item/@n = '3'"));
        assertFalse(xpath2("() = ()"));
    }

    @Test
    public void testValueComparisons() {
        assertTrue(xpath2("1 eq 1.0"));
        assertTrue(xpath2("'a' lt 'b'"));
        assertTrue(xpath2("2 ge 2"));
        assertFalse(xpath2("2 gt 2"));
        assertTrue(xpath2("root/item[1]/@n eq '1'"));
        assertTrue(evaluate(new XPath2Parser(), "() eq 1").isEmpty());
        assertError(ErrorCode.XPTY0004, "1 eq '1'");
        assertError(ErrorCode.XPTY0004, "(1, 2) eq 1");
    }

    @Test
    public void testNodeComparisons() {
        assertTrue(xpath2("root/item[1] is (//item)[1]"));
        assertFalse(xpath2("root/item[1] is root/item[2]"));
        assertTrue(xpath2("root/item[1] << root/item[2]"));
        assertFalse(xpath2("root/item[1] >> root/item[2]"));
        assertTrue(xpath2("root << root/item[1]"));
        assertTrue(evaluate(new XPath2Parser(), "root/nothing is root").isEmpty());
        assertError(ErrorCode.XPTY0004, "1 is root");
    }

    @Test
    public void testChainedComparisonsRejected() {
        try {
            new XPath2Parser().parse("1 = 1 = 1");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPST0003, e.getCode());
        }
    }

    @Test
    public void testLogicalOperators() {
        assertTrue(xpath2("1 = 1 and 2 = 2"));
        assertTrue(xpath2("1 = 2 or 2 = 2"));
        assertFalse(xpath2("root/nothing or ''"));
        assertTrue(xpath1("root/item and 'x'"));
    }

    private boolean xpath1(String expression) {
        return single(evaluate(new XPath1Parser(), expression));
    }

    private boolean xpath2(String expression) {
        return single(evaluate(new XPath2Parser(), expression));
    }

    private void assertError(ErrorCode code, String expression) {
        try {
            evaluate(new XPath2Parser(), expression);
            fail("no error for " + expression);
        } catch (XPathException e) {
            assertEquals(code, e.getCode());
        }
    }

    private List<Object> evaluate(XPathParser parser, String expression) {
        final List<Object> result = new ArrayList<Object>();
        for (Iterator<Object> i = parser.parse(expression).select(context); i.hasNext();)
            result.add(i.next());
        return result;
    }

    private static boolean single(List<Object> values) {
        assertEquals(1, values.size());
        return (Boolean) values.get(0);
    }
}
