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
package org.orbeon.xpath.parser;

import org.junit.Before;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.common.XPathSyntaxException;

import static org.junit.Assert.*;

public class XPath1ParserTest {

    private XPath1Parser parser;

    @Before
    public void setUp() {
        parser = new XPath1Parser();
    }

    @Test
    public void testOperatorPrecedence() {
        assertEquals("(+ (1) (2))", tree("1 + 2"));
        assertEquals("(+ (1) (* (2) (3)))", tree("1 + 2 * 3"));
        assertEquals("(- (- (5) (2)) (1))", tree("5 - 2 - 1"));
        assertEquals("(or (a) (and (b) (c)))", tree("a or b and c"));
        assertEquals("(= (+ (1) (1)) (2))", tree("1 + 1 = 2"));
        assertEquals("(- (1))", tree("-1"));
    }

    @Test
    public void testLiterals() {
        assertEquals("('x')", tree("'x'"));
        assertEquals("('x')", tree("\"x\""));
        assertEquals("(1)", tree("1"));
        assertEquals("(1.5)", tree("1.5"));
    }

    @Test
    public void testPaths() {
        assertEquals("(/)", tree("/"));
        assertEquals("(/ (a) (b))", tree("a/b"));
        assertEquals("(/ (/ (a)) (b))", tree("/a/b"));
        assertEquals("(// (a))", tree("//a"));
        assertEquals("(child (a))", tree("child::a"));
        assertEquals("([ (a) (1))", tree("a[1]"));
        assertEquals("(.)", tree("."));
        assertEquals("(..)", tree(".."));
    }

    @Test
    public void testFunctionsAndVariables() {
        assertEquals("(count (a))", tree("count(a)"));
        assertEquals("(true)", tree("true()"));
        assertEquals("(concat ('a') ('b') ('c'))", tree("concat('a', 'b', 'c')"));
        assertEquals("($ (x))", tree("$x"));
        parser.setNamespace("p", "urn:p");
        assertEquals("(: (p) (a))", tree("p:a"));
    }

    @Test
    public void testUnknownPrefix() {
        assertError(ErrorCode.XPST0081, "q:a");
    }

    @Test
    public void testOperatorNamesAsNames() {
        // Operator names are element names where an operand is expected
        assertEquals("(/ (div) (mod))", tree("div/mod"));
        assertEquals("(and (and) (or))", tree("and and or"));
    }

    @Test
    public void testEmptySource() {
        try {
            parser.parse("");
            fail();
        } catch (XPathSyntaxException e) {
            assertEquals(ErrorCode.XPST0003, e.getCode());
            assertEquals("source is empty", e.getDetail());
        }
    }

    @Test
    public void testUnexpectedEnd() {
        try {
            parser.parse("1 + ");
            fail();
        } catch (XPathSyntaxException e) {
            assertEquals(ErrorCode.XPST0003, e.getCode());
            assertTrue(e.getDetail().startsWith("unexpected end of source"));
        }
    }

    @Test
    public void testUnbalancedParenthesis() {
        try {
            parser.parse("(1 + 2");
            fail();
        } catch (XPathSyntaxException e) {
            assertEquals(ErrorCode.XPST0003, e.getCode());
        }
        try {
            parser.parse("1 + 2)");
            fail();
        } catch (XPathSyntaxException e) {
            assertEquals(ErrorCode.XPST0003, e.getCode());
        }
    }

    @Test
    public void testUnknownFunction() {
        assertError(ErrorCode.XPST0017, "unknown(1)");
    }

    @Test
    public void testUnknownAxis() {
        assertError(ErrorCode.XPST0010, "sideways::a");
    }

    @Test
    public void testWrongArity() {
        assertError(ErrorCode.XPST0017, "count()");
        assertError(ErrorCode.XPST0017, "true(1)");
        assertError(ErrorCode.XPST0017, "substring('a', 1, 2, 3)");
    }

    @Test
    public void testXPath2SyntaxRejected() {
        assertError(ErrorCode.XPST0017, "exists(a)");
        assertError(ErrorCode.XPST0003, "1 to 2");
    }

    @Test
    public void testErrorMessageLocation() {
        try {
            parser.parse("1 +\n  unknown()");
            fail();
        } catch (XPathException e) {
            assertEquals(2, e.getLine());
            assertTrue(e.getMessage().contains("[err:XPST0017]"));
        }
    }

    @Test
    public void testVersion() {
        assertEquals("1.0", parser.getVersion());
        assertTrue(parser.isCompatibilityMode());
    }

    private String tree(String expression) {
        return parser.parse(expression).getTree();
    }

    private void assertError(ErrorCode code, String expression) {
        try {
            parser.parse(expression);
            fail("no error for " + expression);
        } catch (XPathException e) {
            assertEquals(code, e.getCode());
        }
    }
}
