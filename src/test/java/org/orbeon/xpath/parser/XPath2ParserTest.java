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
import org.orbeon.xpath.common.XPathNameException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.schema.SchemaProxy;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class XPath2ParserTest {

    private XPath2Parser parser;

    @Before
    public void setUp() {
        parser = new XPath2Parser();
    }

    @Test
    public void testVersion() {
        assertEquals("2.0", parser.getVersion());
        assertFalse(parser.isCompatibilityMode());
        assertEquals(XPathParser.XQT_ERRORS_NAMESPACE, parser.getNamespaceUri("err"));
    }

    @Test
    public void testConditional() {
        assertEquals(Arrays.<Object>asList("a"), evaluate("if (1 eq 1) then 'a' else 'b'"));
        assertEquals(Arrays.<Object>asList("b"), evaluate("if (()) then 'a' else 'b'"));
    }

    @Test
    public void testRangeAndSequence() {
        assertEquals(integers(1, 2, 3), evaluate("1 to 3"));
        assertEquals(integers(1, 2, 3), evaluate("(1, 2, 3)"));
        assertEquals(integers(1, 2, 3, 4), evaluate("(1, (2, 3), 4)"));
        assertEquals(integers(), evaluate("3 to 1"));
        assertEquals(integers(), evaluate("()"));
    }

    @Test
    public void testFor() {
        assertEquals(integers(2, 4, 6), evaluate("for $x in 1 to 3 return $x * 2"));
        assertEquals(integers(11, 21, 12, 22), evaluate("for $a in (1, 2), $b in (10, 20) return $a + $b"));
    }

    @Test
    public void testQuantified() {
        assertEquals(Arrays.<Object>asList(Boolean.TRUE), evaluate("some $x in 1 to 3 satisfies $x gt 2"));
        assertEquals(Arrays.<Object>asList(Boolean.FALSE), evaluate("every $x in 1 to 3 satisfies $x gt 2"));
        assertEquals(Arrays.<Object>asList(Boolean.TRUE), evaluate("every $x in () satisfies $x gt 2"));
        assertEquals(Arrays.<Object>asList(Boolean.FALSE), evaluate("some $x in () satisfies $x gt 2"));
    }

    @Test
    public void testKeywordsAsNames() {
        // Keywords not followed by their syntax are element names
        assertEquals("(/ (if) (for))", parser.parse("if/for").getTree());
        assertEquals("(/ (return) (satisfies))", parser.parse("return/satisfies").getTree());
    }

    @Test
    public void testBindingTree() {
        assertEquals("(for ($ (x)) (to (1) (3)) ($ (x)))", parser.parse("for $x in 1 to 3 return $x").getTree());
    }

    @Test
    public void testDeclaredVariables() {
        parser.setVariableType("a", "xs:string");
        assertEquals("xs:string", parser.getVariableType("a"));
        parser.parse("$a");
        parser.parse("for $b in 1 to 2 return $a");
        parser.parse("for $b in 1 to 2 return $b");
        try {
            parser.parse("$b");
            fail();
        } catch (XPathNameException e) {
            assertEquals(ErrorCode.XPST0008, e.getCode());
        }
        try {
            parser.parse("(for $b in 1 to 2 return $b), $b");
            fail();
        } catch (XPathNameException e) {
            assertEquals(ErrorCode.XPST0008, e.getCode());
        }
    }

    @Test
    public void testUndeclaredVariablesCheckedAtEvaluation() {
        final XPathToken token = parser.parse("$undefined");
        try {
            token.evaluate(new XPathContext((Object) null));
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPST0008, e.getCode());
        }
    }

    @Test
    public void testXPath2Functions() {
        assertEquals(Arrays.<Object>asList(Boolean.TRUE), evaluate("exists((1, 2))"));
        assertEquals(Arrays.<Object>asList(Boolean.TRUE), evaluate("empty(())"));
        assertEquals(integers(3, 2, 1), evaluate("reverse(1 to 3)"));
        assertEquals(integers(2, 3), evaluate("subsequence(1 to 5, 2, 2)"));
        assertEquals(Arrays.<Object>asList("a-b"), evaluate("string-join(('a', 'b'), '-')"));
    }

    @Test
    public void testXPath2Lexing() {
        assertEquals(integers(3), evaluate("(: comment :) 1 + 2"));
        assertEquals(Arrays.<Object>asList("it's"), evaluate("'it''s'"));
    }

    @Test
    public void testSchemaBoundParsing() {
        parser.setSchema(SchemaProxy.load(getClass().getResource("/org/orbeon/xpath/schema/collection.xsd")));
        parser.setVariableType("n", "xs:integer");
        parser.parse("/collection/object[position = $n]/title");
        parser.parse("sum(/collection/object/price) + $n");
        parser.parse("/unknown/element");
    }

    @Test
    public void testSchemaBoundUnknownFunction() {
        parser.setSchema(SchemaProxy.load(getClass().getResource("/org/orbeon/xpath/schema/collection.xsd")));
        try {
            parser.parse("/collection/unknown()");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPST0017, e.getCode());
        }
    }

    private List<Object> evaluate(String expression) {
        final List<Object> result = new ArrayList<Object>();
        for (Iterator<Object> i = parser.parse(expression).select(new XPathContext((Object) null)); i.hasNext();)
            result.add(i.next());
        return result;
    }

    private static List<Object> integers(int... values) {
        final List<Object> result = new ArrayList<Object>();
        for (int value : values)
            result.add(BigInteger.valueOf(value));
        return result;
    }
}
