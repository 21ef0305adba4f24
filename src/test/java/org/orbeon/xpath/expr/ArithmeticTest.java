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

import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathArithmeticException;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.util.Dom4jUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class ArithmeticTest {

    @Test
    public void testIntegerArithmetic() {
        assertEquals(BigInteger.valueOf(3), xpath2("1 + 2"));
        assertEquals(BigInteger.valueOf(-1), xpath2("1 - 2"));
        assertEquals(BigInteger.valueOf(6), xpath2("2 * 3"));
        assertEquals(BigInteger.valueOf(-3), xpath2("-(1 + 2)"));
        assertEquals(BigInteger.valueOf(7), xpath2("1 + 2 * 3"));
    }

    @Test
    public void testTypePromotion() {
        assertEquals(0, new BigDecimal("7.0").compareTo((BigDecimal) xpath2("2 * 3.5")));
        assertEquals(Double.valueOf(3.5), xpath2("1 + 2.5e0"));
        assertTrue(xpath2("1.5 + 1") instanceof BigDecimal);
    }

    @Test
    public void testXPath2Division() {
        assertEquals(0, new BigDecimal("0.5").compareTo((BigDecimal) xpath2("1 div 2")));
        assertEquals(Double.valueOf(Double.POSITIVE_INFINITY), xpath2("1e0 div 0"));
        assertDivisionByZero("1 div 0");
        assertDivisionByZero("1.5 div 0.0");
        assertDivisionByZero("1 mod 0");
    }

    @Test
    public void testXPath1Division() {
        assertEquals(Double.valueOf(0.5), xpath1("1 div 2"));
        assertEquals(Double.valueOf(Double.POSITIVE_INFINITY), xpath1("1 div 0"));
        assertEquals(Double.valueOf(Double.NEGATIVE_INFINITY), xpath1("-1 div 0"));
        assertTrue(Double.isNaN((Double) xpath1("0 div 0")));
        assertTrue(Double.isNaN((Double) xpath1("1 mod 0")));
    }

    @Test
    public void testIntegerDivisionAndModulus() {
        assertEquals(BigInteger.valueOf(3), xpath2("7 idiv 2"));
        assertEquals(BigInteger.valueOf(-3), xpath2("-7 idiv 2"));
        assertEquals(BigInteger.valueOf(2), xpath2("5.5e0 idiv 2"));
        assertEquals(BigInteger.valueOf(-1), xpath2("-7 mod 2"));
        assertEquals(BigInteger.ONE, xpath2("7 mod -2"));
        assertDivisionByZero("7 idiv 0");
        try {
            xpath2("(0e0 div 0) idiv 1");
            fail();
        } catch (XPathArithmeticException e) {
            assertEquals(ErrorCode.FOAR0002, e.getCode());
        }
    }

    @Test
    public void testEmptyOperands() {
        assertTrue(evaluate(new XPath2Parser(), "1 + ()").isEmpty());
        assertTrue(evaluate(new XPath2Parser(), "-()").isEmpty());
    }

    @Test
    public void testXPath1ConvertsOperands() {
        assertEquals(4.0, ((Number) xpath1("'3' + 1")).doubleValue(), 0);
        assertEquals(2.0, ((Number) xpath1("true() + 1")).doubleValue(), 0);
        assertTrue(Double.isNaN(((Number) xpath1("'a' + 1")).doubleValue()));
    }

    @Test
    public void testXPath2RejectsStrings() {
        try {
            xpath2("'3' + 1");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0004, e.getCode());
        }
    }

    @Test
    public void testUntypedOperands() {
        final XPathContext context = new XPathContext(Dom4jUtils.readDom4j("<a n='4' s='x'/>"));
        assertEquals(Double.valueOf(5.0), single(evaluate(new XPath2Parser(), context, "a/@n + 1")));
        assertTrue(Double.isNaN((Double) single(evaluate(new XPath1Parser(), context, "a/nothing + 1"))));
        assertTrue(evaluate(new XPath2Parser(), context, "a/nothing + 1").isEmpty());
        try {
            evaluate(new XPath2Parser(), context, "a/@s + 1");
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.FORG0001, e.getCode());
        }
    }

    @Test
    public void testRoundingFunctions() {
        assertEquals(Double.valueOf(3.0), xpath1("round(2.5)"));
        assertEquals(Double.valueOf(-2.0), xpath1("round(-2.5)"));
        assertEquals(Double.valueOf(2.0), xpath1("floor(2.7)"));
        assertEquals(Double.valueOf(-2.0), xpath1("ceiling(-2.7)"));
        assertEquals(0, new BigDecimal("3").compareTo((BigDecimal) xpath2("round(2.5)")));
        assertEquals(BigInteger.valueOf(2), xpath2("floor(2)"));
    }

    private void assertDivisionByZero(String expression) {
        try {
            xpath2(expression);
            fail("no error for " + expression);
        } catch (XPathArithmeticException e) {
            assertEquals(ErrorCode.FOAR0001, e.getCode());
        }
    }

    private static Object xpath1(String expression) {
        return single(evaluate(new XPath1Parser(), expression));
    }

    private static Object xpath2(String expression) {
        return single(evaluate(new XPath2Parser(), expression));
    }

    private static List<Object> evaluate(XPathParser parser, String expression) {
        return evaluate(parser, new XPathContext((Object) null), expression);
    }

    private static List<Object> evaluate(XPathParser parser, XPathContext context, String expression) {
        final List<Object> result = new ArrayList<Object>();
        for (Iterator<Object> i = parser.parse(expression).select(context); i.hasNext();)
            result.add(i.next());
        return result;
    }

    private static Object single(List<Object> values) {
        assertEquals(1, values.size());
        return values.get(0);
    }
}
