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

import org.junit.Test;
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.expr.ArithmeticToken;
import org.orbeon.xpath.expr.LiteralToken;
import org.orbeon.xpath.expr.UnionToken;
import org.orbeon.xpath.function.TrueFunction;

import static org.junit.Assert.*;

public class SymbolTableTest {

    @Test
    public void testRegisterAndDuplicate() {
        final SymbolTable table = new SymbolTable();
        table.register("|", 50, 50, TokenDefinition.LABEL_OPERATOR, UnionToken.class);
        table.duplicate("|", "union");

        final TokenDefinition union = table.get("union");
        assertNotNull(union);
        assertEquals("union", union.getSymbol());
        assertEquals(50, union.getLbp());
        assertEquals(UnionToken.class, union.getTokenClass());
        assertEquals("|", table.get("|").getSymbol());
    }

    @Test
    public void testCopyIsIndependent() {
        final SymbolTable base = new SymbolTable();
        base.register("+", 40, 40, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);
        base.seal();

        final SymbolTable derived = base.copy();
        assertFalse(derived.isSealed());
        derived.unregister("+");
        derived.register("-", 40, 40, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);

        assertTrue(base.contains("+"));
        assertFalse(base.contains("-"));
        assertFalse(derived.contains("+"));
        assertTrue(derived.contains("-"));
    }

    @Test(expected = XPathValueException.class)
    public void testSealedTableRejectsChanges() {
        final SymbolTable table = new SymbolTable();
        table.seal();
        table.register("(string)", 0, 0, TokenDefinition.LABEL_LITERAL, LiteralToken.class);
    }

    @Test(expected = XPathValueException.class)
    public void testReservedFunctionName() {
        new SymbolTable().registerFunction("node", 0, 0, new TrueFunction());
    }

    @Test(expected = XPathValueException.class)
    public void testBlankSymbol() {
        new SymbolTable().register("  ", 0, 0, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);
    }

    @Test(expected = XPathValueException.class)
    public void testUnregisterUnknownSymbol() {
        new SymbolTable().unregister("foo");
    }

    @Test
    public void testGrammarVersionsShareNothing() {
        final SymbolTable xpath1 = new XPath1Parser().getSymbolTable();
        final SymbolTable xpath2 = new XPath2Parser().getSymbolTable();

        assertTrue(xpath1.isSealed());
        assertTrue(xpath2.isSealed());
        assertFalse(xpath1.contains("to"));
        assertTrue(xpath2.contains("to"));
        assertTrue(xpath2.contains("union"));
        assertEquals(2, xpath1.get("contains").getMaxArguments());
        assertEquals(3, xpath2.get("contains").getMaxArguments());
        assertTrue(xpath1.get("ancestor").isReverseAxis());
        assertFalse(xpath1.get("descendant").isReverseAxis());
    }
}
