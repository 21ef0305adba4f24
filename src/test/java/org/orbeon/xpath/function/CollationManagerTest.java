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
package org.orbeon.xpath.function;

import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;

import static org.junit.Assert.*;

public class CollationManagerTest {

    @Test
    public void testCodepoint() {
        assertTrue(CollationManager.isCodepoint(null));
        assertTrue(CollationManager.isCodepoint(CollationManager.CODEPOINT_COLLATION));
        assertFalse(CollationManager.isCodepoint(CollationManager.UCA_COLLATION));

        final CollationManager manager = new CollationManager(null, null);
        try {
            assertEquals(CollationManager.CODEPOINT_COLLATION, manager.getCollation());
            assertEquals(1, manager.compare("a", "B"));
            assertEquals(-1, manager.compare("a", "b"));
            assertEquals(0, manager.compare("a", "a"));
            assertTrue(manager.ne("a", "A"));
            // U+FF00 against U+10000, which is a surrogate pair
            assertEquals(-1, manager.compare("\uFF00", "\uD800\uDC00"));
            assertEquals(1, manager.compare("\uD800\uDC00", "\uFFFF"));
            assertEquals(-1, manager.compare("a", "a\uD800\uDC00"));
            assertEquals(0, manager.compare("x\uD800\uDC00", "x\uD800\uDC00"));
        } finally {
            manager.close();
        }
    }

    @Test
    public void testLocaleNames() {
        for (String name : new String[] { "en_US", "it-IT", "it_IT.UTF-8" }) {
            final CollationManager manager = new CollationManager(name, null);
            try {
                assertEquals(name, -1, manager.compare("a", "B"));
                assertEquals(name, 1, manager.compare("b", "A"));
            } finally {
                manager.close();
            }
        }
    }

    @Test
    public void testUca() {
        final CollationManager root = new CollationManager(CollationManager.UCA_COLLATION, null);
        try {
            assertEquals(-1, root.compare("a", "B"));
        } finally {
            root.close();
        }

        final CollationManager italian = new CollationManager(CollationManager.UCA_COLLATION + "?lang=it", null);
        try {
            assertEquals(-1, italian.compare("a", "B"));
            assertTrue(italian.eq("abc", "abc"));
        } finally {
            italian.close();
        }
    }

    @Test
    public void testUnsupported() {
        for (String name : new String[] { "http://example.org/collation", "xx", CollationManager.UCA_COLLATION + "?lang=xx" }) {
            try {
                new CollationManager(name, null);
                fail("Expected FOCH0002 for " + name);
            } catch (XPathException e) {
                assertEquals(ErrorCode.FOCH0002, e.getCode());
            }
        }
    }

    @Test
    public void testSubstrings() {
        final CollationManager codepoint = new CollationManager(null, null);
        try {
            assertEquals(2, codepoint.find("hello", "ll"));
            assertEquals(4, codepoint.findEnd("hello", "ll"));
            assertEquals(-1, codepoint.find("hello", "x"));
            assertEquals(-1, codepoint.findEnd("hello", "x"));
            assertTrue(codepoint.startsWith("hello", "he"));
            assertFalse(codepoint.startsWith("hello", "He"));
            assertTrue(codepoint.contains("hello", ""));
        } finally {
            codepoint.close();
        }

        final CollationManager english = new CollationManager("en", null);
        try {
            assertEquals(2, english.find("hello", "ll"));
            assertEquals(4, english.findEnd("hello", "ll"));
            assertEquals(0, english.find("hello", ""));
            assertEquals(-1, english.find("hello", "x"));
            assertTrue(english.startsWith("hello", "hel"));
            assertTrue(english.contains("hello", "ell"));
            assertFalse(english.contains("hello", "elo"));
        } finally {
            english.close();
        }
    }

    @Test
    public void testCloseTwice() {
        final CollationManager manager = new CollationManager("en", null);
        manager.close();
        manager.close();
    }
}
