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
package org.orbeon.xpath.util;

import org.dom4j.Document;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathValueException;

import java.net.URL;

import static org.junit.Assert.*;

public class Dom4jUtilsTest {

    @Test
    public void testReadKeepsWhitespace() {
        final Document document = Dom4jUtils.readDom4j("<a> <b/> </a>");
        assertEquals("a", document.getRootElement().getName());
        assertEquals(3, document.getRootElement().content().size());
    }

    @Test
    public void testReadInvalid() {
        try {
            Dom4jUtils.readDom4j("<a>");
            fail("Expected FODC0002");
        } catch (XPathValueException e) {
            assertEquals(ErrorCode.FODC0002, e.getCode());
        }
    }

    @Test
    public void testReadUrl() {
        final URL url = getClass().getResource("/org/orbeon/xpath/function/catalog.xml");
        assertEquals("catalog", Dom4jUtils.readDom4j(url).getRootElement().getName());
    }

    @Test
    public void testToURL() {
        assertEquals("http", Dom4jUtils.toURL("http://example.org/a.xml").getProtocol());
        assertEquals("file", Dom4jUtils.toURL("data/a.xml").getProtocol());
        try {
            Dom4jUtils.toURL("http://exa mple.org/");
            fail("Expected FODC0002");
        } catch (XPathValueException e) {
            assertEquals(ErrorCode.FODC0002, e.getCode());
        }
    }
}
