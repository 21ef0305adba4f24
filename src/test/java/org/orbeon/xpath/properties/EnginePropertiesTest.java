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
package org.orbeon.xpath.properties;

import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.function.CollationManager;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.parser.XPathParser;

import java.io.File;
import java.io.IOException;
import java.net.URL;

import static org.junit.Assert.*;

public class EnginePropertiesTest {

    @Test
    public void testDefaultConfiguration() {
        final EngineProperties properties = EngineProperties.instance();
        assertSame(properties, EngineProperties.instance());
        assertEquals("2.0", properties.getVersion());
        assertFalse(properties.isStrict());
        assertFalse(properties.isFragment());
        assertEquals(CollationManager.CODEPOINT_COLLATION, properties.getDefaultCollation());

        final XPathParser parser = properties.createParser();
        assertTrue(parser instanceof XPath2Parser);
        assertFalse(parser.isStrict());
    }

    @Test
    public void testEmptyPropertySet() {
        final EngineProperties properties = new EngineProperties(new PropertySet());
        assertEquals(XPath2Parser.VERSION, properties.getVersion());
        assertNull(properties.getDefaultCollation());
        assertFalse(properties.isFragment());
    }

    @Test
    public void testVersionAndStrictness() {
        final PropertySet propertySet = new PropertySet();
        propertySet.setProperty(EngineProperties.VERSION_PROPERTY, PropertyStore.XS_STRING_QNAME, "1.0");
        propertySet.setProperty(EngineProperties.STRICT_PROPERTY, PropertyStore.XS_BOOLEAN_QNAME, "true");

        final XPathParser parser = new EngineProperties(propertySet).createParser();
        assertTrue(parser instanceof XPath1Parser);
        assertTrue(parser.isStrict());
        assertTrue(parser.isCompatibilityMode());
    }

    @Test
    public void testUnsupportedVersion() {
        final PropertySet propertySet = new PropertySet();
        propertySet.setProperty(EngineProperties.VERSION_PROPERTY, PropertyStore.XS_STRING_QNAME, "3.1");
        try {
            new EngineProperties(propertySet).createParser();
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.FORG0001, e.getCode());
            assertTrue(e.getMessage().contains("3.1"));
        }
    }

    @Test
    public void testUnreadableProperties() throws Exception {
        final URL url = new File("target/no-such-dir/xpath-properties.xml").toURI().toURL();
        try {
            EngineProperties.load(url);
            fail();
        } catch (XPathException e) {
            assertEquals(ErrorCode.FODC0002, e.getCode());
            assertTrue(e.getCause() instanceof IOException);
        }
    }
}
