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

import org.dom4j.Document;
import org.junit.Before;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.util.Dom4jUtils;

import java.net.URI;
import java.util.Arrays;

import static org.junit.Assert.*;

public class PropertyStoreTest {

    private static final String PROPERTIES =
            "<properties xmlns:xs='http://www.w3.org/2001/XMLSchema'>" +
                "<property as='xs:string'  name='engine.name'        value='  xpath  '/>" +
                "<property as='xs:string'  name='engine.blank'       value='   '/>" +
                "<property as='xs:integer' name='engine.cache.size'  value=' 42 '/>" +
                "<property as='xs:boolean' name='engine.cache.on'    value='1'/>" +
                "<property as='xs:boolean' name='engine.strict'      value='false'/>" +
                "<property as='xs:anyURI'  name='engine.home'        value='http://example.org/home'/>" +
                "<property as='xs:string'  name='engine.*.label'     value='any'/>" +
                "<group>" +
                    "<property as='xs:string' name='nested.value' value='inside'/>" +
                "</group>" +
                "<property name='untyped' value='ignored'/>" +
            "</properties>";

    private PropertySet propertySet;

    @Before
    public void setUp() {
        propertySet = new PropertyStore(Dom4jUtils.readDom4j(PROPERTIES)).getPropertySet();
    }

    @Test
    public void testTypedGetters() {
        assertEquals("xpath", propertySet.getString("engine.name"));
        assertEquals(Integer.valueOf(42), propertySet.getInteger("engine.cache.size"));
        assertEquals(Boolean.TRUE, propertySet.getBoolean("engine.cache.on"));
        assertEquals(Boolean.FALSE, propertySet.getBoolean("engine.strict"));
        assertEquals(URI.create("http://example.org/home"), propertySet.getURI("engine.home"));
        assertEquals("inside", propertySet.getString("nested.value"));
        assertEquals(Integer.valueOf(42), propertySet.getObject("engine.cache.size"));
    }

    @Test
    public void testDefaults() {
        assertNull(propertySet.getString("engine.blank"));
        assertEquals("default", propertySet.getString("engine.blank", "default"));
        assertEquals("default", propertySet.getString("engine.missing", "default"));
        assertEquals(7, propertySet.getInteger("engine.missing", 7));
        assertTrue(propertySet.getBoolean("engine.missing", true));
        assertEquals("fallback", propertySet.getObject("engine.missing", "fallback"));
        assertNull(propertySet.getProperty("untyped"));
    }

    @Test
    public void testWildcards() {
        assertEquals("any", propertySet.getString("engine.parser.label"));
        assertEquals("any", propertySet.getString("engine.tree.label"));
        assertNull(propertySet.getString("engine.parser.other"));
    }

    @Test
    public void testPropertiesStartsWith() {
        assertEquals(Arrays.asList("engine.cache.size", "engine.cache.on", "engine.*.label"),
                propertySet.getPropertiesStartsWith("engine.cache"));
        assertEquals(Arrays.asList("nested.value"), propertySet.getPropertiesStartsWith("nested"));
        assertTrue(propertySet.getPropertiesStartsWith("unknown").isEmpty());
        assertEquals(8, propertySet.size());
        assertTrue(propertySet.keySet().contains("engine.*.label"));
    }

    @Test
    public void testWrongType() {
        try {
            propertySet.getString("engine.cache.size");
            fail("Expected FORG0001");
        } catch (XPathValueException e) {
            assertEquals(ErrorCode.FORG0001, e.getCode());
        }
    }

    @Test
    public void testInvalidDeclarations() {
        assertInvalid("<property as='xs:date' name='a' value='2020-01-01'/>");
        assertInvalid("<property as='xs:integer' name='a' value='many'/>");
        assertInvalid("<property as='xs:boolean' name='a' value='yes'/>");
        assertInvalid("<property as='xs:anyURI' name='a' value='not a uri'/>");
        assertInvalid("<property as='xs:string' value='nameless'/>");
    }

    private static void assertInvalid(String property) {
        final Document document = Dom4jUtils.readDom4j(
                "<properties xmlns:xs='http://www.w3.org/2001/XMLSchema'>" + property + "</properties>");
        try {
            new PropertyStore(document);
            fail("Expected FORG0001 for " + property);
        } catch (XPathValueException e) {
            assertEquals(ErrorCode.FORG0001, e.getCode());
        }
    }

    @Test
    public void testConverters() {
        assertEquals(Integer.valueOf(3), PropertyStore.getObjectFromStringValue("3", PropertyStore.XS_INTEGER_QNAME));
        assertEquals(Boolean.FALSE, PropertyStore.getObjectFromStringValue("0", PropertyStore.XS_BOOLEAN_QNAME));
        assertEquals("s", PropertyStore.getObjectFromStringValue("s", PropertyStore.XS_STRING_QNAME));
    }
}
