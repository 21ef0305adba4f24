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
package org.orbeon.xpath.schema;

import org.apache.xerces.xs.XSTypeDefinition;
import org.junit.Before;
import org.junit.Test;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.util.Dom4jUtils;
import org.orbeon.xpath.value.UntypedAtomic;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.*;

public class SchemaProxyTest {

    private static final String XSD = "{http://www.w3.org/2001/XMLSchema}";

    private static final String TEXT_SCHEMA =
            "<xs:schema xmlns:xs='http://www.w3.org/2001/XMLSchema' targetNamespace='urn:t' xmlns:t='urn:t'>" +
                "<xs:element name='size' type='xs:int'/>" +
                "<xs:attribute name='flag' type='xs:boolean'/>" +
                "<xs:simpleType name='code'><xs:restriction base='xs:token'/></xs:simpleType>" +
            "</xs:schema>";

    private SchemaProxy collection;

    @Before
    public void setUp() {
        collection = SchemaProxy.load(getClass().getResource("/org/orbeon/xpath/schema/collection.xsd"));
    }

    @Test
    public void testLoadFromUrl() {
        assertNotNull(collection.getModel());
        assertNotNull(collection.getElementType("collection"));
        assertNull(collection.getElementType("nothing"));
        assertNull(collection.getAttributeType("id"));

        final XSTypeDefinition partType = collection.getType("partType");
        assertNotNull(partType);
        assertEquals("partType", SchemaTypes.getExpandedName(partType));
        assertNull(SchemaTypes.getExpandedName(collection.getElementType("object")));
    }

    @Test
    public void testLoadFromText() {
        final SchemaProxy schema = SchemaProxy.load(TEXT_SCHEMA);
        assertEquals(XSD + "int", SchemaTypes.getExpandedName(schema.getElementType("{urn:t}size")));
        assertNull(schema.getElementType("size"));
        assertEquals(XSD + "boolean", SchemaTypes.getExpandedName(schema.getAttributeType("{urn:t}flag")));
        assertEquals("{urn:t}code", SchemaTypes.getExpandedName(schema.getType("{urn:t}code")));
        assertEquals("1", schema.getSampleValue("{urn:t}code"));
        assertEquals(BigInteger.ONE, SchemaTypes.sampleValue(schema.getElementType("{urn:t}size")));
    }

    @Test
    public void testSampleValues() {
        assertEquals(BigInteger.ONE, collection.getSampleValue(XSD + "integer"));
        assertEquals(BigInteger.ONE, collection.getSampleValue(XSD + "unsignedByte"));
        assertEquals(BigDecimal.ONE, collection.getSampleValue(XSD + "decimal"));
        assertEquals(Double.valueOf(1.0), collection.getSampleValue(XSD + "double"));
        assertEquals(Boolean.TRUE, collection.getSampleValue(XSD + "boolean"));
        assertEquals("1", collection.getSampleValue(XSD + "string"));
        assertEquals(new UntypedAtomic("1"), collection.getSampleValue("noSuchType"));
        assertEquals(new UntypedAtomic(""), SchemaTypes.sampleValue(collection.getElementType("object")));
    }

    @Test
    public void testContext() {
        final XPathContext first = collection.getContext();
        final XPathContext second = collection.getContext();
        assertNotSame(first, second);
        assertTrue(first.isSchema());
        assertSame(first.getRoot(), second.getRoot());

        final XPath2Parser parser = new XPath2Parser();
        parser.setSchema(collection);
        final Iterator<Object> titles = parser.parse("/collection/object/title").select(collection.getContext());
        assertTrue(titles.hasNext());
        titles.next();
        assertFalse(titles.hasNext());
    }

    @Test
    public void testSchemaContextFallbacks() {
        assertEquals(Collections.<Object>singletonList(Boolean.FALSE), schemaSelect("/collection/object/title = 1"));
        assertTrue(schemaSelect("/collection/object/title + 1").isEmpty());
        assertTrue(schemaSelect("doc('collection.xml')").isEmpty());
        assertEquals(Collections.<Object>singletonList(Boolean.FALSE), schemaSelect("doc-available('collection.xml')"));
        assertTrue(schemaSelect("environment-variable('PATH')").isEmpty());

        // Same mismatch on instance data raises
        final XPath2Parser parser = new XPath2Parser();
        try {
            toList(parser.parse("'1' + 1").select(new XPathContext(Dom4jUtils.readDom4j("<collection/>"))));
            fail("Expected XPTY0004");
        } catch (XPathException e) {
            assertEquals(ErrorCode.XPTY0004, e.getCode());
        }
    }

    @Test
    public void testInvalidSchema() {
        try {
            SchemaProxy.load("<xs:schema xmlns:xs='http://www.w3.org/2001/XMLSchema'>");
            fail("Expected FODC0002");
        } catch (XPathValueException e) {
            assertEquals(ErrorCode.FODC0002, e.getCode());
        }
    }

    @Test
    public void testInvalidName() {
        try {
            collection.getType("{urn:t");
            fail("Expected FORG0001");
        } catch (XPathValueException e) {
            assertEquals(ErrorCode.FORG0001, e.getCode());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullModel() {
        new SchemaProxy(null);
    }

    private List<Object> schemaSelect(String expression) {
        final XPath2Parser parser = new XPath2Parser();
        parser.setSchema(collection);
        return toList(parser.parse(expression).select(collection.getContext()));
    }

    private static List<Object> toList(Iterator<Object> iterator) {
        final List<Object> result = new ArrayList<Object>();
        while (iterator.hasNext())
            result.add(iterator.next());
        return result;
    }
}
