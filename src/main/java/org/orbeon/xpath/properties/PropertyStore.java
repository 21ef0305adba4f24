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

import org.apache.log4j.Logger;
import org.dom4j.Document;
import org.dom4j.Element;
import org.dom4j.QName;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.util.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a property document:
 *
 * <pre>
 * &lt;properties xmlns:xs="http://www.w3.org/2001/XMLSchema">
 *     &lt;property as="xs:boolean" name="xpath.strict" value="false"/>
 * &lt;/properties>
 * </pre>
 */
public class PropertyStore {

    private static final Logger logger = LoggerFactory.createLogger(PropertyStore.class);

    public static final QName XS_STRING_QNAME = QName.get("string", "xs", XPathParser.XSD_NAMESPACE);
    public static final QName XS_INTEGER_QNAME = QName.get("integer", "xs", XPathParser.XSD_NAMESPACE);
    public static final QName XS_BOOLEAN_QNAME = QName.get("boolean", "xs", XPathParser.XSD_NAMESPACE);
    public static final QName XS_ANYURI_QNAME = QName.get("anyURI", "xs", XPathParser.XSD_NAMESPACE);

    public static final Map<QName, Converter> SUPPORTED_TYPES = new HashMap<QName, Converter>();

    static {
        SUPPORTED_TYPES.put(XS_STRING_QNAME, new StringConverter());
        SUPPORTED_TYPES.put(XS_INTEGER_QNAME, new IntegerConverter());
        SUPPORTED_TYPES.put(XS_BOOLEAN_QNAME, new BooleanConverter());
        SUPPORTED_TYPES.put(XS_ANYURI_QNAME, new URIConverter());
    }

    private final PropertySet propertySet = new PropertySet();

    /**
     * Convert a property's string value to an object of its type.
     */
    public static Object getObjectFromStringValue(String stringValue, QName type) {
        final Converter converter = SUPPORTED_TYPES.get(type);
        return (converter == null) ? null : converter.convert(stringValue);
    }

    public PropertyStore(Document propertiesDocument) {
        final XPathContext context = new XPathContext(propertiesDocument);
        for (Iterator<Object> i = new XPath1Parser().parse("/properties//property").select(context); i.hasNext();) {
            final Element propertyElement = (Element) ((XPathNode) i.next()).getNativeNode();

            final String as = propertyElement.attributeValue("as");
            final String name = propertyElement.attributeValue("name");
            final String value = propertyElement.attributeValue("value");

            if (as != null) {
                final QName typeQName = propertyElement.getQName(as);
                if (SUPPORTED_TYPES.get(typeQName) == null)
                    throw new XPathValueException(ErrorCode.FORG0001, "invalid as attribute: " + as
                            + " for property " + name, null);
                if (name == null)
                    throw new XPathValueException(ErrorCode.FORG0001, "property without name", null);

                propertySet.setProperty(name, typeQName, value);
                if (logger.isDebugEnabled())
                    logger.debug("Property " + name + " = " + value + " (" + as + ")");
            }
        }
    }

    public PropertySet getPropertySet() {
        return propertySet;
    }

    /* All converters */

    public interface Converter {
        Object convert(String value);
    }

    public static class StringConverter implements Converter {
        public Object convert(String value) {
            return value;
        }
    }

    public static class IntegerConverter implements Converter {
        public Object convert(String value) {
            try {
                return Integer.valueOf(value.trim());
            } catch (NumberFormatException e) {
                throw new XPathValueException(ErrorCode.FORG0001, "not an integer: " + value, null, e);
            }
        }
    }

    public static class BooleanConverter implements Converter {
        public Object convert(String value) {
            final String trimmed = value.trim();
            if ("true".equals(trimmed) || "1".equals(trimmed))
                return Boolean.TRUE;
            else if ("false".equals(trimmed) || "0".equals(trimmed))
                return Boolean.FALSE;
            throw new XPathValueException(ErrorCode.FORG0001, "not a boolean: " + value, null);
        }
    }

    public static class URIConverter implements Converter {
        public Object convert(String value) {
            try {
                return new URI(value.trim());
            } catch (URISyntaxException e) {
                throw new XPathValueException(ErrorCode.FORG0001, "not a URI: " + value, null, e);
            }
        }
    }
}
