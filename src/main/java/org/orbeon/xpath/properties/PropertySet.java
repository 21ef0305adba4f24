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

import org.apache.commons.lang3.StringUtils;
import org.dom4j.QName;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathValueException;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Represent a set of properties.
 *
 * A property name can be exact, e.g. xpath.tree.fragment, or it can contain wildcards, like "xpath.*.fragment" or
 * "xpath.*". An exact name always wins over a wildcard.
 */
public class PropertySet {

    public static class Property {
        public final QName type;
        public final Object value;

        public Property(QName type, Object value) {
            this.type = type;
            this.value = value;
        }
    }

    private static class PropertyNode {
        public Property property;
        public Map<String, PropertyNode> children;
    }

    private final Map<String, Property> exactProperties = new HashMap<String, Property>();
    private final PropertyNode wildcardProperties = new PropertyNode();

    public Set<String> keySet() {
        return Collections.unmodifiableSet(exactProperties.keySet());
    }

    public int size() {
        return exactProperties.size();
    }

    /**
     * Set a property, converting its string value according to its type.
     */
    public void setProperty(String name, QName type, String stringValue) {
        final Property property = new Property(type, PropertyStore.getObjectFromStringValue(stringValue, type));

        exactProperties.put(name, property);

        // Also store in tree, so that wildcards and prefixes can be searched
        PropertyNode currentNode = wildcardProperties;
        for (String token : StringUtils.split(name, '.')) {
            if (currentNode.children == null)
                currentNode.children = new LinkedHashMap<String, PropertyNode>();
            PropertyNode newNode = currentNode.children.get(token);
            if (newNode == null) {
                newNode = new PropertyNode();
                currentNode.children.put(token, newNode);
            }
            currentNode = newNode;
        }
        currentNode.property = property;
    }

    private List<String> getPropertiesStartsWithWorker(PropertyNode propertyNode, String consumed, String[] tokens, int currentTokenPosition) {
        final List<String> result = new ArrayList<String>();
        final String token = currentTokenPosition >= tokens.length ? null : tokens[currentTokenPosition];

        if (token == null || "*".equals(token)) {
            if (propertyNode.children == null && token == null)
                result.add(consumed);

            if (propertyNode.children != null) {
                for (Map.Entry<String, PropertyNode> entry : propertyNode.children.entrySet()) {
                    final String newConsumed = consumed.length() == 0 ? entry.getKey() : consumed + "." + entry.getKey();
                    result.addAll(getPropertiesStartsWithWorker(entry.getValue(), newConsumed, tokens, currentTokenPosition + 1));
                }
            }
        } else if (propertyNode.children != null) {
            for (String actualToken : new String[] { token, "*" }) {
                final PropertyNode newPropertyNode = propertyNode.children.get(actualToken);
                if (newPropertyNode != null) {
                    final String newConsumed = consumed.length() == 0 ? actualToken : consumed + "." + actualToken;
                    result.addAll(getPropertiesStartsWithWorker(newPropertyNode, newConsumed, tokens, currentTokenPosition + 1));
                }
            }
        }
        return result;
    }

    /**
     * Names of the properties whose name starts with the given tokens.
     */
    public List<String> getPropertiesStartsWith(String name) {
        return getPropertiesStartsWithWorker(wildcardProperties, "", StringUtils.split(name, '.'), 0);
    }

    private Property getPropertyWorker(PropertyNode propertyNode, String[] tokens, int currentTokenPosition) {
        if (propertyNode == null) {
            return null;
        } else if (currentTokenPosition == tokens.length) {
            return propertyNode.property;
        } else {
            if (propertyNode.children == null)
                return null;
            final Property result = getPropertyWorker(propertyNode.children.get(tokens[currentTokenPosition]), tokens, currentTokenPosition + 1);
            if (result != null)
                return result;
            return getPropertyWorker(propertyNode.children.get("*"), tokens, currentTokenPosition + 1);
        }
    }

    /**
     * Get a property.
     *
     * @param name      property name
     * @param type      property type to check against, or null
     * @return          property if found, null otherwise
     */
    private Property getProperty(String name, QName type) {
        Property property = exactProperties.get(name);
        if (property == null) {
            property = getPropertyWorker(wildcardProperties, StringUtils.split(name, '.'), 0);
            if (property == null)
                return null;
        }

        if (type != null && !type.equals(property.type))
            throw new XPathValueException(ErrorCode.FORG0001, "invalid type requested for property '" + name
                    + "': expected " + type.getQualifiedName() + ", found " + property.type.getQualifiedName(), null);
        return property;
    }

    private Object getPropertyValue(String name, QName type) {
        final Property property = getProperty(name, type);
        return (property == null) ? null : property.value;
    }

    public Property getProperty(String name) {
        return getProperty(name, null);
    }

    public Object getObject(String name) {
        return getPropertyValue(name, null);
    }

    public Object getObject(String name, Object defaultValue) {
        final Object result = getObject(name);
        return (result == null) ? defaultValue : result;
    }

    public String getString(String name) {
        return StringUtils.trimToNull((String) getPropertyValue(name, PropertyStore.XS_STRING_QNAME));
    }

    public String getString(String name, String defaultValue) {
        final String result = getString(name);
        return (result == null) ? defaultValue : result;
    }

    public Integer getInteger(String name) {
        return (Integer) getPropertyValue(name, PropertyStore.XS_INTEGER_QNAME);
    }

    public int getInteger(String name, int defaultValue) {
        final Integer result = getInteger(name);
        return (result == null) ? defaultValue : result;
    }

    public Boolean getBoolean(String name) {
        return (Boolean) getPropertyValue(name, PropertyStore.XS_BOOLEAN_QNAME);
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        final Boolean result = getBoolean(name);
        return (result == null) ? defaultValue : result;
    }

    public URI getURI(String name) {
        return (URI) getPropertyValue(name, PropertyStore.XS_ANYURI_QNAME);
    }
}
