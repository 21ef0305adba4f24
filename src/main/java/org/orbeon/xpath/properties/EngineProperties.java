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
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.parser.XPath2Parser;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.util.Dom4jUtils;
import org.orbeon.xpath.util.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;

/**
 * Engine configuration, read once from <code>config/xpath-properties.xml</code> on the class path. Without that file
 * every property has its default value.
 */
public class EngineProperties {

    private static final Logger logger = LoggerFactory.createLogger(EngineProperties.class);

    public static final String PROPERTIES_RESOURCE = "config/xpath-properties.xml";

    public static final String VERSION_PROPERTY = "xpath.version";
    public static final String STRICT_PROPERTY = "xpath.strict";
    public static final String DEFAULT_COLLATION_PROPERTY = "xpath.default-collation";
    public static final String FRAGMENT_PROPERTY = "xpath.tree.fragment";

    private static EngineProperties instance;

    private final PropertySet propertySet;

    public EngineProperties(PropertySet propertySet) {
        this.propertySet = propertySet;
    }

    public static synchronized EngineProperties instance() {
        if (instance == null)
            instance = new EngineProperties(load());
        return instance;
    }

    private static PropertySet load() {
        final URL url = EngineProperties.class.getClassLoader().getResource(PROPERTIES_RESOURCE);
        if (url == null) {
            logger.debug("No " + PROPERTIES_RESOURCE + " found, using defaults");
            return new PropertySet();
        }
        return load(url);
    }

    static PropertySet load(URL url) {
        if (logger.isDebugEnabled())
            logger.debug("Loading properties from " + url);
        InputStream inputStream = null;
        try {
            inputStream = url.openStream();
            return new PropertyStore(Dom4jUtils.readDom4j(inputStream, url.toExternalForm())).getPropertySet();
        } catch (IOException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "cannot read properties " + url, null, e);
        } finally {
            if (inputStream != null) {
                try {
                    inputStream.close();
                } catch (IOException e) {
                    logger.warn("Cannot close " + url, e);
                }
            }
        }
    }

    public PropertySet getPropertySet() {
        return propertySet;
    }

    public String getVersion() {
        return propertySet.getString(VERSION_PROPERTY, XPath2Parser.VERSION);
    }

    public boolean isStrict() {
        return propertySet.getBoolean(STRICT_PROPERTY, false);
    }

    public String getDefaultCollation() {
        return propertySet.getString(DEFAULT_COLLATION_PROPERTY);
    }

    public boolean isFragment() {
        return propertySet.getBoolean(FRAGMENT_PROPERTY, false);
    }

    /**
     * New parser of the configured version.
     */
    public XPathParser createParser() {
        final String version = getVersion();
        final XPathParser parser;
        if (XPath1Parser.VERSION.equals(version))
            parser = new XPath1Parser();
        else if (XPath2Parser.VERSION.equals(version))
            parser = new XPath2Parser();
        else
            throw ErrorCode.FORG0001.createException("unsupported " + VERSION_PROPERTY + ": " + version, null);
        parser.setStrict(isStrict());
        return parser;
    }
}
