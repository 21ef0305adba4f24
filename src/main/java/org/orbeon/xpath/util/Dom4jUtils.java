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
import org.dom4j.DocumentException;
import org.dom4j.io.SAXReader;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathValueException;

import java.io.File;
import java.io.InputStream;
import java.io.StringReader;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * Reading dom4j documents. Parse errors become {@link XPathValueException} with code FODC0002.
 */
public class Dom4jUtils {

    private Dom4jUtils() {}

    private static SAXReader createSAXReader() {
        final SAXReader reader = new SAXReader();
        reader.setMergeAdjacentText(true);
        reader.setStripWhitespaceText(false);
        return reader;
    }

    /**
     * Parse an XML string.
     */
    public static Document readDom4j(String xml) {
        try {
            return createSAXReader().read(new StringReader(xml));
        } catch (DocumentException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "cannot parse XML: " + e.getMessage(), null, e);
        }
    }

    public static Document readDom4j(InputStream inputStream, String systemId) {
        try {
            return createSAXReader().read(inputStream, systemId);
        } catch (DocumentException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "cannot parse " + systemId + ": " + e.getMessage(), null, e);
        }
    }

    public static Document readDom4j(URL url) {
        try {
            return createSAXReader().read(url);
        } catch (DocumentException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "cannot read " + url + ": " + e.getMessage(), null, e);
        }
    }

    /**
     * Resolve a URI given as string: absolute URIs are used as they are, other strings are file paths.
     */
    public static URL toURL(String uri) {
        try {
            final URI parsed = new URI(uri);
            if (parsed.isAbsolute())
                return parsed.toURL();
            return new File(uri).toURI().toURL();
        } catch (URISyntaxException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "invalid URI " + uri, null, e);
        } catch (MalformedURLException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "invalid URI " + uri, null, e);
        } catch (IllegalArgumentException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "invalid URI " + uri, null, e);
        }
    }
}
