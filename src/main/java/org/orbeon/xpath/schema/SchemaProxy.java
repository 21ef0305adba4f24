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

import org.apache.log4j.Logger;
import org.apache.xerces.impl.xs.XMLSchemaLoader;
import org.apache.xerces.xni.XNIException;
import org.apache.xerces.xni.grammars.XSGrammar;
import org.apache.xerces.xni.parser.XMLErrorHandler;
import org.apache.xerces.xni.parser.XMLInputSource;
import org.apache.xerces.xni.parser.XMLParseException;
import org.apache.xerces.xs.XSAttributeDeclaration;
import org.apache.xerces.xs.XSElementDeclaration;
import org.apache.xerces.xs.XSModel;
import org.apache.xerces.xs.XSTypeDefinition;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.context.XPathSchemaContext;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.tree.NodeTrees;
import org.orbeon.xpath.util.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.net.URL;

/**
 * Gives the parser access to an XML Schema: the node tree of the schema graph used for static evaluation, and the
 * types of global declarations.
 */
public class SchemaProxy {

    private static final Logger logger = LoggerFactory.createLogger(SchemaProxy.class);

    private final XSModel model;
    private final String uri;
    private DocumentNode schemaRoot;

    public SchemaProxy(XSModel model) {
        this(model, null);
    }

    public SchemaProxy(XSModel model, String uri) {
        if (model == null)
            throw new IllegalArgumentException("Schema model is null");
        this.model = model;
        this.uri = uri;
    }

    /**
     * Load a schema from its XSD text.
     */
    public static SchemaProxy load(String xsd) {
        return load(new XMLInputSource(null, null, null, new StringReader(xsd), null), null);
    }

    public static SchemaProxy load(URL url) {
        final String systemId = url.toExternalForm();
        return load(new XMLInputSource(null, systemId, null), systemId);
    }

    private static SchemaProxy load(XMLInputSource inputSource, String systemId) {
        if (logger.isDebugEnabled())
            logger.debug("Loading schema " + (systemId != null ? systemId : "from text"));
        final XMLSchemaLoader loader = new XMLSchemaLoader();
        loader.setErrorHandler(new XMLErrorHandler() {
            public void warning(String domain, String key, XMLParseException exception) {
                logger.warn("Schema warning: " + exception.getMessage());
            }

            public void error(String domain, String key, XMLParseException exception) {
                throw exception;
            }

            public void fatalError(String domain, String key, XMLParseException exception) {
                throw exception;
            }
        });
        try {
            final XSGrammar grammar = (XSGrammar) loader.loadGrammar(inputSource);
            if (grammar == null)
                throw new XPathValueException(ErrorCode.FODC0002, "no schema found at " + systemId, null);
            return new SchemaProxy(grammar.toXSModel(), systemId);
        } catch (XNIException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "invalid schema: " + e.getMessage(), null, e);
        } catch (IOException e) {
            throw new XPathValueException(ErrorCode.FODC0002, "cannot read schema: " + e.getMessage(), null, e);
        }
    }

    public XSModel getModel() {
        return model;
    }

    /**
     * New context for evaluating an expression against the schema graph. The graph is built once.
     */
    public synchronized XPathSchemaContext getContext() {
        if (schemaRoot == null)
            schemaRoot = (DocumentNode) NodeTrees.getNodeTree(model, null, uri, false);
        return new XPathSchemaContext(schemaRoot);
    }

    /**
     * Type of a global element declaration, by name in <code>{uri}local</code> or <code>local</code> notation.
     */
    public XSTypeDefinition getElementType(String name) {
        final String[] parts = splitName(name);
        final XSElementDeclaration declaration = model.getElementDeclaration(parts[1], parts[0]);
        return declaration == null ? null : declaration.getTypeDefinition();
    }

    public XSTypeDefinition getAttributeType(String name) {
        final String[] parts = splitName(name);
        final XSAttributeDeclaration declaration = model.getAttributeDeclaration(parts[1], parts[0]);
        return declaration == null ? null : declaration.getTypeDefinition();
    }

    /**
     * Named type, including the built-in types of the XML Schema namespace.
     */
    public XSTypeDefinition getType(String name) {
        final String[] parts = splitName(name);
        return model.getTypeDefinition(parts[1], parts[0]);
    }

    /**
     * Sample value of a named type, as used for the static evaluation of variables.
     */
    public Object getSampleValue(String typeName) {
        return SchemaTypes.sampleValue(getType(typeName));
    }

    private static String[] splitName(String name) {
        if (name.startsWith("{")) {
            final int end = name.indexOf('}');
            if (end < 0)
                throw new XPathValueException(ErrorCode.FORG0001, "invalid expanded name " + name, null);
            final String namespace = name.substring(1, end);
            return new String[] { namespace.length() == 0 ? null : namespace, name.substring(end + 1) };
        }
        return new String[] { null, name };
    }
}
