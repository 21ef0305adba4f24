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
package org.orbeon.xpath;

import org.apache.commons.collections.Transformer;
import org.apache.commons.collections.iterators.TransformIterator;
import org.apache.log4j.Logger;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.XPath1Parser;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.properties.EngineProperties;
import org.orbeon.xpath.util.IndentedLogger;
import org.orbeon.xpath.util.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A compiled XPath expression.
 *
 * The expression is parsed once, then evaluated against any number of roots: dom4j documents or elements, Xerces
 * schema models, or nodes of an existing node tree. Results returned by the <code>select</code> methods have their
 * nodes replaced by the native objects they wrap, so a dom4j document gives dom4j elements, attributes and so on.
 *
 * Instances are immutable and can be shared between threads. Each evaluation uses its own context.
 */
public class XPath {

    private static final Logger logger = LoggerFactory.createLogger(XPath.class);

    private static final Transformer NATIVE_TRANSFORMER = new Transformer() {
        public Object transform(Object item) {
            return toNative(item);
        }
    };

    private final String expression;
    private final XPathParser parser;
    private final XPathToken rootToken;
    private final boolean fragment;
    private final String defaultCollation;

    /**
     * Compile an expression with the parser version configured in the engine properties.
     */
    public XPath(String expression) {
        this(expression, EngineProperties.instance().createParser());
    }

    public XPath(String expression, XPathParser parser) {
        this.expression = expression;
        this.parser = parser;
        this.fragment = EngineProperties.instance().isFragment();
        this.defaultCollation = EngineProperties.instance().getDefaultCollation();

        final IndentedLogger indentedLogger = LoggerFactory.createIndentedLogger(logger, "xpath");
        if (indentedLogger.isDebugEnabled())
            indentedLogger.startHandleOperation("compile", "expression", "expression", expression,
                    "version", parser.getVersion());
        XPathToken token = null;
        try {
            synchronized (parser) {
                token = parser.parse(expression);
            }
        } finally {
            if (indentedLogger.isDebugEnabled())
                indentedLogger.endHandleOperation("tree", token != null ? token.getTree() : null);
        }
        this.rootToken = token;
    }

    /**
     * Select with an XPath 1.0 expression.
     */
    public static List<Object> select(Object root, String expression) {
        return select(root, expression, null);
    }

    public static List<Object> select(Object root, String expression, Map<String, String> namespaces) {
        return new XPath(expression, new XPath1Parser(namespaces)).selectNodes(root);
    }

    public String getExpression() {
        return expression;
    }

    public XPathParser getParser() {
        return parser;
    }

    public XPathToken getRootToken() {
        return rootToken;
    }

    /**
     * New context for the given root, with the default collation of the engine.
     */
    public XPathContext createContext(Object root, Map<String, Object> variables) {
        if (root instanceof XPathContext)
            return (XPathContext) root;
        final XPathContext context = new XPathContext(root, null, variables, null, null, fragment);
        if (defaultCollation != null)
            context.setDefaultCollation(defaultCollation);
        return context;
    }

    /**
     * Evaluate the expression. The result is an atomic value, a node, or a list of items.
     *
     * @param root  root of the evaluation, or an {@link XPathContext}, or null for expressions not using the focus
     */
    public Object evaluate(Object root) {
        return evaluate(root, null);
    }

    public Object evaluate(Object root, Map<String, Object> variables) {
        final XPathContext context = root == null && variables == null ? null : createContext(root, variables);
        final IndentedLogger indentedLogger = LoggerFactory.createIndentedLogger(logger, "xpath");
        if (indentedLogger.isDebugEnabled())
            indentedLogger.startHandleOperation("evaluate", "expression", "expression", expression);
        try {
            return rootToken.evaluate(context);
        } finally {
            if (indentedLogger.isDebugEnabled())
                indentedLogger.endHandleOperation();
        }
    }

    /**
     * All the items of the result, nodes being replaced by their native objects.
     */
    public List<Object> selectNodes(Object root) {
        return selectNodes(root, null);
    }

    public List<Object> selectNodes(Object root, Map<String, Object> variables) {
        final IndentedLogger indentedLogger = LoggerFactory.createIndentedLogger(logger, "xpath");
        if (indentedLogger.isDebugEnabled())
            indentedLogger.startHandleOperation("select", "expression", "expression", expression);
        final List<Object> result = new ArrayList<Object>();
        try {
            for (Iterator<Object> i = iterSelect(root, variables); i.hasNext();)
                result.add(i.next());
        } finally {
            if (indentedLogger.isDebugEnabled())
                indentedLogger.endHandleOperation("items", Integer.toString(result.size()));
        }
        return result;
    }

    /**
     * First item of the result, or null.
     */
    public Object selectSingleNode(Object root) {
        final Iterator<Object> i = iterSelect(root, null);
        return i.hasNext() ? i.next() : null;
    }

    /**
     * Lazy iteration over the result. Stopping early does not evaluate the rest of the expression.
     */
    @SuppressWarnings("unchecked")
    public Iterator<Object> iterSelect(Object root, Map<String, Object> variables) {
        final XPathContext context = root == null && variables == null ? null : createContext(root, variables);
        return new TransformIterator(rootToken.select(context), NATIVE_TRANSFORMER);
    }

    /**
     * String value of the first item of the result, or the empty string.
     */
    public String stringValueOf(Object root) {
        final Iterator<Object> i = selectItems(root);
        return i.hasNext() ? rootToken.stringValue(i.next()) : "";
    }

    /**
     * Number value of the first item of the result, NaN if the result is empty.
     */
    public double numberValueOf(Object root) {
        final Iterator<Object> i = selectItems(root);
        return i.hasNext() ? rootToken.numberValue(i.next()) : Double.NaN;
    }

    /**
     * Effective boolean value of the result.
     */
    public boolean booleanValueOf(Object root) {
        return rootToken.booleanValue(selectItems(root));
    }

    private Iterator<Object> selectItems(Object root) {
        return rootToken.select(root == null ? null : createContext(root, null));
    }

    private static Object toNative(Object item) {
        if (item instanceof XPathNode)
            return ((XPathNode) item).getNativeNode();
        return item;
    }

    @Override
    public String toString() {
        return expression;
    }
}
