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
package org.orbeon.xpath.function;

import org.apache.log4j.Logger;
import org.dom4j.Document;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.FunctionToken;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.tree.NodeTrees;
import org.orbeon.xpath.util.Dom4jUtils;
import org.orbeon.xpath.util.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * <code>doc(uri)</code>: document node of the XML document at the URI. Documents are cached in the context, so
 * that the same URI always gives the same node. Against a schema, the result is the empty sequence.
 */
public class DocFunction implements Function {

    private static final Logger logger = LoggerFactory.createLogger(DocFunction.class);

    public Object call(FunctionToken token, XPathContext context) {
        if (context != null && context.isSchema())
            return Collections.emptyList();
        final Object argument = token.getAtomicArgument(context, 0);
        if (argument == null)
            return Collections.emptyList();
        return load(token, context, token.stringValue(argument));
    }

    public static XPathNode load(FunctionToken token, XPathContext context, String uri) {
        final Map<String, XPathNode> documents = context != null ? context.getDocuments() : null;
        if (documents != null && documents.containsKey(uri))
            return documents.get(uri);

        if (logger.isDebugEnabled())
            logger.debug("Loading document " + uri);
        final Document document;
        try {
            document = Dom4jUtils.readDom4j(Dom4jUtils.toURL(uri));
        } catch (XPathException e) {
            throw ErrorCode.FODC0002.createException("cannot retrieve document " + uri + ": " + e.getDetail(), token);
        }
        final XPathNode result = NodeTrees.getDocumentTree(document, uri);
        if (documents != null)
            documents.put(uri, result);
        return result;
    }
}
