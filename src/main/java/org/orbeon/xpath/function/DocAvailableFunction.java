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
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.FunctionToken;
import org.orbeon.xpath.util.LoggerFactory;

public class DocAvailableFunction implements Function {

    private static final Logger logger = LoggerFactory.createLogger(DocAvailableFunction.class);

    public Object call(FunctionToken token, XPathContext context) {
        if (context != null && context.isSchema())
            return Boolean.FALSE;
        final Object argument = token.getAtomicArgument(context, 0);
        if (argument == null)
            return Boolean.FALSE;
        try {
            DocFunction.load(token, context, token.stringValue(argument));
            return Boolean.TRUE;
        } catch (XPathException e) {
            if (e.getCode() != ErrorCode.FODC0002)
                throw e;
            if (logger.isDebugEnabled())
                logger.debug("Document not available: " + e.getDetail());
            return Boolean.FALSE;
        }
    }
}
