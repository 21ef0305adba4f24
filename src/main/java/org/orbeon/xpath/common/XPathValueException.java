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
package org.orbeon.xpath.common;

import org.orbeon.xpath.expr.XPathToken;

/**
 * Invalid values, and errors found while defining a grammar.
 */
public class XPathValueException extends XPathException {

    public XPathValueException(ErrorCode code, String message, XPathToken token) {
        super(code, message, token);
    }

    public XPathValueException(ErrorCode code, String message, XPathToken token, Throwable cause) {
        super(code, message, token, cause);
    }
}
