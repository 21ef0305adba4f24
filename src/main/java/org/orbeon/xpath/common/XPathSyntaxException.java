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
 * Indicates an error while parsing an expression. Parsing stops at the first error and no token tree is returned.
 */
public class XPathSyntaxException extends XPathException {

    private static final String lineSeparator = System.getProperty("line.separator");

    public XPathSyntaxException(ErrorCode code, String message, XPathToken token) {
        super(code, message, token);
    }

    public XPathSyntaxException(String message, String source, int position) {
        super(ErrorCode.XPST0003, message, source, position);
    }

    /**
     * Returns a string in the form <code>"   ^"</code> which, when placed on the line below the expression,
     * shows the column at which the error occurred.
     */
    public String getPositionMarker() {
        final int column = Math.max(getColumn(), 1);
        final StringBuilder sb = new StringBuilder();
        for (int i = 1; i < column; i++)
            sb.append(' ');
        sb.append('^');
        return sb.toString();
    }

    /**
     * Returns a long description of the error: the message, the expression line and the position marker.
     */
    public String getMultilineMessage() {
        final StringBuilder sb = new StringBuilder(getMessage());
        final String source = getSource();
        if (source != null) {
            final int line = Math.max(getLine(), 1);
            final String[] lines = source.split("\n", -1);
            sb.append(lineSeparator);
            sb.append(lines[Math.min(line, lines.length) - 1]);
            sb.append(lineSeparator);
            sb.append(getPositionMarker());
        }
        return sb.toString();
    }
}
