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
 * Base class of all the errors raised while defining grammars, parsing expressions, building node trees and
 * evaluating expressions.
 */
public class XPathException extends RuntimeException {

    private final ErrorCode code;
    private final XPathToken token;
    private final String source;
    private final int position;
    private final String detail;

    public XPathException(ErrorCode code, String message, XPathToken token) {
        this(code, message, token, null);
    }

    public XPathException(ErrorCode code, String message, XPathToken token, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.token = token;
        this.detail = message;
        if (token != null) {
            this.source = token.getSource();
            this.position = token.getPosition();
        } else {
            this.source = null;
            this.position = -1;
        }
    }

    /**
     * Error located in a source text without a token, as the lexer reports it.
     */
    public XPathException(ErrorCode code, String message, String source, int position) {
        super(message);
        this.code = code;
        this.token = null;
        this.detail = message;
        this.source = source;
        this.position = position;
    }

    public ErrorCode getCode() {
        return code;
    }

    public XPathToken getToken() {
        return token;
    }

    public String getSource() {
        return source;
    }

    public int getPosition() {
        return position;
    }

    public String getDetail() {
        return detail;
    }

    public int getLine() {
        if (source == null || position < 0)
            return -1;
        int line = 1;
        for (int i = 0; i < position && i < source.length(); i++) {
            if (source.charAt(i) == '\n')
                line++;
        }
        return line;
    }

    public int getColumn() {
        if (source == null || position < 0)
            return -1;
        final int end = Math.min(position, source.length());
        final int lineStart = source.lastIndexOf('\n', end - 1) + 1;
        return end - lineStart + 1;
    }

    @Override
    public String getMessage() {
        final StringBuilder sb = new StringBuilder();
        if (token != null) {
            sb.append(token.toString());
            sb.append(' ');
        }
        if (getLine() > 0) {
            sb.append("at line ").append(getLine()).append(", column ").append(getColumn()).append(": ");
        } else if (token != null) {
            sb.append(": ");
        }
        sb.append('[').append(code.getQualifiedName()).append("] ");
        sb.append(detail);
        return sb.toString();
    }

    public Throwable getRootThrowable() {
        Throwable current = this;
        while (current.getCause() != null && current.getCause() != current)
            current = current.getCause();
        return current;
    }
}
