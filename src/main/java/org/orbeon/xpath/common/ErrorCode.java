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
 * Closed set of error codes raised by the engine. Each code belongs to a kind, which decides the exception class
 * used to report it.
 */
public enum ErrorCode {

    XPST0003(Kind.SYNTAX, "invalid XPath expression"),
    XPDY0002(Kind.MISSING_CONTEXT, "dynamic context required for evaluate"),
    XPTY0004(Kind.TYPE, "type is not appropriate for the context"),
    XPST0005(Kind.TYPE, "static type of the expression is the empty sequence"),
    XPST0008(Kind.NAME, "name not found"),
    XPST0010(Kind.NAME, "axis not supported"),
    XPST0017(Kind.TYPE, "wrong number of arguments or unknown function"),
    XPTY0018(Kind.TYPE, "path result mixes nodes and atomic values"),
    XPTY0019(Kind.TYPE, "intermediate step contains an atomic value"),
    XPTY0020(Kind.TYPE, "context item is not a node"),
    XPST0081(Kind.NAME, "unknown namespace prefix"),
    FOAR0001(Kind.ARITHMETIC, "division by zero"),
    FOAR0002(Kind.ARITHMETIC, "numeric operation overflow/underflow"),
    FOCA0002(Kind.VALUE, "invalid lexical value"),
    FOCH0002(Kind.VALUE, "unsupported collation"),
    FODC0002(Kind.VALUE, "error retrieving resource"),
    FORG0001(Kind.VALUE, "invalid value for cast/constructor"),
    FORG0006(Kind.TYPE, "invalid argument type"),
    FOTY0012(Kind.VALUE, "argument node does not have a typed value");

    public enum Kind { SYNTAX, MISSING_CONTEXT, TYPE, NAME, VALUE, ARITHMETIC }

    private final Kind kind;
    private final String description;

    ErrorCode(Kind kind, String description) {
        this.kind = kind;
        this.description = description;
    }

    public Kind getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    public String getQualifiedName() {
        return "err:" + name();
    }

    public XPathException createException(String message, XPathToken token) {
        final String text = (message != null) ? message : description;
        switch (kind) {
            case SYNTAX:
                return new XPathSyntaxException(this, text, token);
            case MISSING_CONTEXT:
                return new MissingContextException(this, text, token);
            case TYPE:
                return new XPathTypeException(this, text, token);
            case NAME:
                return new XPathNameException(this, text, token);
            case ARITHMETIC:
                return new XPathArithmeticException(this, text, token);
            default:
                return new XPathValueException(this, text, token);
        }
    }

    public XPathException createException(XPathToken token) {
        return createException(null, token);
    }
}
