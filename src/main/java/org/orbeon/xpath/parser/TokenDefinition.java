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
package org.orbeon.xpath.parser;

import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.function.Function;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Entry of a symbol table: the symbol, its binding powers, its label and the token class built for it. Function
 * entries also carry the function and its arity, axis entries their direction.
 */
public class TokenDefinition {

    public static final String LABEL_OPERATOR = "operator";
    public static final String LABEL_KEYWORD = "keyword";
    public static final String LABEL_FUNCTION = "function";
    public static final String LABEL_AXIS = "axis";
    public static final String LABEL_KIND_TEST = "kind test";
    public static final String LABEL_LITERAL = "literal";
    public static final String LABEL_NAME = "name";
    public static final String LABEL_SEPARATOR = "separator";

    private final String symbol;
    private final int lbp;
    private final int rbp;
    private final String label;
    private final Class<? extends XPathToken> tokenClass;
    private final Constructor<? extends XPathToken> constructor;

    private final Function function;
    private final int minArguments;
    private final int maxArguments;
    private final boolean reverseAxis;

    public TokenDefinition(String symbol, int lbp, int rbp, String label, Class<? extends XPathToken> tokenClass) {
        this(symbol, lbp, rbp, label, tokenClass, null, 0, 0, false);
    }

    public TokenDefinition(String symbol, int lbp, int rbp, String label, Class<? extends XPathToken> tokenClass,
                           Function function, int minArguments, int maxArguments, boolean reverseAxis) {
        if (symbol == null || symbol.trim().length() == 0)
            throw new XPathValueException(ErrorCode.FORG0001, "a symbol cannot be blank", null);
        this.symbol = symbol;
        this.lbp = lbp;
        this.rbp = rbp;
        this.label = label;
        this.tokenClass = tokenClass;
        this.function = function;
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
        this.reverseAxis = reverseAxis;
        try {
            this.constructor = tokenClass.getConstructor(XPathParser.class, TokenDefinition.class, Object.class);
        } catch (NoSuchMethodException e) {
            throw new XPathValueException(ErrorCode.FORG0001, "token class " + tokenClass.getName()
                    + " has no (XPathParser, TokenDefinition, Object) constructor", null);
        }
    }

    /**
     * Same definition under another symbol.
     */
    public TokenDefinition withSymbol(String newSymbol) {
        return new TokenDefinition(newSymbol, lbp, rbp, label, tokenClass, function, minArguments, maxArguments, reverseAxis);
    }

    public XPathToken createToken(XPathParser parser, Object value) {
        try {
            return constructor.newInstance(parser, this, value);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof XPathException)
                throw (XPathException) e.getCause();
            throw new IllegalStateException("Cannot create token for symbol '" + symbol + "'", e.getCause());
        } catch (InstantiationException e) {
            throw new IllegalStateException("Cannot create token for symbol '" + symbol + "'", e);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot create token for symbol '" + symbol + "'", e);
        }
    }

    public String getSymbol() {
        return symbol;
    }

    public int getLbp() {
        return lbp;
    }

    public int getRbp() {
        return rbp;
    }

    public String getLabel() {
        return label;
    }

    public Class<? extends XPathToken> getTokenClass() {
        return tokenClass;
    }

    public Function getFunction() {
        return function;
    }

    public int getMinArguments() {
        return minArguments;
    }

    /**
     * Maximum number of arguments, -1 for no limit.
     */
    public int getMaxArguments() {
        return maxArguments;
    }

    public boolean isReverseAxis() {
        return reverseAxis;
    }

    @Override
    public String toString() {
        return "'" + symbol + "' " + label;
    }
}
