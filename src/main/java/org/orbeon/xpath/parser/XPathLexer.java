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

import org.orbeon.xpath.common.XPathSyntaxException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Splits an expression into lexemes. Which punctuation is a symbol is decided by the symbol table of the grammar,
 * longest match first. Telling names, operators, functions and axes apart is left to the parser.
 */
public class XPathLexer {

    public enum Kind { STRING, INTEGER, DECIMAL, DOUBLE, NAME, SYMBOL, END }

    public static class Lexeme {
        public final Kind kind;
        public final String text;
        public final Object value;
        public final int position;
        public final boolean spaced;

        public Lexeme(Kind kind, String text, Object value, int position, boolean spaced) {
            this.kind = kind;
            this.text = text;
            this.value = value;
            this.position = position;
            this.spaced = spaced;
        }

        @Override
        public String toString() {
            return kind + "(" + text + ")@" + position;
        }
    }

    private final String xpath;
    private final SymbolTable symbolTable;
    private final boolean xpath2;

    private int currentPosition;
    private final int endPosition;

    public XPathLexer(String xpath, SymbolTable symbolTable, boolean xpath2) {
        this.xpath = xpath;
        this.symbolTable = symbolTable;
        this.xpath2 = xpath2;
        this.currentPosition = 0;
        this.endPosition = xpath.length();
    }

    public String getXPath() {
        return xpath;
    }

    public Lexeme nextLexeme() {
        final boolean spaced = whitespace();
        if (!hasMoreChars())
            return new Lexeme(Kind.END, "(end)", null, currentPosition, spaced);

        switch (LA(1)) {
            case '"':
            case '\'':
                return literal(spaced);
            case '0': case '1': case '2': case '3': case '4':
            case '5': case '6': case '7': case '8': case '9':
                return number(spaced);
            case '.':
                if (isDigit(LA(2)))
                    return number(spaced);
                return symbol(spaced);
            case '{':
                return bracedUri(spaced, 1);
            default:
                if (LA(1) == 'Q' && LA(2) == '{' && symbolTable.contains("Q{"))
                    return bracedUri(spaced, 2);
                if (isIdentifierStartChar(LA(1)))
                    return identifier(spaced);
                return symbol(spaced);
        }
    }

    /**
     * Whether the text following the current position, after whitespace, starts with the given string.
     */
    public boolean lookingAt(String text) {
        final int saved = currentPosition;
        try {
            whitespace();
            return xpath.startsWith(text, currentPosition);
        } finally {
            currentPosition = saved;
        }
    }

    private boolean whitespace() {
        boolean found = false;
        while (hasMoreChars()) {
            switch (LA(1)) {
                case ' ':
                case '\t':
                case '\n':
                case '\r':
                    consume();
                    found = true;
                    break;
                case '(':
                    if (xpath2 && LA(2) == ':') {
                        comment();
                        found = true;
                        break;
                    }
                    return found;
                default:
                    return found;
            }
        }
        return found;
    }

    // Comments nest
    private void comment() {
        final int start = currentPosition;
        int depth = 0;
        while (hasMoreChars()) {
            if (LA(1) == '(' && LA(2) == ':') {
                depth++;
                consume(2);
            } else if (LA(1) == ':' && LA(2) == ')') {
                depth--;
                consume(2);
                if (depth == 0)
                    return;
            } else {
                consume();
            }
        }
        throw new XPathSyntaxException("unterminated comment", xpath, start);
    }

    private Lexeme literal(boolean spaced) {
        final char match = LA(1);
        final int start = currentPosition;
        consume();
        final StringBuilder sb = new StringBuilder();
        while (hasMoreChars()) {
            final char c = LA(1);
            consume();
            if (c == match) {
                // Doubled delimiters stand for one delimiter in XPath 2
                if (xpath2 && LA(1) == match) {
                    sb.append(c);
                    consume();
                } else {
                    return new Lexeme(Kind.STRING, xpath.substring(start, currentPosition), sb.toString(), start, spaced);
                }
            } else {
                sb.append(c);
            }
        }
        throw new XPathSyntaxException("unterminated string literal", xpath, start);
    }

    private Lexeme number(boolean spaced) {
        final int start = currentPosition;
        boolean periodAllowed = true;
        Kind kind = Kind.INTEGER;
        while (hasMoreChars()) {
            final char c = LA(1);
            if (c == '.' && periodAllowed) {
                periodAllowed = false;
                kind = Kind.DECIMAL;
                consume();
            } else if (isDigit(c)) {
                consume();
            } else {
                break;
            }
        }
        if (xpath2 && (LA(1) == 'e' || LA(1) == 'E')
                && (isDigit(LA(2)) || ((LA(2) == '+' || LA(2) == '-') && isDigit(LA(3))))) {
            consume(2);
            while (isDigit(LA(1)))
                consume();
            kind = Kind.DOUBLE;
        }
        if (hasMoreChars() && isIdentifierStartChar(LA(1)) && xpath2)
            throw new XPathSyntaxException("invalid numeric literal", xpath, start);

        final String text = xpath.substring(start, currentPosition);
        final Object value;
        switch (kind) {
            case INTEGER:
                value = new BigInteger(text);
                break;
            case DECIMAL:
                value = new BigDecimal(text);
                break;
            default:
                value = Double.valueOf(text);
                break;
        }
        return new Lexeme(kind, text, value, start, spaced);
    }

    private Lexeme identifier(boolean spaced) {
        final int start = currentPosition;
        while (hasMoreChars() && isIdentifierChar(LA(1)))
            consume();
        final String text = xpath.substring(start, currentPosition);
        return new Lexeme(Kind.NAME, text, text, start, spaced);
    }

    /**
     * <code>{uri}</code> or <code>Q{uri}</code>: the whole braced part is one lexeme, whose value is the URI.
     */
    private Lexeme bracedUri(boolean spaced, int prefixLength) {
        final int start = currentPosition;
        final String text = xpath.substring(start, start + prefixLength);
        final int close = xpath.indexOf('}', start + prefixLength);
        if (close < 0)
            throw new XPathSyntaxException("unterminated braced URI", xpath, start);
        final String uri = xpath.substring(start + prefixLength, close).trim();
        if (uri.indexOf('{') >= 0)
            throw new XPathSyntaxException("invalid braced URI", xpath, start);
        currentPosition = close + 1;
        return new Lexeme(Kind.SYMBOL, text, uri, start, spaced);
    }

    private Lexeme symbol(boolean spaced) {
        final int start = currentPosition;
        for (int length = 2; length >= 1; length--) {
            if (start + length <= endPosition) {
                final String candidate = xpath.substring(start, start + length);
                if (symbolTable.contains(candidate)) {
                    consume(length);
                    return new Lexeme(Kind.SYMBOL, candidate, null, start, spaced);
                }
            }
        }
        throw new XPathSyntaxException("unknown symbol '" + LA(1) + "'", xpath, start);
    }

    private char LA(int i) {
        final int index = currentPosition + i - 1;
        return index < endPosition ? xpath.charAt(index) : (char) -1;
    }

    private void consume() {
        ++currentPosition;
    }

    private void consume(int number) {
        currentPosition += number;
    }

    private boolean hasMoreChars() {
        return currentPosition < endPosition;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStartChar(char c) {
        return c == '_' || (c != (char) -1 && Character.isLetter(c));
    }

    private static boolean isIdentifierChar(char c) {
        if (c == (char) -1)
            return false;
        if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '·')
            return true;
        final int type = Character.getType(c);
        return type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }
}
