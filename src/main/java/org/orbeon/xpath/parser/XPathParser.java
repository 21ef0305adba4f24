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
import org.orbeon.xpath.common.XPathNameException;
import org.orbeon.xpath.common.XPathSyntaxException;
import org.orbeon.xpath.common.XPathTypeException;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.schema.SchemaProxy;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Precedence climbing (Pratt) parser. Each grammar version is a subclass holding its own symbol table; the tokens
 * built from the table parse themselves through their <code>nud</code> and <code>led</code> methods, calling back
 * {@link #expression(int)} and {@link #advance(String...)}.
 *
 * A parser instance keeps state while parsing and must not be used by several threads at once. The token trees it
 * returns can be shared.
 */
public abstract class XPathParser {

    public static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";
    public static final String XSD_NAMESPACE = "http://www.w3.org/2001/XMLSchema";
    public static final String XPATH_FUNCTIONS_NAMESPACE = "http://www.w3.org/2005/xpath-functions";
    public static final String XQT_ERRORS_NAMESPACE = "http://www.w3.org/2005/xqt-errors";

    private static final Set<String> PATH_STEP_SYMBOLS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "(integer)", "(string)", "(decimal)", "(double)", "(name)", "*", "@", "..", ".", "(", "{", "Q{", "$")));

    private final Map<String, String> namespaces = new HashMap<String, String>();
    private String defaultNamespace;
    private boolean strict;
    private boolean compatibilityMode;
    private SchemaProxy schema;

    private String source;
    private XPathLexer lexer;
    private XPathToken token;
    private XPathToken nextToken;

    protected XPathParser(Map<String, String> namespaces) {
        this.namespaces.put("xml", XML_NAMESPACE);
        this.namespaces.put("xs", XSD_NAMESPACE);
        this.namespaces.put("fn", XPATH_FUNCTIONS_NAMESPACE);
        if (namespaces != null)
            this.namespaces.putAll(namespaces);
    }

    public abstract SymbolTable getSymbolTable();

    public abstract String getVersion();

    /**
     * Whether the lexer accepts XPath 2 lexical forms: comments, doubled quotes and exponents.
     */
    protected boolean isXPath2Lexing() {
        return false;
    }

    /**
     * Parse an expression and return the root of its token tree.
     */
    public XPathToken parse(String source) {
        this.source = source;
        this.lexer = new XPathLexer(source, getSymbolTable(), isXPath2Lexing());
        this.token = null;
        this.nextToken = null;
        try {
            advance();
            final XPathToken root = expression(0);
            if (!"(end)".equals(nextToken.getSymbol()))
                throw nextToken.wrongSyntax("unexpected " + nextToken);
            return root;
        } finally {
            this.lexer = null;
            this.token = null;
            this.nextToken = null;
        }
    }

    /**
     * Move to the next token, checking that it is one of the expected symbols if any are given.
     */
    public XPathToken advance(String... expected) {
        if (nextToken != null) {
            if ("(end)".equals(nextToken.getSymbol())) {
                if (token == null)
                    throw new XPathSyntaxException("source is empty", source, 0);
                throw token.wrongSyntax("unexpected end of source after " + token);
            } else if (expected.length > 0 && !Arrays.asList(expected).contains(nextToken.getSymbol())) {
                throw nextToken.wrongSyntax("unexpected " + nextToken + ", expected " + describe(expected));
            }
        }
        token = nextToken;
        nextToken = readToken();
        return token;
    }

    /**
     * Parse an expression whose operators bind more tightly than the given right binding power.
     */
    public XPathToken expression(int rbp) {
        XPathToken current = nextToken;
        advance();
        XPathToken left = current.nud();
        while (rbp < nextToken.getLbp()) {
            current = nextToken;
            advance();
            left = current.led(left);
        }
        return left;
    }

    /**
     * Consume a name, accepting keywords and operator names used as names, and return it.
     */
    public String advanceName() {
        if (!nextToken.isNameLike()) {
            if ("(end)".equals(nextToken.getSymbol()))
                advance();
            throw nextToken.wrongSyntax("unexpected " + nextToken + ", expected a name");
        }
        advance();
        return token.getNameValue();
    }

    /**
     * Whether the next token can start a relative path step.
     */
    public boolean isPathStep(XPathToken candidate) {
        final String label = candidate.getLabel();
        return PATH_STEP_SYMBOLS.contains(candidate.getSymbol()) || candidate.isNameLike()
                || TokenDefinition.LABEL_AXIS.equals(label) || TokenDefinition.LABEL_KIND_TEST.equals(label);
    }

    private XPathToken readToken() {
        final XPathLexer.Lexeme lexeme = lexer.nextLexeme();
        final SymbolTable symbolTable = getSymbolTable();
        final TokenDefinition definition;
        switch (lexeme.kind) {
            case END:
                definition = symbolTable.get("(end)");
                break;
            case STRING:
                definition = symbolTable.get("(string)");
                break;
            case INTEGER:
                definition = symbolTable.get("(integer)");
                break;
            case DECIMAL:
                definition = symbolTable.get("(decimal)");
                break;
            case DOUBLE:
                definition = symbolTable.get("(double)");
                break;
            case NAME:
                definition = resolveName(lexeme);
                break;
            default:
                definition = symbolTable.get(lexeme.text);
                if (definition == null)
                    throw new XPathSyntaxException("unknown symbol '" + lexeme.text + "'", source, lexeme.position);
                break;
        }
        final XPathToken result = definition.createToken(this, lexeme.value);
        result.setLocation(lexeme.position, lexeme.spaced);
        return result;
    }

    /**
     * A name is an axis when followed by <code>::</code>, a function or kind test when followed by a parenthesis,
     * a keyword or operator when registered as such, and a name otherwise.
     */
    private TokenDefinition resolveName(XPathLexer.Lexeme lexeme) {
        final SymbolTable symbolTable = getSymbolTable();
        final TokenDefinition definition = symbolTable.get(lexeme.text);
        if (lexer.lookingAt("::")) {
            if (definition == null || !TokenDefinition.LABEL_AXIS.equals(definition.getLabel()))
                throw new XPathNameException(ErrorCode.XPST0010, "unknown axis '" + lexeme.text + "'", source, lexeme.position);
            return definition;
        } else if (lexer.lookingAt("(") && !lexer.lookingAt("(:")) {
            if (definition == null)
                throw new XPathTypeException(ErrorCode.XPST0017, "unknown function '" + lexeme.text + "'", source, lexeme.position);
            return definition;
        } else if (definition != null && (TokenDefinition.LABEL_OPERATOR.equals(definition.getLabel())
                || TokenDefinition.LABEL_KEYWORD.equals(definition.getLabel()))) {
            return definition;
        }
        return symbolTable.get("(name)");
    }

    private static String describe(String[] symbols) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < symbols.length; i++) {
            if (i > 0)
                sb.append(i == symbols.length - 1 ? " or " : ", ");
            sb.append('\'').append(symbols[i]).append('\'');
        }
        return sb.toString();
    }

    public String getSource() {
        return source;
    }

    public XPathToken getToken() {
        return token;
    }

    public XPathToken getNextToken() {
        return nextToken;
    }

    public Map<String, String> getNamespaces() {
        return Collections.unmodifiableMap(namespaces);
    }

    public void setNamespace(String prefix, String uri) {
        namespaces.put(prefix, uri);
    }

    /**
     * URI bound to a prefix, null if the prefix is unknown.
     */
    public String getNamespaceUri(String prefix) {
        return namespaces.get(prefix);
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public void setDefaultNamespace(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public boolean isCompatibilityMode() {
        return compatibilityMode;
    }

    public void setCompatibilityMode(boolean compatibilityMode) {
        this.compatibilityMode = compatibilityMode;
    }

    public SchemaProxy getSchema() {
        return schema;
    }

    public void setSchema(SchemaProxy schema) {
        this.schema = schema;
    }
}
