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
import org.orbeon.xpath.common.XPathValueException;
import org.orbeon.xpath.expr.AxisToken;
import org.orbeon.xpath.expr.FunctionToken;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.function.Function;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps the symbols of a grammar to their token definitions.
 *
 * A grammar version starts from a copy of the table of the version it extends, then registers, unregisters and
 * duplicates symbols. Tables are filled when parser classes are initialized and sealed afterwards.
 */
public class SymbolTable {

    /**
     * Names which can be followed by a parenthesis without being function calls.
     */
    public static final Set<String> RESERVED_FUNCTION_NAMES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "attribute", "comment", "document-node", "element", "empty-sequence", "if", "item", "namespace-node",
            "node", "processing-instruction", "schema-attribute", "schema-element", "text", "typeswitch")));

    private final Map<String, TokenDefinition> definitions;
    private boolean sealed;

    public SymbolTable() {
        this.definitions = new LinkedHashMap<String, TokenDefinition>();
    }

    public SymbolTable(SymbolTable base) {
        this.definitions = new LinkedHashMap<String, TokenDefinition>(base.definitions);
    }

    /**
     * Unsealed copy of this table.
     */
    public SymbolTable copy() {
        return new SymbolTable(this);
    }

    /**
     * Insert or replace the definition of a symbol.
     */
    public TokenDefinition register(String symbol, int lbp, int rbp, String label, Class<? extends XPathToken> tokenClass) {
        return put(new TokenDefinition(symbol, lbp, rbp, label, tokenClass));
    }

    public TokenDefinition registerFunction(String name, int minArguments, int maxArguments, Function function) {
        if (RESERVED_FUNCTION_NAMES.contains(name))
            throw new XPathValueException(ErrorCode.FORG0001, "'" + name + "' is a reserved function name", null);
        if (maxArguments >= 0 && maxArguments < minArguments)
            throw new XPathValueException(ErrorCode.FORG0001, "invalid arity for function '" + name + "'", null);
        return put(new TokenDefinition(name, 0, 90, TokenDefinition.LABEL_FUNCTION, FunctionToken.class, function,
                minArguments, maxArguments, false));
    }

    public TokenDefinition registerAxis(String name, boolean reverse) {
        return registerAxis(name, reverse, AxisToken.class);
    }

    public TokenDefinition registerAxis(String name, boolean reverse, Class<? extends AxisToken> tokenClass) {
        return put(new TokenDefinition(name, 0, 80, TokenDefinition.LABEL_AXIS, tokenClass, null, 0, 0, reverse));
    }

    public TokenDefinition registerKindTest(String name, Class<? extends XPathToken> tokenClass) {
        return put(new TokenDefinition(name, 0, 90, TokenDefinition.LABEL_KIND_TEST, tokenClass));
    }

    /**
     * Remove the definition of a symbol, before a new grammar version gives it another one.
     */
    public void unregister(String symbol) {
        checkModifiable();
        if (definitions.remove(symbol) == null)
            throw new XPathValueException(ErrorCode.FORG0001, "symbol '" + symbol + "' is not registered", null);
    }

    /**
     * Register an existing definition under another symbol.
     */
    public TokenDefinition duplicate(String symbol, String newSymbol) {
        final TokenDefinition definition = definitions.get(symbol);
        if (definition == null)
            throw new XPathValueException(ErrorCode.FORG0001, "symbol '" + symbol + "' is not registered", null);
        return put(definition.withSymbol(newSymbol));
    }

    public TokenDefinition get(String symbol) {
        return definitions.get(symbol);
    }

    public boolean contains(String symbol) {
        return definitions.containsKey(symbol);
    }

    public Set<String> getSymbols() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private TokenDefinition put(TokenDefinition definition) {
        checkModifiable();
        definitions.put(definition.getSymbol(), definition);
        return definition;
    }

    private void checkModifiable() {
        if (sealed)
            throw new XPathValueException(ErrorCode.FORG0001, "symbol table is sealed", null);
    }
}
