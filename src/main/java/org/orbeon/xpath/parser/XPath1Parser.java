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

import org.orbeon.xpath.expr.ArithmeticToken;
import org.orbeon.xpath.expr.AttributeToken;
import org.orbeon.xpath.expr.BracedNameToken;
import org.orbeon.xpath.expr.ComparisonToken;
import org.orbeon.xpath.expr.ContextItemToken;
import org.orbeon.xpath.expr.DescendantPathToken;
import org.orbeon.xpath.expr.EndToken;
import org.orbeon.xpath.expr.KindTestToken;
import org.orbeon.xpath.expr.LiteralToken;
import org.orbeon.xpath.expr.LogicalToken;
import org.orbeon.xpath.expr.NameToken;
import org.orbeon.xpath.expr.ParentToken;
import org.orbeon.xpath.expr.ParenthesizedToken;
import org.orbeon.xpath.expr.PathToken;
import org.orbeon.xpath.expr.PredicateToken;
import org.orbeon.xpath.expr.PrefixedNameToken;
import org.orbeon.xpath.expr.SeparatorToken;
import org.orbeon.xpath.expr.UnionToken;
import org.orbeon.xpath.expr.VariableToken;
import org.orbeon.xpath.expr.WildcardToken;
import org.orbeon.xpath.function.BooleanFunction;
import org.orbeon.xpath.function.CeilingFunction;
import org.orbeon.xpath.function.ConcatFunction;
import org.orbeon.xpath.function.ContainsFunction;
import org.orbeon.xpath.function.CountFunction;
import org.orbeon.xpath.function.FalseFunction;
import org.orbeon.xpath.function.FloorFunction;
import org.orbeon.xpath.function.IdFunction;
import org.orbeon.xpath.function.LangFunction;
import org.orbeon.xpath.function.LastFunction;
import org.orbeon.xpath.function.LocalNameFunction;
import org.orbeon.xpath.function.NameFunction;
import org.orbeon.xpath.function.NamespaceUriFunction;
import org.orbeon.xpath.function.NormalizeSpaceFunction;
import org.orbeon.xpath.function.NotFunction;
import org.orbeon.xpath.function.NumberFunction;
import org.orbeon.xpath.function.PositionFunction;
import org.orbeon.xpath.function.RoundFunction;
import org.orbeon.xpath.function.StartsWithFunction;
import org.orbeon.xpath.function.StringFunction;
import org.orbeon.xpath.function.StringLengthFunction;
import org.orbeon.xpath.function.SubstringAfterFunction;
import org.orbeon.xpath.function.SubstringBeforeFunction;
import org.orbeon.xpath.function.SubstringFunction;
import org.orbeon.xpath.function.SumFunction;
import org.orbeon.xpath.function.TranslateFunction;
import org.orbeon.xpath.function.TrueFunction;

import java.util.Map;

/**
 * XPath 1.0 parser. Expressions are evaluated in compatibility mode. Names may also be written <code>{uri}name</code>
 * unless the parser is strict.
 */
public class XPath1Parser extends XPathParser {

    public static final String VERSION = "1.0";

    static final SymbolTable SYMBOL_TABLE = new SymbolTable();

    static {
        final SymbolTable table = SYMBOL_TABLE;

        // Markers and literals
        table.register("(end)", 0, 0, TokenDefinition.LABEL_SEPARATOR, EndToken.class);
        table.register("(string)", 0, 0, TokenDefinition.LABEL_LITERAL, LiteralToken.class);
        table.register("(integer)", 0, 0, TokenDefinition.LABEL_LITERAL, LiteralToken.class);
        table.register("(decimal)", 0, 0, TokenDefinition.LABEL_LITERAL, LiteralToken.class);
        table.register("(double)", 0, 0, TokenDefinition.LABEL_LITERAL, LiteralToken.class);
        table.register("(name)", 0, 0, TokenDefinition.LABEL_NAME, NameToken.class);

        for (String symbol : new String[] { ")", "]", "::", "," })
            table.register(symbol, 0, 0, TokenDefinition.LABEL_SEPARATOR, SeparatorToken.class);

        // Operators
        table.register("or", 20, 20, TokenDefinition.LABEL_OPERATOR, LogicalToken.class);
        table.register("and", 25, 25, TokenDefinition.LABEL_OPERATOR, LogicalToken.class);
        for (String symbol : new String[] { "=", "!=", "<", "<=", ">", ">=" })
            table.register(symbol, 30, 30, TokenDefinition.LABEL_OPERATOR, ComparisonToken.class);
        table.register("+", 40, 40, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);
        table.register("-", 40, 40, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);
        table.register("*", 45, 45, TokenDefinition.LABEL_OPERATOR, WildcardToken.class);
        table.register("div", 45, 45, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);
        table.register("mod", 45, 45, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);
        table.register("|", 50, 50, TokenDefinition.LABEL_OPERATOR, UnionToken.class);
        table.register("/", 75, 75, TokenDefinition.LABEL_OPERATOR, PathToken.class);
        table.register("//", 75, 75, TokenDefinition.LABEL_OPERATOR, DescendantPathToken.class);
        table.register("[", 80, 0, TokenDefinition.LABEL_OPERATOR, PredicateToken.class);
        table.register("@", 80, 80, TokenDefinition.LABEL_OPERATOR, AttributeToken.class);
        table.register("$", 90, 90, TokenDefinition.LABEL_OPERATOR, VariableToken.class);
        table.register(":", 95, 95, TokenDefinition.LABEL_OPERATOR, PrefixedNameToken.class);
        table.register("{", 0, 0, TokenDefinition.LABEL_OPERATOR, BracedNameToken.class);
        table.register("(", 0, 0, TokenDefinition.LABEL_OPERATOR, ParenthesizedToken.class);
        table.register(".", 0, 0, TokenDefinition.LABEL_OPERATOR, ContextItemToken.class);
        table.register("..", 0, 0, TokenDefinition.LABEL_OPERATOR, ParentToken.class);

        // Axes
        table.registerAxis("self", false);
        table.registerAxis("child", false);
        table.registerAxis("parent", true);
        table.registerAxis("attribute", false);
        table.registerAxis("namespace", false);
        table.registerAxis("following-sibling", false);
        table.registerAxis("preceding-sibling", true);
        table.registerAxis("following", false);
        table.registerAxis("preceding", true);
        table.registerAxis("ancestor", true);
        table.registerAxis("ancestor-or-self", true);
        table.registerAxis("descendant", false);
        table.registerAxis("descendant-or-self", false);

        // Node type tests
        table.registerKindTest("node", KindTestToken.class);
        table.registerKindTest("text", KindTestToken.class);
        table.registerKindTest("comment", KindTestToken.class);
        table.registerKindTest("processing-instruction", KindTestToken.class);

        // Node set functions
        table.registerFunction("last", 0, 0, new LastFunction());
        table.registerFunction("position", 0, 0, new PositionFunction());
        table.registerFunction("count", 1, 1, new CountFunction());
        table.registerFunction("id", 1, 1, new IdFunction());
        table.registerFunction("local-name", 0, 1, new LocalNameFunction());
        table.registerFunction("namespace-uri", 0, 1, new NamespaceUriFunction());
        table.registerFunction("name", 0, 1, new NameFunction());

        // String functions
        table.registerFunction("string", 0, 1, new StringFunction());
        table.registerFunction("concat", 2, -1, new ConcatFunction());
        table.registerFunction("starts-with", 2, 2, new StartsWithFunction());
        table.registerFunction("contains", 2, 2, new ContainsFunction());
        table.registerFunction("substring-before", 2, 2, new SubstringBeforeFunction());
        table.registerFunction("substring-after", 2, 2, new SubstringAfterFunction());
        table.registerFunction("substring", 2, 3, new SubstringFunction());
        table.registerFunction("string-length", 0, 1, new StringLengthFunction());
        table.registerFunction("normalize-space", 0, 1, new NormalizeSpaceFunction());
        table.registerFunction("translate", 3, 3, new TranslateFunction());

        // Boolean functions
        table.registerFunction("boolean", 1, 1, new BooleanFunction());
        table.registerFunction("not", 1, 1, new NotFunction());
        table.registerFunction("true", 0, 0, new TrueFunction());
        table.registerFunction("false", 0, 0, new FalseFunction());
        table.registerFunction("lang", 1, 1, new LangFunction());

        // Number functions
        table.registerFunction("number", 0, 1, new NumberFunction());
        table.registerFunction("sum", 1, 1, new SumFunction());
        table.registerFunction("floor", 1, 1, new FloorFunction());
        table.registerFunction("ceiling", 1, 1, new CeilingFunction());
        table.registerFunction("round", 1, 1, new RoundFunction());

        table.seal();
    }

    public XPath1Parser() {
        this(null);
    }

    public XPath1Parser(Map<String, String> namespaces) {
        super(namespaces);
        setCompatibilityMode(true);
    }

    @Override
    public SymbolTable getSymbolTable() {
        return SYMBOL_TABLE;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }
}
