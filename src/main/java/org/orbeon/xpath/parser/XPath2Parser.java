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

import org.apache.log4j.Logger;
import org.orbeon.xpath.context.XPathSchemaContext;
import org.orbeon.xpath.expr.ArithmeticToken;
import org.orbeon.xpath.expr.AttributeAxisOrTestToken;
import org.orbeon.xpath.expr.ForToken;
import org.orbeon.xpath.expr.IfToken;
import org.orbeon.xpath.expr.IntersectExceptToken;
import org.orbeon.xpath.expr.KeywordToken;
import org.orbeon.xpath.expr.KindTestToken;
import org.orbeon.xpath.expr.NodeComparisonToken;
import org.orbeon.xpath.expr.QuantifiedToken;
import org.orbeon.xpath.expr.RangeToken;
import org.orbeon.xpath.expr.SequenceParenthesizedToken;
import org.orbeon.xpath.expr.SequenceToken;
import org.orbeon.xpath.expr.ValueComparisonToken;
import org.orbeon.xpath.expr.VariableReferenceToken;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.function.CompareFunction;
import org.orbeon.xpath.function.ContainsFunction;
import org.orbeon.xpath.function.DataFunction;
import org.orbeon.xpath.function.DistinctValuesFunction;
import org.orbeon.xpath.function.DocAvailableFunction;
import org.orbeon.xpath.function.DocFunction;
import org.orbeon.xpath.function.EmptyFunction;
import org.orbeon.xpath.function.EnvironmentVariableFunction;
import org.orbeon.xpath.function.ExistsFunction;
import org.orbeon.xpath.function.ReverseFunction;
import org.orbeon.xpath.function.RootFunction;
import org.orbeon.xpath.function.StartsWithFunction;
import org.orbeon.xpath.function.StringJoinFunction;
import org.orbeon.xpath.function.SubsequenceFunction;
import org.orbeon.xpath.function.SubstringAfterFunction;
import org.orbeon.xpath.function.SubstringBeforeFunction;
import org.orbeon.xpath.function.SumFunction;
import org.orbeon.xpath.util.LoggerFactory;
import org.orbeon.xpath.value.UntypedAtomic;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Map;

/**
 * XPath 2.0 parser. The grammar extends the XPath 1.0 one; compatibility mode is off unless set.
 *
 * The parser is also the static context of the expressions it parses: variables declared with
 * {@link #setVariableType(String, String)} are the only ones an expression may reference, besides the ones it binds
 * itself with <code>for</code>, <code>some</code> and <code>every</code>. When no variable is declared, references are
 * checked at evaluation time only.
 */
public class XPath2Parser extends XPathParser {

    private static final Logger logger = LoggerFactory.createLogger(XPath2Parser.class);

    public static final String VERSION = "2.0";

    static final SymbolTable SYMBOL_TABLE = XPath1Parser.SYMBOL_TABLE.copy();

    static {
        final SymbolTable table = SYMBOL_TABLE;

        // Sequences
        table.unregister(",");
        table.register(",", 5, 5, TokenDefinition.LABEL_OPERATOR, SequenceToken.class);
        table.unregister("(");
        table.register("(", 0, 0, TokenDefinition.LABEL_OPERATOR, SequenceParenthesizedToken.class);
        table.register("to", 35, 35, TokenDefinition.LABEL_OPERATOR, RangeToken.class);

        // Operators
        table.register("idiv", 45, 45, TokenDefinition.LABEL_OPERATOR, ArithmeticToken.class);
        table.duplicate("|", "union");
        table.register("intersect", 55, 55, TokenDefinition.LABEL_OPERATOR, IntersectExceptToken.class);
        table.register("except", 55, 55, TokenDefinition.LABEL_OPERATOR, IntersectExceptToken.class);
        for (String symbol : new String[] { "eq", "ne", "lt", "le", "gt", "ge" })
            table.register(symbol, 30, 30, TokenDefinition.LABEL_OPERATOR, ValueComparisonToken.class);
        for (String symbol : new String[] { "is", "<<", ">>" })
            table.register(symbol, 30, 30, TokenDefinition.LABEL_OPERATOR, NodeComparisonToken.class);
        table.duplicate("{", "Q{");
        table.unregister("$");
        table.register("$", 90, 90, TokenDefinition.LABEL_OPERATOR, VariableReferenceToken.class);

        // Conditional, for and quantified expressions
        table.register("if", 0, 20, TokenDefinition.LABEL_KEYWORD, IfToken.class);
        table.register("for", 0, 20, TokenDefinition.LABEL_KEYWORD, ForToken.class);
        table.register("some", 0, 20, TokenDefinition.LABEL_KEYWORD, QuantifiedToken.class);
        table.register("every", 0, 20, TokenDefinition.LABEL_KEYWORD, QuantifiedToken.class);
        for (String symbol : new String[] { "then", "else", "in", "return", "satisfies" })
            table.register(symbol, 0, 0, TokenDefinition.LABEL_KEYWORD, KeywordToken.class);

        // Kind tests
        table.unregister("attribute");
        table.registerAxis("attribute", false, AttributeAxisOrTestToken.class);
        table.registerKindTest("element", KindTestToken.class);
        table.registerKindTest("document-node", KindTestToken.class);

        // String functions with an optional collation
        table.registerFunction("contains", 2, 3, new ContainsFunction());
        table.registerFunction("starts-with", 2, 3, new StartsWithFunction());
        table.registerFunction("substring-before", 2, 3, new SubstringBeforeFunction());
        table.registerFunction("substring-after", 2, 3, new SubstringAfterFunction());
        table.registerFunction("compare", 2, 3, new CompareFunction());
        table.registerFunction("string-join", 2, 2, new StringJoinFunction());

        // Sequence functions
        table.registerFunction("sum", 1, 2, new SumFunction());
        table.registerFunction("empty", 1, 1, new EmptyFunction());
        table.registerFunction("exists", 1, 1, new ExistsFunction());
        table.registerFunction("data", 1, 1, new DataFunction());
        table.registerFunction("reverse", 1, 1, new ReverseFunction());
        table.registerFunction("subsequence", 2, 3, new SubsequenceFunction());
        table.registerFunction("distinct-values", 1, 2, new DistinctValuesFunction());
        table.registerFunction("root", 0, 1, new RootFunction());

        // Documents and environment
        table.registerFunction("doc", 1, 1, new DocFunction());
        table.registerFunction("doc-available", 1, 1, new DocAvailableFunction());
        table.registerFunction("environment-variable", 1, 1, new EnvironmentVariableFunction());

        table.seal();
    }

    private final Map<String, String> variableTypes = new HashMap<String, String>();
    private final LinkedList<String> rangeVariables = new LinkedList<String>();

    public XPath2Parser() {
        this(null);
    }

    public XPath2Parser(Map<String, String> namespaces) {
        super(namespaces);
        setNamespace("err", XQT_ERRORS_NAMESPACE);
    }

    @Override
    public SymbolTable getSymbolTable() {
        return SYMBOL_TABLE;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    protected boolean isXPath2Lexing() {
        return true;
    }

    /**
     * Parse an expression. With a schema, the expression is also evaluated once against the schema context, so that
     * type errors are found before any instance document is seen.
     */
    @Override
    public XPathToken parse(String source) {
        rangeVariables.clear();
        final XPathToken root = super.parse(source);
        if (getSchema() != null) {
            if (logger.isDebugEnabled())
                logger.debug("Checking expression against schema: " + source);
            final XPathSchemaContext context = getSchema().getContext();
            for (Map.Entry<String, String> entry : variableTypes.entrySet())
                context.setVariable(entry.getKey(), getSampleValue(entry.getValue()));
            for (Iterator<Object> i = root.select(context); i.hasNext();)
                i.next();
        }
        return root;
    }

    /**
     * Representative value of a sequence type: a sample of the atomic type when the type is a QName, an empty
     * untyped value otherwise.
     */
    private Object getSampleValue(String sequenceType) {
        String type = sequenceType.trim();
        if (type.endsWith("?") || type.endsWith("*") || type.endsWith("+"))
            type = type.substring(0, type.length() - 1);
        final int colon = type.indexOf(':');
        if (colon > 0 && type.indexOf('(') < 0) {
            final String uri = getNamespaceUri(type.substring(0, colon));
            if (uri != null)
                return getSchema().getSampleValue("{" + uri + "}" + type.substring(colon + 1));
        }
        return new UntypedAtomic("");
    }

    /**
     * Declare an in-scope variable with its sequence type, for instance <code>xs:string</code> or <code>node()*</code>.
     */
    public void setVariableType(String name, String sequenceType) {
        variableTypes.put(name, sequenceType);
    }

    public String getVariableType(String name) {
        return variableTypes.get(name);
    }

    public Map<String, String> getVariableTypes() {
        return Collections.unmodifiableMap(variableTypes);
    }

    public boolean isVariableInScope(String name) {
        return variableTypes.isEmpty() || variableTypes.containsKey(name) || rangeVariables.contains(name);
    }

    public void bindRangeVariable(String name) {
        rangeVariables.addFirst(name);
    }

    public void unbindRangeVariable(String name) {
        rangeVariables.remove(name);
    }
}
