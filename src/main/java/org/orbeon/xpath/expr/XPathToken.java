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
package org.orbeon.xpath.expr;

import org.apache.commons.collections.IteratorUtils;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.value.UntypedAtomic;
import org.orbeon.xpath.value.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A token of an expression, which is also a node of its syntax tree and the unit of evaluation.
 *
 * Parsing: the parser calls {@link #nud()} when the token starts an expression and {@link #led(XPathToken)} when
 * it follows a left operand. Both consume the operands they need through the parser and return the resulting tree.
 *
 * Evaluation: {@link #evaluate(XPathContext)} returns a single value or a list, {@link #select(XPathContext)} a
 * lazy iterator over the items of the result. Each has a default implementation based on the other, so a token
 * class overrides at least one of them.
 */
public abstract class XPathToken {

    protected final XPathParser parser;
    protected final TokenDefinition definition;
    protected Object value;
    protected final List<XPathToken> items = new ArrayList<XPathToken>(2);

    private final String source;
    private int position = -1;
    private boolean spaced;

    protected XPathToken(XPathParser parser, TokenDefinition definition, Object value) {
        this.parser = parser;
        this.definition = definition;
        this.value = value;
        this.source = parser != null ? parser.getSource() : null;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Parsing

    public XPathToken nud() {
        throw wrongSyntax("unexpected " + this);
    }

    public XPathToken led(XPathToken left) {
        throw wrongSyntax("unexpected " + this);
    }

    /**
     * Same token read as a name, for keywords and operators that also are valid names.
     */
    public XPathToken asName() {
        final NameToken name = (NameToken) parser.getSymbolTable().get("(name)").createToken(parser, getSymbol());
        name.setLocation(position, spaced);
        return name;
    }

    /**
     * Whether this token, before any parsing, could be read as a name.
     */
    public boolean isNameLike() {
        if ("(name)".equals(getSymbol()))
            return true;
        final String label = getLabel();
        return (TokenDefinition.LABEL_OPERATOR.equals(label) || TokenDefinition.LABEL_KEYWORD.equals(label)
                || TokenDefinition.LABEL_FUNCTION.equals(label) || TokenDefinition.LABEL_AXIS.equals(label)
                || TokenDefinition.LABEL_KIND_TEST.equals(label))
                && Character.isLetter(getSymbol().charAt(0));
    }

    /**
     * The name this token stands for when read as a name.
     */
    public String getNameValue() {
        return "(name)".equals(getSymbol()) ? (String) value : getSymbol();
    }

    public void setLocation(int position, boolean spaced) {
        this.position = position;
        this.spaced = spaced;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Evaluation

    public Object evaluate(XPathContext context) {
        return toList(select(context));
    }

    public Iterator<Object> select(XPathContext context) {
        return iterate(evaluate(context));
    }

    /**
     * Whether {@link #select(XPathContext)} returns nodes in document order without duplicates, for any context
     * made of a single node.
     */
    public boolean isDocumentOrdered() {
        return false;
    }

    /**
     * Whether this token can follow an axis: a name test or a kind test.
     */
    public boolean isNodeTest() {
        return false;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Accessors

    public String getSymbol() {
        return definition.getSymbol();
    }

    public String getLabel() {
        return definition.getLabel();
    }

    public int getLbp() {
        return definition.getLbp();
    }

    public int getRbp() {
        return definition.getRbp();
    }

    public TokenDefinition getDefinition() {
        return definition;
    }

    public Object getValue() {
        return value;
    }

    public List<XPathToken> getItems() {
        return Collections.unmodifiableList(items);
    }

    public XPathToken get(int index) {
        return items.get(index);
    }

    public int size() {
        return items.size();
    }

    public String getSource() {
        return source;
    }

    public int getPosition() {
        return position;
    }

    public boolean isSpaced() {
        return spaced;
    }

    public XPathParser getParser() {
        return parser;
    }

    protected boolean isCompatibilityMode() {
        return parser != null && parser.isCompatibilityMode();
    }

    /**
     * Syntax tree in prefix notation, for diagnostics: <code>(+ (1) (2))</code>.
     */
    public String getTree() {
        if (items.isEmpty()) {
            if (value instanceof String && TokenDefinition.LABEL_LITERAL.equals(getLabel()))
                return "('" + value + "')";
            else if (value != null && !(this instanceof FunctionToken))
                return "(" + Values.stringValue(value, false) + ")";
            else
                return "(" + getSymbol() + ")";
        }
        final StringBuilder sb = new StringBuilder("(").append(getSymbol());
        for (XPathToken item : items)
            sb.append(' ').append(item.getTree());
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        final String label = getLabel();
        if ("(name)".equals(getSymbol()))
            return "name '" + value + "'";
        else if (TokenDefinition.LABEL_LITERAL.equals(label))
            return "literal " + (value instanceof String ? "'" + value + "'" : Values.stringValue(value, false));
        else if ("(end)".equals(getSymbol()))
            return "end of source";
        else
            return "'" + getSymbol() + "' " + label;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Errors

    public XPathException error(ErrorCode code, String message) {
        return code.createException(message, this);
    }

    public XPathException wrongSyntax(String message) {
        return ErrorCode.XPST0003.createException(message, this);
    }

    public XPathException missingContext() {
        return ErrorCode.XPDY0002.createException(null, this);
    }

    public XPathException wrongType(String message) {
        return ErrorCode.XPTY0004.createException(message, this);
    }

    public XPathException missingName(String message) {
        return ErrorCode.XPST0008.createException(message, this);
    }

    public XPathException wrongValue(String message) {
        return ErrorCode.FORG0001.createException(message, this);
    }

    // ---------------------------------------------------------------------------------------------------------
    // Values

    @SuppressWarnings("unchecked")
    public static List<Object> toList(Iterator<Object> iterator) {
        return IteratorUtils.toList(iterator);
    }

    @SuppressWarnings("unchecked")
    public static Iterator<Object> iterate(Object value) {
        if (value == null)
            return Collections.emptyList().iterator();
        else if (value instanceof List)
            return ((List<Object>) value).iterator();
        else
            return Collections.singletonList(value).iterator();
    }

    /**
     * Check that the focus is on a node, or on the implicit document above a root element, before a step.
     */
    protected void checkNodeFocus(XPathContext context) {
        if (context == null)
            throw missingContext();
        final Object item = context.getItem();
        if (item == null) {
            if (context.getRoot() == null)
                throw missingContext();
        } else if (!(item instanceof XPathNode)) {
            throw error(ErrorCode.XPTY0020, "the context item is not a node");
        }
    }

    protected static XPathContext copy(XPathContext context) {
        return context != null ? context.copy() : null;
    }

    /**
     * Single item of the result of an operand, null if the result is empty.
     */
    public Object getArgument(XPathContext context, int index) {
        final Iterator<Object> iterator = items.get(index).select(copy(context));
        if (!iterator.hasNext())
            return null;
        final Object result = iterator.next();
        if (iterator.hasNext())
            throw wrongType("a sequence of more than one item is not allowed as argument " + (index + 1));
        return result;
    }

    /**
     * Atomized single item of the result of an operand, null if the result is empty.
     */
    public Object getAtomicArgument(XPathContext context, int index) {
        final Object argument = getArgument(context, index);
        return argument instanceof XPathNode ? ((XPathNode) argument).getTypedValue() : argument;
    }

    /**
     * Atomized items of the result of an operand.
     */
    public List<Object> atomization(XPathContext context, int index) {
        final List<Object> result = new ArrayList<Object>();
        for (Iterator<Object> i = items.get(index).select(copy(context)); i.hasNext();) {
            final Object item = i.next();
            result.add(item instanceof XPathNode ? ((XPathNode) item).getTypedValue() : item);
        }
        return result;
    }

    /**
     * Effective boolean value.
     */
    public boolean booleanValue(Object value) {
        if (value instanceof List)
            return booleanValue(((List<?>) value).iterator());
        else if (value == null)
            return false;
        else if (value instanceof XPathNode)
            return true;
        else if (value instanceof Boolean)
            return (Boolean) value;
        else if (value instanceof String)
            return ((String) value).length() > 0;
        else if (value instanceof UntypedAtomic)
            return ((UntypedAtomic) value).getValue().length() > 0;
        else if (value instanceof Double)
            return !(((Double) value) == 0 || ((Double) value).isNaN());
        else if (value instanceof BigInteger)
            return ((BigInteger) value).signum() != 0;
        else if (value instanceof BigDecimal)
            return ((BigDecimal) value).signum() != 0;
        else
            throw error(ErrorCode.FORG0006, "effective boolean value is not defined for " + value.getClass().getSimpleName());
    }

    /**
     * Effective boolean value of a sequence, reading no more items than needed.
     */
    public boolean booleanValue(Iterator<?> iterator) {
        if (!iterator.hasNext())
            return false;
        final Object first = iterator.next();
        if (first instanceof XPathNode)
            return true;
        if (iterator.hasNext())
            throw error(ErrorCode.FORG0006, "effective boolean value is not defined for a sequence of two or more items "
                    + "starting with a " + first.getClass().getSimpleName());
        return booleanValue(first);
    }

    public String stringValue(Object value) {
        if (value instanceof List) {
            final List<?> list = (List<?>) value;
            return list.isEmpty() ? "" : stringValue(list.get(0));
        } else if (value == null) {
            return "";
        } else if (value instanceof XPathNode) {
            return ((XPathNode) value).getStringValue();
        } else {
            return Values.stringValue(value, isCompatibilityMode());
        }
    }

    public double numberValue(Object value) {
        if (value instanceof List) {
            final List<?> list = (List<?>) value;
            return list.isEmpty() ? Double.NaN : numberValue(list.get(0));
        } else if (value == null) {
            return Double.NaN;
        } else if (value instanceof XPathNode) {
            return Values.parseDouble(((XPathNode) value).getStringValue(), isCompatibilityMode());
        } else if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else {
            return Values.parseDouble(value.toString(), isCompatibilityMode());
        }
    }

    public Object dataValue(Object item) {
        return item instanceof XPathNode ? ((XPathNode) item).getTypedValue() : item;
    }
}
