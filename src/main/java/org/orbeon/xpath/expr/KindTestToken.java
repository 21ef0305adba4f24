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

import org.apache.commons.collections.Predicate;
import org.apache.commons.collections.iterators.FilterIterator;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.NodeKind;
import org.orbeon.xpath.om.XPathNode;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;

import java.util.Iterator;

/**
 * Kind tests: <code>node()</code>, <code>text()</code>, <code>comment()</code>,
 * <code>processing-instruction([name])</code>, and in XPath 2 <code>element([name])</code> and
 * <code>document-node([element(...)])</code>.
 */
public class KindTestToken extends XPathToken {

    public KindTestToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        parser.advance("(");
        final String symbol = getSymbol();
        final XPathToken next = parser.getNextToken();
        if (!")".equals(next.getSymbol())) {
            if ("processing-instruction".equals(symbol)) {
                if ("(string)".equals(next.getSymbol()) || next.isNameLike()) {
                    parser.advance();
                    final XPathToken target = parser.getToken();
                    value = "(string)".equals(target.getSymbol())
                            ? ((String) target.getValue()).trim() : target.getNameValue();
                } else {
                    throw next.wrongSyntax("unexpected " + next + ", expected a processing instruction target");
                }
            } else if ("element".equals(symbol)) {
                final XPathToken name = parser.expression(5);
                if (!(name instanceof NameToken || (name instanceof WildcardToken && name.isNodeTest())))
                    throw name.wrongSyntax("unexpected " + name + ", expected an element name");
                items.add(name);
            } else if ("document-node".equals(symbol)) {
                final XPathToken test = parser.expression(5);
                if (!(test instanceof KindTestToken && "element".equals(test.getSymbol())))
                    throw test.wrongSyntax("unexpected " + test + ", expected an element test");
                items.add(test);
            } else {
                throw next.wrongSyntax("unexpected " + next + ", expected ')'");
            }
        }
        parser.advance(")");
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Object> select(final XPathContext context) {
        checkNodeFocus(context);
        return new FilterIterator(context.iterChildrenOrSelf(), new Predicate() {
            public boolean evaluate(Object candidate) {
                return candidate instanceof XPathNode && matches((XPathNode) candidate, context);
            }
        });
    }

    public boolean matches(XPathNode node, XPathContext context) {
        final String symbol = getSymbol();
        final NodeKind kind = node.getKind();
        if ("node".equals(symbol)) {
            return true;
        } else if ("text".equals(symbol)) {
            return kind == NodeKind.TEXT;
        } else if ("comment".equals(symbol)) {
            return kind == NodeKind.COMMENT;
        } else if ("processing-instruction".equals(symbol)) {
            return kind == NodeKind.PROCESSING_INSTRUCTION && (value == null || value.equals(node.getLocalName()));
        } else if ("element".equals(symbol)) {
            if (kind != NodeKind.ELEMENT)
                return false;
            if (items.isEmpty())
                return true;
            final XPathToken name = items.get(0);
            return name instanceof NameToken ? node.matchesName(((NameToken) name).getNameTest(context)) : true;
        } else if ("document-node".equals(symbol)) {
            if (kind != NodeKind.DOCUMENT)
                return false;
            if (items.isEmpty())
                return true;
            final ElementNode element = ((DocumentNode) node).getDocumentElement();
            return element != null && ((KindTestToken) items.get(0)).matches(element, context);
        }
        return false;
    }

    @Override
    public boolean isDocumentOrdered() {
        return true;
    }

    @Override
    public boolean isNodeTest() {
        return true;
    }
}
