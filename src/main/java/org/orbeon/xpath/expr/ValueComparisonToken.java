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

import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.value.UntypedAtomic;

import java.util.Collections;

/**
 * Value comparisons <code>eq</code>, <code>ne</code>, <code>lt</code>, <code>le</code>, <code>gt</code> and
 * <code>ge</code> between two single atomic values. Untyped values compare as strings.
 */
public class ValueComparisonToken extends ComparisonToken {

    public ValueComparisonToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        return asName();
    }

    @Override
    public Object evaluate(XPathContext context) {
        Object a = getAtomicArgument(context, 0);
        Object b = getAtomicArgument(context, 1);
        if (a == null || b == null)
            return Collections.emptyList();
        if (a instanceof UntypedAtomic)
            a = a.toString();
        if (b instanceof UntypedAtomic)
            b = b.toString();
        try {
            return Comparisons.apply(getSymbol(), Comparisons.compareAtomics(this, context, getSymbol(), a, b));
        } catch (XPathException e) {
            if (context != null && context.isSchema() && e.getCode() == ErrorCode.XPTY0004)
                return Boolean.FALSE;
            throw e;
        }
    }
}
