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
package org.orbeon.xpath.function;

import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.expr.Comparisons;
import org.orbeon.xpath.expr.FunctionToken;
import org.orbeon.xpath.value.UntypedAtomic;

import java.util.ArrayList;
import java.util.List;

/**
 * <code>distinct-values(items[, collation])</code>: atomized values without duplicates, first occurrences kept.
 * Untyped values compare as strings and NaN is equal to itself.
 */
public class DistinctValuesFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final XPathContext comparisonContext = context != null ? context.copy() : new XPathContext(null);
        if (token.hasArgument(1))
            comparisonContext.setDefaultCollation(token.getStringArgument(context, 1));

        final List<Object> result = new ArrayList<Object>();
        for (Object value : token.atomization(context, 0)) {
            final Object candidate = value instanceof UntypedAtomic ? value.toString() : value;
            boolean found = false;
            for (Object kept : result) {
                if (Comparisons.sameValue(token, comparisonContext, kept, candidate)) {
                    found = true;
                    break;
                }
            }
            if (!found)
                result.add(candidate);
        }
        return result;
    }
}
