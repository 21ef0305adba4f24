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
import org.orbeon.xpath.expr.NumericOperations;
import org.orbeon.xpath.value.UntypedAtomic;
import org.orbeon.xpath.value.Values;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;

/**
 * <code>sum(items[, zero])</code>. XPath 1.0 adds the numbers of the items as doubles; XPath 2.0 adds the atomized
 * values, casting untyped ones to doubles, and returns <code>zero</code> (default 0) for an empty sequence.
 */
public class SumFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        if (token.getParser() != null && token.getParser().isCompatibilityMode()) {
            double sum = 0;
            for (Iterator<Object> i = token.get(0).select(context != null ? context.copy() : null); i.hasNext();)
                sum += token.numberValue(i.next());
            return sum;
        }

        final List<Object> values = token.atomization(context, 0);
        if (values.isEmpty())
            return token.hasArgument(1) ? token.getAtomicArgument(context, 1) : BigInteger.ZERO;

        Object sum = null;
        for (Object value : values) {
            final Object number;
            if (value instanceof UntypedAtomic)
                number = Comparisons.castToDouble(token, value.toString());
            else if (Values.isNumeric(value))
                number = value;
            else
                throw token.wrongType("cannot sum a value of type " + value.getClass().getSimpleName());
            sum = sum == null ? number : NumericOperations.add(sum, number);
        }
        return sum;
    }
}
