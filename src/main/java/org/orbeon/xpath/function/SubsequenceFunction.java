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
import org.orbeon.xpath.expr.FunctionToken;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * <code>subsequence(items, start[, length])</code>, with the rounding rules of <code>substring</code>.
 */
public class SubsequenceFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final double start = Functions.roundPosition(token.getNumberArgument(context, 1));
        final double end = token.hasArgument(2)
                ? start + Functions.roundPosition(token.getNumberArgument(context, 2)) : Double.POSITIVE_INFINITY;

        final List<Object> result = new ArrayList<Object>();
        int position = 1;
        for (Iterator<Object> i = token.get(0).select(context != null ? context.copy() : null); i.hasNext(); position++) {
            final Object item = i.next();
            if (position >= end)
                break;
            if (position >= start)
                result.add(item);
        }
        return result;
    }
}
