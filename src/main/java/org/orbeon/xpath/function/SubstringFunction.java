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

import java.util.List;

/**
 * <code>substring(s, start[, length])</code>, counting characters as code points. A character at position p is
 * kept when <code>round(start) &lt;= p &lt; round(start) + round(length)</code>, which gives the expected results
 * for NaN and infinite arguments.
 */
public class SubstringFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final String s = token.getStringArgument(context, 0);
        final double start = Functions.roundPosition(token.getNumberArgument(context, 1));
        final double end = token.hasArgument(2)
                ? start + Functions.roundPosition(token.getNumberArgument(context, 2)) : Double.POSITIVE_INFINITY;

        final List<Integer> codePoints = Functions.codePoints(s);
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < codePoints.size(); i++) {
            final int position = i + 1;
            if (position >= start && position < end)
                sb.appendCodePoint(codePoints.get(i));
        }
        return sb.toString();
    }
}
