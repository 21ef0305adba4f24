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
 * <code>translate(s, from, to)</code>: each character of <code>from</code> is replaced with the character at the
 * same position in <code>to</code>, or removed when <code>to</code> is shorter. Surrogate pairs count as one
 * character.
 */
public class TranslateFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final String s = token.getStringArgument(context, 0);
        final List<Integer> from = Functions.codePoints(token.getStringArgument(context, 1));
        final List<Integer> to = Functions.codePoints(token.getStringArgument(context, 2));

        final StringBuilder sb = new StringBuilder(s.length());
        for (Integer codePoint : Functions.codePoints(s)) {
            final int index = from.indexOf(codePoint);
            if (index < 0)
                sb.appendCodePoint(codePoint);
            else if (index < to.size())
                sb.appendCodePoint(to.get(index));
        }
        return sb.toString();
    }
}
