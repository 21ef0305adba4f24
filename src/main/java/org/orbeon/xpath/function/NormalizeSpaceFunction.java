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
import org.orbeon.xpath.value.Values;

public class NormalizeSpaceFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final String s = token.hasArgument(0)
                ? token.getStringArgument(context, 0) : token.stringValue(token.getContextItem(context));
        return normalize(s);
    }

    public static String normalize(String s) {
        final StringBuilder sb = new StringBuilder(s.length());
        boolean pendingSpace = false;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (Values.isXmlWhitespace(c)) {
                pendingSpace = sb.length() > 0;
            } else {
                if (pendingSpace)
                    sb.append(' ');
                pendingSpace = false;
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
