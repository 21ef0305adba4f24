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

public class SubstringAfterFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final String s1 = token.getStringArgument(context, 0);
        final String s2 = token.getStringArgument(context, 1);
        final String collation = Functions.getCollation(token, context, 2);
        final int end;
        if (CollationManager.isCodepoint(collation)) {
            final int index = s1.indexOf(s2);
            end = index < 0 ? -1 : index + s2.length();
        } else {
            final CollationManager manager = new CollationManager(collation, token);
            try {
                end = manager.findEnd(s1, s2);
            } finally {
                manager.close();
            }
        }
        return end < 0 ? "" : s1.substring(end);
    }
}
