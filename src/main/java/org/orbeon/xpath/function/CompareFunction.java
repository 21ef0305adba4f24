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

import java.math.BigInteger;
import java.util.Collections;

/**
 * <code>compare(s1, s2[, collation])</code>: -1, 0 or 1, or the empty sequence if an argument is empty.
 */
public class CompareFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final Object a = token.getAtomicArgument(context, 0);
        final Object b = token.getAtomicArgument(context, 1);
        if (a == null || b == null)
            return Collections.emptyList();

        final CollationManager manager = new CollationManager(Functions.getCollation(token, context, 2), token);
        try {
            return BigInteger.valueOf(manager.compare(token.stringValue(a), token.stringValue(b)));
        } finally {
            manager.close();
        }
    }
}
