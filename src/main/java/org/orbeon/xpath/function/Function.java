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

/**
 * Implementation of a function of the library.
 */
public interface Function {

    /**
     * Call the function.
     *
     * @param token     the function call, giving access to the arguments and to the conversion rules of the
     *                  grammar version
     * @param context   the dynamic context, or null when evaluating without context
     * @return          a single item, a list of items, or null or an empty list for the empty sequence
     */
    Object call(FunctionToken token, XPathContext context);
}
