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
import org.orbeon.xpath.expr.NumericOperations;

import java.util.Collections;

public class CeilingFunction implements Function {

    public Object call(FunctionToken token, XPathContext context) {
        final Object value = Functions.getNumericArgument(token, context);
        return value == null ? Collections.emptyList() : NumericOperations.ceiling(value);
    }
}
