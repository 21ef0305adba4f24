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
package org.orbeon.xpath.expr;

import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.common.XPathException;
import org.orbeon.xpath.context.XPathContext;
import org.orbeon.xpath.parser.TokenDefinition;
import org.orbeon.xpath.parser.XPathParser;
import org.orbeon.xpath.value.UntypedAtomic;
import org.orbeon.xpath.value.Values;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Integer range <code>a to b</code>, generated lazily.
 */
public class RangeToken extends XPathToken {

    public RangeToken(XPathParser parser, TokenDefinition definition, Object value) {
        super(parser, definition, value);
    }

    @Override
    public XPathToken nud() {
        return asName();
    }

    @Override
    public XPathToken led(XPathToken left) {
        items.add(left);
        items.add(parser.expression(getRbp()));
        return this;
    }

    @Override
    public Iterator<Object> select(XPathContext context) {
        final BigInteger start;
        final BigInteger end;
        try {
            start = toInteger(getAtomicArgument(context, 0));
            end = toInteger(getAtomicArgument(context, 1));
        } catch (XPathException e) {
            if (context != null && context.isSchema()
                    && (e.getCode() == ErrorCode.XPTY0004 || e.getCode() == ErrorCode.FORG0001))
                return Collections.emptyList().iterator();
            throw e;
        }
        if (start == null || end == null)
            return Collections.emptyList().iterator();

        return new Iterator<Object>() {
            private BigInteger current = start;

            public boolean hasNext() {
                return current.compareTo(end) <= 0;
            }

            public Object next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                final BigInteger result = current;
                current = current.add(BigInteger.ONE);
                return result;
            }

            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    private BigInteger toInteger(Object value) {
        if (value == null || value instanceof BigInteger) {
            return (BigInteger) value;
        } else if (value instanceof UntypedAtomic) {
            try {
                return new BigInteger(Values.trimWhitespace(value.toString()));
            } catch (NumberFormatException e) {
                throw wrongValue("invalid value '" + value + "' for xs:integer");
            }
        }
        throw wrongType("operands of 'to' must be integers, found " + Comparisons.typeName(value));
    }
}
