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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Concatenates the iterators obtained by applying a step to each item of an outer iterator. The step is applied
 * right after the outer iterator returned the item, while the focus is still on it.
 */
abstract class StepIterator implements Iterator<Object> {

    private final Iterator<Object> outer;
    private Iterator<Object> inner;

    protected StepIterator(Iterator<Object> outer) {
        this.outer = outer;
    }

    protected abstract Iterator<Object> step(Object item);

    public boolean hasNext() {
        while (inner == null || !inner.hasNext()) {
            if (!outer.hasNext())
                return false;
            inner = step(outer.next());
        }
        return true;
    }

    public Object next() {
        if (!hasNext())
            throw new NoSuchElementException();
        return inner.next();
    }

    public void remove() {
        throw new UnsupportedOperationException();
    }
}
