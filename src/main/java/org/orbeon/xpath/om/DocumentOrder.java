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
package org.orbeon.xpath.om;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Orders nodes by tree build, then by position. Within a tree this is document order; across trees the order is
 * stable but arbitrary.
 */
public class DocumentOrder implements Comparator<XPathNode> {

    public static final DocumentOrder INSTANCE = new DocumentOrder();

    public int compare(XPathNode node1, XPathNode node2) {
        final int ordinal1 = node1.getTree().getOrdinal();
        final int ordinal2 = node2.getTree().getOrdinal();
        if (ordinal1 != ordinal2)
            return ordinal1 < ordinal2 ? -1 : 1;
        final int position1 = node1.getPosition();
        final int position2 = node2.getPosition();
        return position1 < position2 ? -1 : (position1 == position2 ? 0 : 1);
    }

    public static boolean isSorted(List<?> items) {
        for (int i = 1; i < items.size(); i++) {
            if (INSTANCE.compare((XPathNode) items.get(i - 1), (XPathNode) items.get(i)) > 0)
                return false;
        }
        return true;
    }

    /**
     * Sort a list of nodes in document order, in place, unless it already is.
     */
    public static void sort(List<Object> nodes) {
        if (!isSorted(nodes)) {
            final List<XPathNode> sorted = new ArrayList<XPathNode>(nodes.size());
            for (Object node : nodes)
                sorted.add((XPathNode) node);
            Collections.sort(sorted, INSTANCE);
            nodes.clear();
            nodes.addAll(sorted);
        }
    }

    /**
     * Merge two node lists, each in document order and free of duplicates, into one list in document order.
     * Nodes present in both lists are kept once.
     */
    public static List<Object> merge(List<Object> first, List<Object> second) {
        final List<Object> result = new ArrayList<Object>(first.size() + second.size());
        int i = 0;
        int j = 0;
        while (i < first.size() && j < second.size()) {
            final XPathNode node1 = (XPathNode) first.get(i);
            final XPathNode node2 = (XPathNode) second.get(j);
            final int comparison = INSTANCE.compare(node1, node2);
            if (comparison < 0) {
                result.add(node1);
                i++;
            } else if (comparison > 0) {
                result.add(node2);
                j++;
            } else {
                result.add(node1);
                i++;
                j++;
            }
        }
        while (i < first.size())
            result.add(first.get(i++));
        while (j < second.size())
            result.add(second.get(j++));
        return result;
    }
}
