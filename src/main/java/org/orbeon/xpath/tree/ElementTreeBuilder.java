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
package org.orbeon.xpath.tree;

import org.dom4j.Element;
import org.orbeon.xpath.om.ElementNode;
import org.orbeon.xpath.om.NodeTree;

import java.util.Map;

/**
 * Builds a node tree from a dom4j element alone. Nothing outside of the element is modeled: the root node has no
 * parent and no document-level siblings.
 */
public class ElementTreeBuilder extends Dom4jTreeBuilder {

    private final Map<String, String> namespaces;

    public ElementTreeBuilder(Map<String, String> namespaces, String uri) {
        super(new NodeTree(uri, false, 1));
        this.namespaces = namespaces;
    }

    public ElementNode build(Element root) {
        final ElementNode rootNode = buildElement(root, null, createRootNamespaces(namespaces));
        tree.setRoot(rootNode);
        return rootNode;
    }
}
