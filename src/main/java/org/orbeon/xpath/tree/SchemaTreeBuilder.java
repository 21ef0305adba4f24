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

import org.apache.xerces.xs.XSComplexTypeDefinition;
import org.apache.xerces.xs.XSConstants;
import org.apache.xerces.xs.XSElementDeclaration;
import org.apache.xerces.xs.XSModel;
import org.apache.xerces.xs.XSModelGroup;
import org.apache.xerces.xs.XSNamedMap;
import org.apache.xerces.xs.XSObjectList;
import org.apache.xerces.xs.XSParticle;
import org.apache.xerces.xs.XSTerm;
import org.apache.xerces.xs.XSTypeDefinition;
import org.orbeon.xpath.om.DocumentNode;
import org.orbeon.xpath.om.NodeTree;
import org.orbeon.xpath.om.SchemaElementNode;
import org.orbeon.xpath.om.XPathNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

/**
 * Builds a node tree from an XML Schema graph. Element particles of complex types become child nodes and
 * attribute uses become attribute nodes.
 *
 * Schema graphs can be circular. Two rules keep the tree finite:
 *
 * o a global declaration used inside a content model gives a reference node, linked after the traversal to the
 *   node of the global declaration, which is built on demand if needed
 * o a local declaration reached again through a recursive type gives a node sharing the child list of the first
 *   node built for it
 */
public class SchemaTreeBuilder {

    private static final Map<String, String> SCHEMA_NAMESPACES;
    static {
        final Map<String, String> namespaces = new LinkedHashMap<String, String>();
        namespaces.put("xml", Dom4jTreeBuilder.XML_NAMESPACE);
        SCHEMA_NAMESPACES = Collections.unmodifiableMap(namespaces);
    }

    private final NodeTree tree;
    private final List<SchemaElementNode> globalElements = new ArrayList<SchemaElementNode>();
    private final List<SchemaElementNode> references = new ArrayList<SchemaElementNode>();

    private SchemaTreeBuilder(String uri) {
        this.tree = new NodeTree(uri, true, 1);
    }

    /**
     * Build the graph of all the global element declarations of a schema, under a document node.
     */
    public static DocumentNode build(XSModel model, String uri) {
        final SchemaTreeBuilder builder = new SchemaTreeBuilder(uri);
        final DocumentNode documentNode = new DocumentNode(builder.tree, model, builder.tree.reserve(1));
        builder.tree.addNode(documentNode, model);
        builder.tree.setRoot(documentNode);

        final XSNamedMap declarations = model.getComponents(XSConstants.ELEMENT_DECLARATION);
        for (int i = 0; i < declarations.getLength(); i++)
            documentNode.addChild(builder.buildSubtree((XSElementDeclaration) declarations.item(i), documentNode));

        builder.linkReferences(documentNode);
        return documentNode;
    }

    /**
     * Build the graph rooted at one element declaration.
     */
    public static SchemaElementNode build(XSElementDeclaration declaration, String uri) {
        final SchemaTreeBuilder builder = new SchemaTreeBuilder(uri);
        final SchemaElementNode rootNode = builder.buildSubtree(declaration, null);
        builder.tree.setRoot(rootNode);
        builder.linkReferences(null);
        return rootNode;
    }

    public NodeTree getTree() {
        return tree;
    }

    private SchemaElementNode buildSubtree(XSElementDeclaration declaration, XPathNode parent) {
        final SchemaElementNode rootNode = createNode(declaration, parent, false);
        if (declaration.getScope() == XSConstants.SCOPE_GLOBAL)
            globalElements.add(rootNode);

        final Map<XSElementDeclaration, SchemaElementNode> localNodes = new IdentityHashMap<XSElementDeclaration, SchemaElementNode>();
        localNodes.put(declaration, rootNode);

        final Stack<Frame> stack = new Stack<Frame>();
        stack.push(new Frame(rootNode, getChildDeclarations(declaration)));
        while (!stack.isEmpty()) {
            final Frame frame = stack.peek();
            if (!frame.children.hasNext()) {
                stack.pop();
                continue;
            }

            final XSElementDeclaration child = frame.children.next();
            if (child.getScope() == XSConstants.SCOPE_GLOBAL) {
                final SchemaElementNode reference = createNode(child, frame.node, true);
                frame.node.addChild(reference);
                references.add(reference);
            } else if (localNodes.containsKey(child)) {
                final SchemaElementNode node = createNode(child, frame.node, false);
                node.shareChildren(localNodes.get(child));
                frame.node.addChild(node);
            } else {
                final SchemaElementNode node = createNode(child, frame.node, false);
                localNodes.put(child, node);
                frame.node.addChild(node);
                stack.push(new Frame(node, getChildDeclarations(child)));
            }
        }
        return rootNode;
    }

    /**
     * Deferred pass: link each reference node to the node of its global declaration. Building a missing global
     * subtree can add references, which are linked by the same loop.
     */
    private void linkReferences(DocumentNode documentNode) {
        for (int i = 0; i < references.size(); i++) {
            final SchemaElementNode reference = references.get(i);
            SchemaElementNode target = findGlobalElement(reference.getDeclaration());
            if (target == null) {
                target = buildSubtree(reference.getDeclaration(), documentNode);
                if (documentNode != null)
                    documentNode.addChild(target);
            }
            reference.setTarget(target);
        }
    }

    private SchemaElementNode findGlobalElement(XSElementDeclaration declaration) {
        for (SchemaElementNode node : globalElements) {
            if (node.getDeclaration() == declaration)
                return node;
        }
        return null;
    }

    private SchemaElementNode createNode(XSElementDeclaration declaration, XPathNode parent, boolean reference) {
        final SchemaElementNode node = new SchemaElementNode(tree, parent, tree.getNextPosition(), declaration, reference, SCHEMA_NAMESPACES);
        tree.reserve(node.getReservedPositions());
        tree.addNode(node, reference ? null : declaration);
        return node;
    }

    private static Iterator<XSElementDeclaration> getChildDeclarations(XSElementDeclaration declaration) {
        final List<XSElementDeclaration> result = new ArrayList<XSElementDeclaration>();
        final XSTypeDefinition type = declaration.getTypeDefinition();
        if (type != null && type.getTypeCategory() == XSTypeDefinition.COMPLEX_TYPE) {
            final XSParticle particle = ((XSComplexTypeDefinition) type).getParticle();
            if (particle != null)
                collectDeclarations(particle.getTerm(), result);
        }
        return result.iterator();
    }

    private static void collectDeclarations(XSTerm term, List<XSElementDeclaration> result) {
        if (term instanceof XSElementDeclaration) {
            result.add((XSElementDeclaration) term);
        } else if (term instanceof XSModelGroup) {
            final XSObjectList particles = ((XSModelGroup) term).getParticles();
            for (int i = 0; i < particles.getLength(); i++)
                collectDeclarations(((XSParticle) particles.item(i)).getTerm(), result);
        }
    }

    private static class Frame {
        public final SchemaElementNode node;
        public final Iterator<XSElementDeclaration> children;

        public Frame(SchemaElementNode node, Iterator<XSElementDeclaration> children) {
            this.node = node;
            this.children = children;
        }
    }
}
