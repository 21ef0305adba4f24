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

import org.apache.xerces.xs.XSAttributeDeclaration;
import org.apache.xerces.xs.XSAttributeUse;
import org.apache.xerces.xs.XSComplexTypeDefinition;
import org.apache.xerces.xs.XSElementDeclaration;
import org.apache.xerces.xs.XSObjectList;
import org.apache.xerces.xs.XSTypeDefinition;
import org.orbeon.xpath.schema.SchemaTypes;
import org.orbeon.xpath.value.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Element node of a schema graph, wrapping an element declaration. A reference node stands for a global
 * declaration used inside a content model: once linked, it exposes the children of the node built for the global
 * declaration.
 */
public class SchemaElementNode extends ElementNode {

    private final XSElementDeclaration declaration;
    private final boolean reference;
    private SchemaElementNode target;

    public SchemaElementNode(NodeTree tree, XPathNode parent, int position, XSElementDeclaration declaration,
                             boolean reference, Map<String, String> namespaces) {
        super(tree, parent, position, declaration.getName(), declaration.getNamespace(), null, namespaces);
        this.declaration = declaration;
        this.reference = reference;
    }

    public Object getNativeNode() {
        return declaration;
    }

    public XSElementDeclaration getDeclaration() {
        return declaration;
    }

    public XSTypeDefinition getXsdType() {
        return declaration.getTypeDefinition();
    }

    public boolean isReference() {
        return reference;
    }

    /**
     * Node of the global declaration this reference resolves to, null until linked.
     */
    public SchemaElementNode getTarget() {
        return target;
    }

    public void setTarget(SchemaElementNode target) {
        this.target = target;
    }

    /**
     * Use the child list of another node for the same local declaration, reached again through a recursive type.
     */
    public void shareChildren(SchemaElementNode other) {
        this.children = other.children;
    }

    @Override
    public List<XPathNode> getChildren() {
        return (target != null) ? target.getChildren() : Collections.unmodifiableList(children);
    }

    public int getAttributeCount() {
        final XSObjectList uses = getAttributeUses();
        return uses != null ? uses.getLength() : 0;
    }

    protected List<AttributeNode> createAttributeNodes(int firstPosition) {
        final XSObjectList uses = getAttributeUses();
        final List<AttributeNode> result = new ArrayList<AttributeNode>();
        if (uses != null) {
            int current = firstPosition;
            for (int i = 0; i < uses.getLength(); i++) {
                final XSAttributeDeclaration attribute = ((XSAttributeUse) uses.item(i)).getAttrDeclaration();
                result.add(new SchemaAttributeNode(this, current++, attribute));
            }
        }
        return result;
    }

    private XSObjectList getAttributeUses() {
        final XSTypeDefinition type = declaration.getTypeDefinition();
        if (type != null && type.getTypeCategory() == XSTypeDefinition.COMPLEX_TYPE)
            return ((XSComplexTypeDefinition) type).getAttributeUses();
        return null;
    }

    @Override
    public Object getTypedValue() {
        return SchemaTypes.sampleValue(declaration.getTypeDefinition());
    }

    @Override
    public String getStringValue() {
        return Values.stringValue(getTypedValue(), false);
    }
}
