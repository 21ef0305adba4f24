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
import org.apache.xerces.xs.XSTypeDefinition;
import org.orbeon.xpath.schema.SchemaTypes;
import org.orbeon.xpath.value.Values;

public class SchemaAttributeNode extends AttributeNode {

    private final XSAttributeDeclaration declaration;

    public SchemaAttributeNode(SchemaElementNode parent, int position, XSAttributeDeclaration declaration) {
        super(parent, position, declaration.getName(), declaration.getNamespace(), null,
                Values.stringValue(SchemaTypes.sampleValue(declaration.getTypeDefinition()), false), declaration);
        this.declaration = declaration;
    }

    public XSTypeDefinition getXsdType() {
        return declaration.getTypeDefinition();
    }

    @Override
    public Object getTypedValue() {
        return SchemaTypes.sampleValue(declaration.getTypeDefinition());
    }
}
