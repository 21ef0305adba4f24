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
package org.orbeon.xpath.schema;

import org.apache.xerces.xs.XSComplexTypeDefinition;
import org.apache.xerces.xs.XSConstants;
import org.apache.xerces.xs.XSSimpleTypeDefinition;
import org.apache.xerces.xs.XSTypeDefinition;
import org.orbeon.xpath.value.UntypedAtomic;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Maps XML Schema types to representative atomic values. Nodes of a schema graph have no data, so their typed
 * value is a sample of the right class, which lets static evaluation find type errors.
 */
public class SchemaTypes {

    private SchemaTypes() {}

    public static Object sampleValue(XSTypeDefinition type) {
        if (type == null)
            return new UntypedAtomic("1");

        final XSSimpleTypeDefinition simpleType;
        if (type.getTypeCategory() == XSTypeDefinition.COMPLEX_TYPE) {
            final XSComplexTypeDefinition complexType = (XSComplexTypeDefinition) type;
            switch (complexType.getContentType()) {
                case XSComplexTypeDefinition.CONTENTTYPE_SIMPLE:
                    simpleType = complexType.getSimpleType();
                    break;
                case XSComplexTypeDefinition.CONTENTTYPE_MIXED:
                    return new UntypedAtomic("1");
                default:
                    return new UntypedAtomic("");
            }
        } else {
            simpleType = (XSSimpleTypeDefinition) type;
        }

        if (simpleType == null || simpleType.getVariety() != XSSimpleTypeDefinition.VARIETY_ATOMIC)
            return new UntypedAtomic("1");

        switch (simpleType.getBuiltInKind()) {
            case XSConstants.INTEGER_DT:
            case XSConstants.NONPOSITIVEINTEGER_DT:
            case XSConstants.NEGATIVEINTEGER_DT:
            case XSConstants.LONG_DT:
            case XSConstants.INT_DT:
            case XSConstants.SHORT_DT:
            case XSConstants.BYTE_DT:
            case XSConstants.NONNEGATIVEINTEGER_DT:
            case XSConstants.UNSIGNEDLONG_DT:
            case XSConstants.UNSIGNEDINT_DT:
            case XSConstants.UNSIGNEDSHORT_DT:
            case XSConstants.UNSIGNEDBYTE_DT:
            case XSConstants.POSITIVEINTEGER_DT:
                return BigInteger.ONE;
            case XSConstants.DECIMAL_DT:
                return BigDecimal.ONE;
            case XSConstants.FLOAT_DT:
            case XSConstants.DOUBLE_DT:
                return Double.valueOf(1.0);
            case XSConstants.BOOLEAN_DT:
                return Boolean.TRUE;
            case XSConstants.ANYSIMPLETYPE_DT:
                return new UntypedAtomic("1");
            default:
                return "1";
        }
    }

    /**
     * Type name in <code>{uri}local</code> notation, or null for anonymous types.
     */
    public static String getExpandedName(XSTypeDefinition type) {
        if (type == null || type.getAnonymous() || type.getName() == null)
            return null;
        final String uri = type.getNamespace();
        return (uri == null || uri.length() == 0) ? type.getName() : "{" + uri + "}" + type.getName();
    }
}
