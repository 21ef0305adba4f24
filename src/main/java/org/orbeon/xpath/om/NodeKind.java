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

public enum NodeKind {

    DOCUMENT("document-node"),
    ELEMENT("element"),
    ATTRIBUTE("attribute"),
    NAMESPACE("namespace"),
    TEXT("text"),
    COMMENT("comment"),
    PROCESSING_INSTRUCTION("processing-instruction");

    private final String testName;

    NodeKind(String testName) {
        this.testName = testName;
    }

    /**
     * Name of the kind test matching this kind, e.g. <code>document-node</code>.
     */
    public String getTestName() {
        return testName;
    }
}
