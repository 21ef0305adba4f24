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
package org.orbeon.xpath.util;

import org.apache.log4j.Logger;

public class LoggerFactory {

    public static final Logger logger = LoggerFactory.createLogger(LoggerFactory.class);

    public static Logger createLogger(String name) {
        return Logger.getLogger(name);
    }

    public static Logger createLogger(Class clazz) {
        return Logger.getLogger(clazz.getName());
    }

    /**
     * New indented logger over the given logger, debug-enabled when the logger is.
     */
    public static IndentedLogger createIndentedLogger(Logger logger, String prefix) {
        return new IndentedLogger(logger, prefix);
    }
}
