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

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.util.Stack;

/**
 * Abstraction over log4j, which provides:
 *
 * o start/end operation with parameters and elapsed time
 * o indenting depending on current nesting of operations
 * o name/value parameters appended to messages
 *
 * Instances hold the nesting of operations and are not thread-safe: create one per operation.
 */
public class IndentedLogger {

    private final Logger logger;
    private final String prefix;
    private final boolean debugEnabled;

    private int indentation;
    private final Stack<Operation> stack = new Stack<Operation>();

    public IndentedLogger(Logger logger, String prefix) {
        this(logger, logger.isDebugEnabled(), prefix);
    }

    public IndentedLogger(Logger logger, boolean debugEnabled, String prefix) {
        this.logger = logger;
        this.debugEnabled = debugEnabled;
        this.prefix = prefix;
    }

    public final boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void startHandleOperation(String type, String message, String... parameters) {
        if (debugEnabled) {
            stack.push(new Operation(type, message));
            logDebug(type, "start " + message, parameters);
            indentation++;
        }
    }

    public void endHandleOperation(String... parameters) {
        if (debugEnabled && !stack.isEmpty()) {
            indentation--;
            final Operation operation = stack.pop();
            final String[] newParameters = new String[parameters.length + 2];
            newParameters[0] = "time (ms)";
            newParameters[1] = Long.toString(operation.getTimeElapsed());
            System.arraycopy(parameters, 0, newParameters, 2, parameters.length);
            logDebug(operation.type, "end " + operation.message, newParameters);
        }
    }

    public void logDebug(String type, String message, String... parameters) {
        if (debugEnabled)
            log(Level.DEBUG, type, message, parameters);
    }

    public void logWarning(String type, String message, String... parameters) {
        log(Level.WARN, type, message, parameters);
    }

    private void log(Level level, String type, String message, String... parameters) {
        if (!logger.isEnabledFor(level))
            return;

        final String parametersString;
        if (parameters != null && parameters.length > 1) {
            final StringBuilder sb = new StringBuilder(" {");
            boolean first = true;
            for (int i = 0; i + 1 < parameters.length; i += 2) {
                final String paramName = parameters[i];
                final String paramValue = parameters[i + 1];

                if (paramName != null && paramValue != null) {
                    if (!first)
                        sb.append(", ");

                    sb.append(paramName);
                    sb.append(": \"");
                    sb.append(paramValue);
                    sb.append('\"');

                    first = false;
                }
            }
            sb.append('}');
            parametersString = sb.toString();
        } else {
            parametersString = "";
        }

        logger.log(level, prefix + " - " + StringUtils.repeat("  ", indentation) + (StringUtils.isNotEmpty(type) ? (type + " - ") : "") + message + parametersString);
    }

    private static class Operation {
        public final String type;
        public final String message;
        public final long startTime = System.currentTimeMillis();

        public Operation(String type, String message) {
            this.type = type;
            this.message = message;
        }

        public long getTimeElapsed() {
            return System.currentTimeMillis() - startTime;
        }
    }
}
