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
package org.orbeon.xpath.function;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import org.orbeon.xpath.common.ErrorCode;
import org.orbeon.xpath.expr.XPathToken;
import org.orbeon.xpath.util.LoggerFactory;

import java.io.Closeable;
import java.text.Collator;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * String operations under a collation. The codepoint collation compares UTF-16 code units; collation URIs with a
 * <code>lang</code> parameter use the {@link Collator} of that locale.
 *
 * An open manager holds a process-wide lock, released by {@link #close()}, so that at most one locale-sensitive
 * collation is active at a time:
 *
 * <pre>
 * final CollationManager manager = new CollationManager(uri, token);
 * try {
 *     ...
 * } finally {
 *     manager.close();
 * }
 * </pre>
 */
public class CollationManager implements Closeable {

    public static final String CODEPOINT_COLLATION = "http://www.w3.org/2005/xpath-functions/collation/codepoint";
    public static final String UCA_COLLATION = "http://www.w3.org/2013/collation/UCA";

    private static final Logger logger = LoggerFactory.createLogger(CollationManager.class);
    private static final ReentrantLock lock = new ReentrantLock();

    private final String collation;
    private final Collator collator;
    private boolean closed;

    public CollationManager(String collation, XPathToken token) {
        this.collation = collation == null ? CODEPOINT_COLLATION : collation;
        this.collator = createCollator(this.collation, token);
        lock.lock();
    }

    public static boolean isCodepoint(String collation) {
        return collation == null || CODEPOINT_COLLATION.equals(collation);
    }

    private static Collator createCollator(String collation, XPathToken token) {
        if (CODEPOINT_COLLATION.equals(collation))
            return null;

        final String language;
        if (collation.startsWith(UCA_COLLATION)) {
            final String parameters = StringUtils.substringAfter(collation, "?");
            String found = null;
            for (String parameter : StringUtils.split(parameters, ";&")) {
                if (parameter.startsWith("lang="))
                    found = parameter.substring("lang=".length());
            }
            language = found;
        } else if (collation.startsWith("http://") || collation.startsWith("https://") || collation.startsWith("urn:")) {
            language = null;
        } else {
            // Locale name such as "en_US", "it-IT" or "it_IT.UTF-8"
            language = collation;
        }
        final Locale locale = language == null ? null : Locale.forLanguageTag(StringUtils.substringBefore(language, ".").replace('_', '-'));
        if (locale == null && collation.equals(UCA_COLLATION))
            return Collator.getInstance(Locale.ROOT);
        if (locale == null || !isKnownLanguage(locale.getLanguage())) {
            LoggerFactory.createIndentedLogger(logger, "collation").logWarning("create", "unsupported collation", "collation", collation);
            throw ErrorCode.FOCH0002.createException("unsupported collation " + collation, token);
        }
        return Collator.getInstance(locale);
    }

    private static boolean isKnownLanguage(String language) {
        for (String candidate : Locale.getISOLanguages()) {
            if (candidate.equals(language))
                return true;
        }
        return false;
    }

    public String getCollation() {
        return collation;
    }

    public int compare(String a, String b) {
        final int result = collator == null ? compareCodepoints(a, b) : collator.compare(a, b);
        return result < 0 ? -1 : (result == 0 ? 0 : 1);
    }

    /**
     * Compare two strings by Unicode code point, so a supplementary character sorts after any BMP character.
     */
    public static int compareCodepoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            final int c1 = a.codePointAt(i);
            final int c2 = b.codePointAt(j);
            if (c1 != c2)
                return c1 < c2 ? -1 : 1;
            i += Character.charCount(c1);
            j += Character.charCount(c2);
        }
        if (i < a.length())
            return 1;
        return j < b.length() ? -1 : 0;
    }

    public boolean eq(String a, String b) {
        return compare(a, b) == 0;
    }

    public boolean ne(String a, String b) {
        return compare(a, b) != 0;
    }

    public boolean contains(String a, String b) {
        return find(a, b) >= 0;
    }

    public boolean startsWith(String a, String b) {
        if (collator == null)
            return a.startsWith(b);
        for (int end = 0; end <= a.length(); end++) {
            if (collator.compare(a.substring(0, end), b) == 0)
                return true;
        }
        return false;
    }

    /**
     * Index of the first match of a substring, -1 if none.
     */
    public int find(String a, String b) {
        if (collator == null)
            return a.indexOf(b);
        if (b.length() == 0)
            return 0;
        for (int start = 0; start < a.length(); start++) {
            for (int end = start + 1; end <= a.length(); end++) {
                if (collator.compare(a.substring(start, end), b) == 0)
                    return start;
            }
        }
        return -1;
    }

    /**
     * End index of the first match of a substring, -1 if none.
     */
    public int findEnd(String a, String b) {
        if (collator == null) {
            final int index = a.indexOf(b);
            return index < 0 ? -1 : index + b.length();
        }
        if (b.length() == 0)
            return 0;
        for (int start = 0; start < a.length(); start++) {
            for (int end = start + 1; end <= a.length(); end++) {
                if (collator.compare(a.substring(start, end), b) == 0)
                    return end;
            }
        }
        return -1;
    }

    public void close() {
        if (!closed) {
            closed = true;
            lock.unlock();
        }
    }
}
