/**
 * This file is part of the Trellis Web Framework.
 * 
 * @author Luke Hutchison
 * 
 * --
 * 
 * @license Apache 2.0 
 * 
 * Copyright 2015 Luke Hutchison
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package trellis.util;

import java.util.regex.Pattern;

public class WebUtils {

    public static final Pattern VALID_ENTITY = Pattern.compile(
            "^&(#\\d\\d?\\d?\\d?\\d?|#x[\\da-fA-F][\\da-fA-F]?[\\da-fA-F]?[\\da-fA-F]?|[a-zA-Z]\\w+);.*",
            Pattern.DOTALL);

    public static enum EscapeAmpersand {
        NEVER, IF_NOT_VALID_ENTITY, ALWAYS;
    }

    /**
     * Encodes HTML-unsafe characters as HTML entities.
     * 
     * See OWASP XSS Rule #1 at https://www.owasp.org/index.php/XSS_(Cross_Site_Scripting)_Prevention_Cheat_Sheet
     * 
     * @param unsafeStr
     *            The string to escape to make HTML-safe.
     * 
     * @param escapeAmpersand
     *            If ALWAYS, turn '&' into "&amp;". If IF_NOT_VALID_ENTITY, leave ampersands in place if they start a
     *            valid entity reference such as "&lt;", otherwise escape them (e.g. "H&M" => "H&amp;M"). If NEVER,
     *            leave '&' as it is.
     * 
     * @param preserveNewline
     *            If true, leave newline characters in the text, rather than turning them into a space.
     */
    public static void encodeForHTML(CharSequence unsafeStr, EscapeAmpersand escapeAmpersand,
            boolean preserveNewline, StringBuilder buf) {
        for (int i = 0, n = unsafeStr.length(); i < n; i++) {
            char c = unsafeStr.charAt(i);
            switch (c) {
            case '&':
                switch (escapeAmpersand) {
                case ALWAYS:
                    buf.append("&amp;");
                    break;
                case NEVER:
                    buf.append('&');
                    break;
                case IF_NOT_VALID_ENTITY:
                    int end = Math.min(i + 32, n); // Assume entities can't be more than 32 chars long
                    boolean validEntity = VALID_ENTITY.matcher(unsafeStr.subSequence(i, end)).matches();
                    buf.append(validEntity ? "&" : "&amp;");
                    break;
                }
                break;
            case '<':
                buf.append("&lt;");
                break;
            case '>':
                buf.append("&gt;");
                break;
            case '"':
                // Always escaped, so that attribute values can't be broken out of
                buf.append("&quot;");
                break;
            case '\'':
                buf.append("&#x27;"); // See http://goo.gl/FzoP6m
                break;
            case StringUtils.NBSP_CHAR:
                buf.append("&nbsp;");
                break;
            case '\n':
                if (preserveNewline) {
                    buf.append('\n');
                    break;
                }
                // else fall through, and handle newline as another control character
            default:
                if (c < 32) {
                    // Turn control characters into spaces
                    buf.append(' ');
                } else {
                    buf.append(c);
                }
            }
        }
    }

    /**
     * Encodes HTML-unsafe characters as HTML entities.
     * 
     * See OWASP XSS Rule #1 at https://www.owasp.org/index.php/XSS_(Cross_Site_Scripting)_Prevention_Cheat_Sheet
     */
    public static String encodeForHTML(CharSequence unsafeStr) {
        StringBuilder buf = new StringBuilder(unsafeStr.length() * 2);
        encodeForHTML(unsafeStr, /* escapeAmpersand = */EscapeAmpersand.ALWAYS, /* preserveNewline = */true, buf);
        return buf.toString();
    }

    /** Encodes a string for use inside a double-quoted HTML attribute value. */
    public static String encodeForHTMLAttribute(CharSequence unsafeStr) {
        StringBuilder buf = new StringBuilder(unsafeStr.length() * 2);
        encodeForHTML(unsafeStr, /* escapeAmpersand = */EscapeAmpersand.ALWAYS, /* preserveNewline = */false, buf);
        return buf.toString();
    }

    // -----------------------------------------------------------------------------------------------------

    /** Escape a string to be surrounded in double quotes in JSON. */
    public static String escapeJSONString(String unsafeStr) {
        StringBuilder buf = new StringBuilder(unsafeStr.length() * 2);
        escapeJSONString(unsafeStr, buf);
        return buf.toString();
    }

    /** Escape a string to be surrounded in double quotes in JSON. */
    public static void escapeJSONString(String unsafeStr, StringBuilder buf) {
        for (int i = 0, n = unsafeStr.length(); i < n; i++) {
            char c = unsafeStr.charAt(i);
            // See http://www.json.org/ under "string"
            switch (c) {
            case '\\':
            case '"':
                // Forward slash can be escaped, but doesn't have to be.
                buf.append('\\');
                buf.append(c);
                break;
            case '\b':
                buf.append("\\b");
                break;
            case '\t':
                buf.append("\\t");
                break;
            case '\n':
                buf.append("\\n");
                break;
            case '\f':
                buf.append("\\f");
                break;
            case '\r':
                buf.append("\\r");
                break;
            default:
                if (c < ' ') {
                    buf.append("\\u00");
                    int d1 = ((int) c) >> 4;
                    buf.append(d1 <= 9 ? (char) ('0' + d1) : (char) ('A' + d1 - 10));
                    int d2 = ((int) c) & 0xf;
                    buf.append(d2 <= 9 ? (char) ('0' + d2) : (char) ('A' + d2 - 10));
                } else {
                    buf.append(c);
                }
            }
        }
    }
}
