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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

public class StringUtils {

    public static final char NBSP_CHAR = (char) 0x00A0;

    private static final BitSet IS_UNICODE_WHITESPACE = new BitSet(1 << 16);

    static {
        // Valid unicode whitespace chars, see:
        // http://stackoverflow.com/questions/4731055/whitespace-matching-regex-java
        String wsChars = ""//
                + (char) 0x0009 // CHARACTER TABULATION
                + (char) 0x000A // LINE FEED (LF)
                + (char) 0x000B // LINE TABULATION
                + (char) 0x000C // FORM FEED (FF)
                + (char) 0x000D // CARRIAGE RETURN (CR)
                + (char) 0x0020 // SPACE
                + (char) 0x0085 // NEXT LINE (NEL) 
                + NBSP_CHAR // NO-BREAK SPACE
                + (char) 0x1680 // OGHAM SPACE MARK
                + (char) 0x180E // MONGOLIAN VOWEL SEPARATOR
                + (char) 0x2000 // EN QUAD 
                + (char) 0x2001 // EM QUAD 
                + (char) 0x2002 // EN SPACE
                + (char) 0x2003 // EM SPACE
                + (char) 0x2004 // THREE-PER-EM SPACE
                + (char) 0x2005 // FOUR-PER-EM SPACE
                + (char) 0x2006 // SIX-PER-EM SPACE
                + (char) 0x2007 // FIGURE SPACE
                + (char) 0x2008 // PUNCTUATION SPACE
                + (char) 0x2009 // THIN SPACE
                + (char) 0x200A // HAIR SPACE
                + (char) 0x2028 // LINE SEPARATOR
                + (char) 0x2029 // PARAGRAPH SEPARATOR
                + (char) 0x202F // NARROW NO-BREAK SPACE
                + (char) 0x205F // MEDIUM MATHEMATICAL SPACE
                + (char) 0x3000; // IDEOGRAPHIC SPACE
        for (int i = 0; i < wsChars.length(); i++) {
            IS_UNICODE_WHITESPACE.set((int) wsChars.charAt(i));
        }
    }

    public static boolean isUnicodeWhitespace(char c) {
        return IS_UNICODE_WHITESPACE.get((int) c);
    }

    /** Returns true if the string is null, empty, or contains only unicode whitespace. */
    public static boolean isBlank(CharSequence cs) {
        if (cs != null) {
            for (int i = 0; i < cs.length(); i++) {
                if (!isUnicodeWhitespace(cs.charAt(i))) {
                    return false;
                }
            }
        }
        return true;
    }

    public static boolean isEmpty(CharSequence cs) {
        return cs == null || cs.length() == 0;
    }

    // -----------------------------------------------------------------------------------------------------

    /**
     * Strip the "Exception" suffix from a class name, if present, e.g. "MissingTemplateException" ->
     * "MissingTemplate".
     */
    public static String stripExceptionSuffix(String className) {
        return className.endsWith("Exception") ? className.substring(0, className.length() - 9) : className;
    }

    /**
     * Convert a class-style name into a variable-style name: underscores are dropped and the character after each
     * one is uppercased, then the first character is lowercased, i.e. "MissingWidget" -> "missingWidget",
     * "Missing_widget" -> "missingWidget".
     */
    public static String variableName(String name) {
        StringBuilder buf = new StringBuilder(name.length());
        boolean upcaseNext = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upcaseNext = buf.length() > 0;
            } else if (buf.length() == 0) {
                buf.append(Character.toLowerCase(c));
                upcaseNext = false;
            } else {
                buf.append(upcaseNext ? Character.toUpperCase(c) : c);
                upcaseNext = false;
            }
        }
        return buf.toString();
    }

    /**
     * Return the exception name without the "Exception" suffix, if present, and insert spaces at lowercase-uppercase
     * transitions, i.e. "MethodNotAllowedException" -> "Method Not Allowed".
     */
    public static String humanizeExceptionName(String className) {
        String name = stripExceptionSuffix(className);
        StringBuilder buf = new StringBuilder(64);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (buf.length() > 0 && Character.isLowerCase(buf.charAt(buf.length() - 1)) && Character.isUpperCase(c)) {
                buf.append(' ');
            }
            buf.append(c);
        }
        return buf.toString();
    }

    // -----------------------------------------------------------------------------------------------------

    public static String spaces(int n) {
        StringBuilder buf = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            buf.append(' ');
        }
        return buf.toString();
    }

    // -----------------------------------------------------------------------------------------------------

    /** Read all input from an InputStream and return it as a String. */
    public static String readWholeFile(InputStream inputStream) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        StringBuilder buf = new StringBuilder();
        for (String line; (line = reader.readLine()) != null;) {
            buf.append(line);
            buf.append('\n');
        }
        return buf.toString();
    }
}
