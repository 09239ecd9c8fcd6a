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

import java.lang.reflect.Array;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import trellis.server.config.TrellisProperties;

public class JSON {
    /**
     * Recursively render JSON. Maps are rendered in iteration order, so that a view can control the order of keys
     * in the output. Objects of any other class are rendered as their toString() value, so that internal state of
     * arbitrary objects (exceptions in particular) is never exposed.
     */
    private static void toJSONRec(Object obj, boolean prettyPrint, int depth, StringBuilder buf) {
        if (obj == null) {
            buf.append("null");
            return;
        }
        Class<? extends Object> klass = obj.getClass();
        if (klass == Integer.class || klass == Boolean.class || klass == Long.class || klass == Short.class) {
            buf.append(obj.toString());

        } else if (klass == Float.class || klass == Double.class) {
            // NaN and the infinities have no JSON representation
            double val = ((Number) obj).doubleValue();
            buf.append(Double.isNaN(val) || Double.isInfinite(val) ? "null" : obj.toString());

        } else if (klass == Byte.class) {
            buf.append(Integer.toString(((Byte) obj).intValue()));

        } else if (klass.isArray() || List.class.isAssignableFrom(klass)) {
            // Render an array or list
            boolean isList = List.class.isAssignableFrom(klass);
            List<?> list = isList ? (List<?>) obj : null;
            int n = isList ? list.size() : Array.getLength(obj);
            if (n == 0) {
                buf.append(prettyPrint ? "[ ]" : "[]");
            } else {
                buf.append(prettyPrint ? "[ " : "[");
                for (int i = 0; i < n; i++) {
                    if (i > 0) {
                        buf.append(prettyPrint ? ", " : ",");
                    }
                    toJSONRec(isList ? list.get(i) : Array.get(obj, i), prettyPrint, depth + 1, buf);
                }
                buf.append(prettyPrint ? " ]" : "]");
            }

        } else if (Iterable.class.isAssignableFrom(klass)) {
            // Render an Iterable (e.g. a Set)
            buf.append(prettyPrint ? "[ " : "[");
            int i = 0;
            for (Object element : (Iterable<?>) obj) {
                if (i++ > 0) {
                    buf.append(prettyPrint ? ", " : ",");
                }
                toJSONRec(element, prettyPrint, depth + 1, buf);
            }
            buf.append(prettyPrint && i > 0 ? " ]" : "]");

        } else if (Map.class.isAssignableFrom(klass)) {
            // Render a Map as a JSON associative array
            Map<?, ?> map = (Map<?, ?>) obj;
            if (map.isEmpty()) {
                buf.append(prettyPrint ? "{ }" : "{}");
            } else {
                buf.append(prettyPrint ? "{\n" : "{");
                int remaining = map.size();
                for (Entry<?, ?> ent : map.entrySet()) {
                    if (prettyPrint) {
                        buf.append(StringUtils.spaces(depth + 1));
                    }
                    buf.append('"');
                    WebUtils.escapeJSONString(String.valueOf(ent.getKey()), buf);
                    buf.append(prettyPrint ? "\" : " : "\":");
                    toJSONRec(ent.getValue(), prettyPrint, depth + 1, buf);
                    if (--remaining > 0) {
                        buf.append(prettyPrint ? ",\n" : ",");
                    } else if (prettyPrint) {
                        buf.append('\n');
                    }
                }
                if (prettyPrint) {
                    buf.append(StringUtils.spaces(depth));
                }
                buf.append('}');
            }

        } else {
            // String, Character, or some other class -- render as a string
            buf.append('"');
            WebUtils.escapeJSONString(obj.toString(), buf);
            buf.append('"');
        }
    }

    /** Recursively render an Object (or array, list, map or set of objects) as JSON. */
    public static String toJSON(Object obj, boolean prettyPrint) {
        StringBuilder buf = new StringBuilder(1024);
        toJSONRec(obj, prettyPrint, 0, buf);
        return buf.toString();
    }

    /** Recursively render an Object (or array, list, map or set of objects) as JSON. */
    public static String toJSON(Object obj) {
        return toJSON(obj, TrellisProperties.PRETTY_PRINT_JSON);
    }

    /**
     * Parse a JSON document. Objects are returned as Maps, arrays as Lists.
     * 
     * @throws ParseException
     *             if the document is not valid JSON.
     */
    public static Object parse(String json) throws ParseException {
        return new JSONParser().parse(json);
    }

}
