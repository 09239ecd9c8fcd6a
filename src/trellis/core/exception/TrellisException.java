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
package trellis.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Superclass of all exceptions thrown by the framework. Carries an integer code (used as the HTTP status when the
 * exception is rendered, if it is in the range 400-505), a map of attributes, and response headers that should be
 * sent along with the error page.
 * 
 * Subclasses that describe a missing resource pass a message template and the attributes to fill it with, e.g. a
 * template of "Template file \"%s\" is missing." and an attribute "file".
 */
public class TrellisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Default code of framework exceptions. */
    public static final int DEFAULT_CODE = 500;

    private final int code;
    private final Map<String, Object> attributes;
    private Map<String, String> responseHeaders;

    public TrellisException(String msg) {
        this(msg, DEFAULT_CODE, null);
    }

    public TrellisException(String msg, int code) {
        this(msg, code, null);
    }

    public TrellisException(String msg, int code, Throwable cause) {
        super(msg, cause);
        this.code = code;
        this.attributes = new LinkedHashMap<>();
    }

    /**
     * Construct an exception whose message is produced by substituting the attribute values, in insertion order,
     * into messageTemplate.
     */
    protected TrellisException(String messageTemplate, Map<String, ?> attributes, int code, Throwable cause) {
        super(String.format(messageTemplate, attributes.values().toArray()), cause);
        this.code = code;
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public int getCode() {
        return code;
    }

    /** Get the attributes that describe this exception. In debug mode these are exposed to error templates. */
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    /** Add a header that should be sent in the response when this exception is rendered. */
    public TrellisException setResponseHeader(String name, String value) {
        if (responseHeaders == null) {
            responseHeaders = new LinkedHashMap<>();
        }
        responseHeaders.put(name, value);
        return this;
    }

    /** Get the headers that should be sent in the response when this exception is rendered. */
    public Map<String, String> getResponseHeaders() {
        return responseHeaders == null ? Collections.<String, String> emptyMap()
                : Collections.unmodifiableMap(responseHeaders);
    }

    /** Build an attribute map with a single entry. */
    protected static Map<String, Object> attributes(String name, Object value) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(name, value);
        return attributes;
    }
}
