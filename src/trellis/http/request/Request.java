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
package trellis.http.request;

import static io.netty.handler.codec.http.HttpHeaderNames.ACCEPT;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpHeaderNames.HOST;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpVersion;
import trellis.server.config.TrellisProperties;

/** An inbound HTTP request, wrapping a Netty HttpRequest. */
public class Request {
    private final HttpRequest httpReq;

    private final HttpMethod method;
    private final String body;

    /** Request body data, as decoded by a body parser. */
    private Map<String, Object> data = new LinkedHashMap<>();

    /** Routing parameters, e.g. "plugin", "controller", "action". */
    private final Map<String, String> params = new LinkedHashMap<>();

    // -----------------------------------------------------------------------------------------------------

    public Request(HttpRequest httpReq) {
        this.httpReq = httpReq;
        this.method = httpReq.method();

        if (httpReq instanceof FullHttpRequest) {
            this.body = ((FullHttpRequest) httpReq).content().toString(StandardCharsets.UTF_8);
        } else {
            this.body = "";
        }
    }

    /**
     * Build a GET request for the root URL of the configured server host. Used when an error has to be rendered
     * outside of the handling of any request.
     */
    public static Request fromDefaults() {
        DefaultFullHttpRequest httpReq = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/");
        httpReq.headers().set(HOST, TrellisProperties.SERVER_HOST);
        return new Request(httpReq);
    }

    // -----------------------------------------------------------------------------------------------------

    public HttpMethod getMethod() {
        return method;
    }

    /** The request target as sent by the client: the path plus any query string. */
    public String getRequestTarget() {
        return httpReq.uri();
    }

    public HttpHeaders getHeaders() {
        return httpReq.headers();
    }

    public String getHeader(CharSequence name) {
        return httpReq.headers().get(name);
    }

    public String getHost() {
        return getHeader(HOST);
    }

    /** The media type of the request body, without parameters, e.g. "application/json". */
    public String getContentType() {
        String contentType = getHeader(CONTENT_TYPE);
        if (contentType == null) {
            return null;
        }
        int semiIdx = contentType.indexOf(';');
        return (semiIdx < 0 ? contentType : contentType.substring(0, semiIdx)).trim().toLowerCase();
    }

    /** Returns true if the Accept header lists the given media type. */
    public boolean accepts(String mediaType) {
        String accept = getHeader(ACCEPT);
        if (accept == null) {
            return false;
        }
        for (String part : accept.split(",")) {
            int semiIdx = part.indexOf(';');
            String type = (semiIdx < 0 ? part : part.substring(0, semiIdx)).trim();
            if (type.equalsIgnoreCase(mediaType)) {
                return true;
            }
        }
        return false;
    }

    public String getBody() {
        return body;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    public Object getData(String key) {
        return data.get(key);
    }

    public Request setData(Map<String, Object> data) {
        this.data = new LinkedHashMap<>(data);
        return this;
    }

    public String getParam(String name) {
        return params.get(name);
    }

    public Request setParam(String name, String value) {
        params.put(name, value);
        return this;
    }

    @Override
    public String toString() {
        return method + " " + getRequestTarget();
    }
}
