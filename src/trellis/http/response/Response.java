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
package trellis.http.response;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;

/**
 * An outbound HTTP response: status, headers, content type and a string body. Setters return this, so calls can be
 * chained.
 */
public class Response {
    protected HttpResponseStatus status = HttpResponseStatus.OK;
    protected final HttpHeaders headers = new DefaultHttpHeaders();
    protected String contentType = "text/html;charset=utf-8";
    protected String body = "";

    public Response() {
    }

    public Response(HttpResponseStatus status) {
        this.status = status;
    }

    // -----------------------------------------------------------------------------------------------------

    public int getStatusCode() {
        return status.code();
    }

    public Response setStatus(HttpResponseStatus status) {
        this.status = status;
        return this;
    }

    public Response setStatus(int code) {
        this.status = HttpResponseStatus.valueOf(code);
        return this;
    }

    // -----------------------------------------------------------------------------------------------------

    public Response setHeader(CharSequence key, Object value) {
        headers.set(key, value);
        return this;
    }

    public String getHeader(CharSequence key) {
        return headers.get(key);
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    // -----------------------------------------------------------------------------------------------------

    /**
     * Set the content type, either as a full media type ("application/xml") or as one of the shorthands "html",
     * "json" or "text".
     */
    public Response setContentType(String type) {
        switch (type) {
        case "html":
            this.contentType = "text/html;charset=utf-8";
            break;
        case "json":
            this.contentType = "application/json;charset=utf-8";
            break;
        case "text":
            this.contentType = "text/plain;charset=utf-8";
            break;
        default:
            this.contentType = type;
        }
        return this;
    }

    public String getContentType() {
        return contentType;
    }

    public Response setBody(String body) {
        this.body = body == null ? "" : body;
        return this;
    }

    public String getBody() {
        return body;
    }

    // -----------------------------------------------------------------------------------------------------

    /** Convert this response into a Netty response that can be written to a channel. */
    public FullHttpResponse toHttpResponse() {
        byte[] content = body.getBytes(StandardCharsets.UTF_8);
        DefaultFullHttpResponse httpRes = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.wrappedBuffer(content));
        httpRes.headers().add(headers);
        httpRes.headers().set(CONTENT_TYPE, contentType);
        httpRes.headers().set(CONTENT_LENGTH, content.length);
        return httpRes;
    }

    @Override
    public String toString() {
        return status + " (" + contentType + ", " + body.length() + " chars)";
    }
}
