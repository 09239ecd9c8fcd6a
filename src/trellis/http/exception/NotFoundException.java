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
package trellis.http.exception;

import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * This exception is thrown when a user tries to access a resource that doesn't exist (404).
 */
public class NotFoundException extends HttpException {

    private static final long serialVersionUID = 1L;

    public NotFoundException() {
        super(HttpResponseStatus.NOT_FOUND);
    }

    public NotFoundException(String msg) {
        super(HttpResponseStatus.NOT_FOUND, msg, null);
    }

    public NotFoundException(String msg, Throwable cause) {
        super(HttpResponseStatus.NOT_FOUND, msg, cause);
    }
}
