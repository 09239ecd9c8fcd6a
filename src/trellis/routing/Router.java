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
package trellis.routing;

import java.util.ArrayDeque;
import java.util.Deque;

import trellis.http.request.Request;

/**
 * Tracks the requests being handled. Requests are pushed when handling begins and popped when it ends; nested
 * requests (e.g. internal sub-requests) stack on top of the request that created them.
 */
public class Router {

    private final Deque<Request> requests = new ArrayDeque<>();

    public void pushRequest(Request request) {
        requests.push(request);
    }

    public Request popRequest() {
        return requests.poll();
    }

    /** Get the request currently being handled, or null if none. */
    public Request getRequest() {
        return requests.peek();
    }
}
