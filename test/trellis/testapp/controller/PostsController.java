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
package trellis.testapp.controller;

import java.util.ArrayList;
import java.util.List;

import trellis.controller.Controller;
import trellis.event.Event;
import trellis.http.request.Request;
import trellis.http.response.Response;

public class PostsController extends Controller {

    public final List<String> lifecycle = new ArrayList<>();

    public PostsController(Request request, Response response) {
        super(request, response);
    }

    @Override
    public void beforeFilter(Event event) {
        lifecycle.add("beforeFilter");
    }

    @Override
    public void beforeRender(Event event) {
        lifecycle.add("beforeRender");
    }

    @Override
    public void afterFilter(Event event) {
        lifecycle.add("afterFilter");
    }
}
