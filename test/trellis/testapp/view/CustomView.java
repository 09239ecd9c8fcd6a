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
package trellis.testapp.view;

import trellis.event.EventManager;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.view.View;
import trellis.view.ViewOptions;

/** An application view, resolved by the short name "Custom". */
public class CustomView extends View {

    public static int constructed;

    public CustomView(Request request, Response response, EventManager eventManager, ViewOptions options) {
        super(request, response, eventManager, options);
        constructed++;
    }

    @Override
    public String render(String template, String layout) {
        return "custom:" + (template == null ? this.template : template);
    }
}
