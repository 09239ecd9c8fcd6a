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
package trellis.view;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import trellis.event.EventManager;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.util.JSON;

/**
 * Renders view variables as JSON. The view variable "_serialize" names the variables to output: a collection of
 * names renders a JSON object with one key per variable, a single name renders that variable's value on its own.
 * Without "_serialize", the view falls back to rendering a template.
 */
public class JsonView extends View {

    public static final String SERIALIZE_VAR = "_serialize";

    public JsonView(Request request, Response response, EventManager eventManager, ViewOptions options) {
        super(request, response, eventManager, options);
    }

    @Override
    public String render(String template, String layout) {
        Object serialize = viewVars.get(SERIALIZE_VAR);
        if (serialize == null) {
            return super.render(template, layout);
        }
        if (serialize instanceof Collection) {
            Map<String, Object> data = new LinkedHashMap<>();
            for (Object varName : (Collection<?>) serialize) {
                String key = varName.toString();
                if (viewVars.containsKey(key)) {
                    data.put(key, viewVars.get(key));
                }
            }
            return JSON.toJSON(data);
        }
        return JSON.toJSON(viewVars.get(serialize.toString()));
    }

    @Override
    public String getContentType() {
        return "json";
    }
}
