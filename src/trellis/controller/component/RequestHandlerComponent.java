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
package trellis.controller.component;

import java.util.LinkedHashMap;
import java.util.Map;

import org.json.simple.parser.ParseException;

import trellis.controller.Component;
import trellis.controller.ComponentRegistry;
import trellis.event.Event;
import trellis.http.exception.BadRequestException;
import trellis.http.request.Request;
import trellis.util.JSON;
import trellis.util.Log;
import trellis.util.StringUtils;

/**
 * Content-type handling: decodes JSON request bodies into the request data on startup, and switches the view class
 * to the JSON view before rendering when the client asks for JSON and not HTML.
 */
public class RequestHandlerComponent extends Component {

    public static final String JSON_TYPE = "application/json";

    public RequestHandlerComponent(ComponentRegistry registry, Map<String, Object> config) {
        super(registry, config);
    }

    /**
     * Decode the request body into the request data, if the body is JSON.
     * 
     * @throws BadRequestException
     *             if the body is not valid JSON.
     */
    @Override
    public void startup(Event event) {
        Request request = getController().getRequest();
        if (!JSON_TYPE.equals(request.getContentType()) || StringUtils.isBlank(request.getBody())) {
            return;
        }
        Object parsed;
        try {
            parsed = JSON.parse(request.getBody());
        } catch (ParseException e) {
            throw new BadRequestException("Malformed JSON request body", e);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        if (parsed instanceof Map) {
            for (Map.Entry<?, ?> ent : ((Map<?, ?>) parsed).entrySet()) {
                data.put(String.valueOf(ent.getKey()), ent.getValue());
            }
        } else {
            data.put("_json", parsed);
        }
        request.setData(data);
        Log.fine("Decoded JSON request body of " + request);
    }

    @Override
    public void beforeRender(Event event) {
        if (prefersJson()) {
            getController().viewBuilder().setClassName("Json");
        }
    }

    /** Returns true if the request accepts JSON responses, but not HTML. */
    public boolean prefersJson() {
        Request request = getController().getRequest();
        return request.accepts(JSON_TYPE) && !request.accepts("text/html");
    }
}
