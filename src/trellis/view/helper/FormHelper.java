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
package trellis.view.helper;

import trellis.util.WebUtils;
import trellis.view.View;

/** Form tags. Forms post back to the current request target unless another action is given. */
public class FormHelper extends Helper {

    public FormHelper(View view) {
        super(view);
    }

    @Override
    protected String fragment(String fragment) {
        switch (fragment) {
        case "create":
            return create(null);
        case "end":
            return end();
        default:
            return null;
        }
    }

    public String create(String action) {
        if (action == null) {
            action = view.getRequest() == null ? "/" : view.getRequest().getRequestTarget();
        }
        return "<form method=\"post\" accept-charset=\"utf-8\" action=\"" + WebUtils.encodeForHTMLAttribute(action)
                + "\">";
    }

    public String end() {
        return "</form>";
    }

    public String text(String fieldName, Object value) {
        String name = WebUtils.encodeForHTMLAttribute(fieldName);
        return "<input type=\"text\" name=\"" + name + "\" id=\"" + name + "\" value=\""
                + (value == null ? "" : WebUtils.encodeForHTMLAttribute(value.toString())) + "\">";
    }
}
