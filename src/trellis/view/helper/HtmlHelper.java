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

/** Common HTML tags. */
public class HtmlHelper extends Helper {

    public HtmlHelper(View view) {
        super(view);
    }

    @Override
    protected String fragment(String fragment) {
        switch (fragment) {
        case "charset":
            return charset();
        case "homeLink":
            return link("Home", "/");
        case "requestLink":
            return view.getRequest() == null ? ""
                    : link(view.getRequest().getRequestTarget(), view.getRequest().getRequestTarget());
        default:
            return null;
        }
    }

    public String charset() {
        return "<meta charset=\"utf-8\">";
    }

    public String link(String title, String url) {
        return "<a href=\"" + WebUtils.encodeForHTMLAttribute(url) + "\">" + escape(title) + "</a>";
    }

    /** Wrap escaped text in a tag with an optional class. */
    public String tag(String tagName, String text, String cssClass) {
        StringBuilder buf = new StringBuilder();
        buf.append('<').append(tagName);
        if (!isEmpty(cssClass)) {
            buf.append(" class=\"").append(WebUtils.encodeForHTMLAttribute(cssClass)).append('"');
        }
        buf.append('>').append(escape(text)).append("</").append(tagName).append('>');
        return buf.toString();
    }
}
