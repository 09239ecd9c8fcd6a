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

import trellis.util.Log;
import trellis.util.StringUtils;
import trellis.util.WebUtils;
import trellis.view.View;

/**
 * A named utility available to templates. A template references a fragment of a helper as "${Html.charset}", which
 * is replaced by the (unescaped) result of renderFragment("charset") on the view's Html helper. Subclasses need a
 * public constructor taking the View.
 */
public abstract class Helper {

    protected final View view;

    public Helper(View view) {
        this.view = view;
    }

    /** The short name of this helper, e.g. "Html" for HtmlHelper. */
    public String getName() {
        String className = getClass().getSimpleName();
        return className.endsWith("Helper") ? className.substring(0, className.length() - 6) : className;
    }

    /**
     * Render a named fragment of HTML. Unknown fragments render as the empty string.
     */
    public String renderFragment(String fragment) {
        String html = fragment(fragment);
        if (html == null) {
            Log.warning("Helper " + getName() + " has no fragment \"" + fragment + "\"");
            return "";
        }
        return html;
    }

    /** Return the HTML for the named fragment, or null if this helper has no such fragment. */
    protected abstract String fragment(String fragment);

    /** Escape text for insertion into HTML. */
    protected static String escape(Object text) {
        return text == null ? "" : WebUtils.encodeForHTML(text.toString());
    }

    protected static boolean isEmpty(String str) {
        return StringUtils.isEmpty(str);
    }
}
