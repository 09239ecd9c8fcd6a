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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import trellis.core.Plugins;
import trellis.core.exception.MissingPluginException;
import trellis.event.EventManager;
import trellis.http.request.Request;
import trellis.http.response.Response;
import trellis.view.exception.MissingHelperException;
import trellis.view.exception.MissingLayoutException;
import trellis.view.exception.MissingTemplateException;
import trellis.view.helper.FormHelper;

public class ViewTest {

    @AfterEach
    public void unloadPlugins() {
        Plugins.unloadAll();
    }

    private static Map<String, Object> vars(Object... keyValues) {
        Map<String, Object> vars = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            vars.put((String) keyValues[i], keyValues[i + 1]);
        }
        return vars;
    }

    private static ViewBuilder posts() {
        return new ViewBuilder().setTemplatePath("Posts").enableAutoLayout(false);
    }

    @Test
    public void testRenderEscapesVariables() {
        String html = posts().build(vars("title", "Fish & <Chips>")).render("index", null);
        assertTrue(html.contains("<h1>Fish &amp; &lt;Chips&gt;</h1>"), html);
    }

    @Test
    public void testUnknownVariablesRenderEmpty() {
        String html = posts().build(null).render("index", null);
        assertTrue(html.contains("<h1></h1>"), html);
    }

    @Test
    public void testSetAddsToBuiltVars() {
        View view = posts().build(vars("title", "x"));
        view.set(vars("subtitle", "y"));
        assertEquals("x", view.getVars().get("title"));
        assertEquals("y", view.getVars().get("subtitle"));
        assertThrows(UnsupportedOperationException.class, () -> view.getVars().put("title", "z"));
    }

    @Test
    public void testMapValuesByKey() {
        String html = posts().build(vars("post", Collections.singletonMap("title", "First post"))).render("item",
                null);
        assertEquals("<li>First post</li>", html.trim());
    }

    @Test
    public void testHelperFragments() {
        String html = posts().addHelper("Html").build(vars("title", "x")).render("index", null);
        assertTrue(html.contains("<p><meta charset=\"utf-8\"></p>"), html);
    }

    @Test
    public void testFormHelper() {
        Request request = new Request(
                new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/posts?page=2&sort=date"));
        View view = posts().addHelper("Form").build(null, request, null, null);
        FormHelper form = (FormHelper) view.getHelper("Form");
        assertEquals("<form method=\"post\" accept-charset=\"utf-8\" action=\"/posts?page=2&amp;sort=date\">",
                form.create(null));
        assertEquals("</form>", form.end());
        assertEquals("<input type=\"text\" name=\"title\" id=\"title\" value=\"&quot;Hi&quot;\">",
                form.text("title", "\"Hi\""));
    }

    @Test
    public void testApplicationHelper() {
        View view = posts().addHelper("Shout").build(null);
        assertEquals("<b>HELLO</b>", view.getHelper("Shout").renderFragment("hello"));
    }

    @Test
    public void testMissingHelper() {
        View view = posts().addHelper("Nonexistent").build(vars("title", "x"));
        assertThrows(MissingHelperException.class, () -> view.render("index", null));
    }

    @Test
    public void testThemeTemplatesTakePrecedence() {
        String html = posts().setTheme("Dark").build(vars("title", "x")).render("index", null);
        assertTrue(html.contains("<h1 class=\"dark\">x</h1>"), html);

        // Templates missing from the theme come from the application
        html = posts().setTheme("Dark").build(vars("post", null)).render("item", null);
        assertEquals("<li></li>", html.trim());
    }

    @Test
    public void testPluginTemplates() {
        Plugins.load("Blog", "trellis.testapp.blog");
        String html = posts().setPlugin("Blog").build(vars("title", "x")).render("index", null);
        assertTrue(html.contains("<h1 class=\"blog\">x</h1>"), html);
    }

    @Test
    public void testPluginMustBeLoaded() {
        View view = posts().setPlugin("Blog").build(vars("title", "x"));
        MissingPluginException e = assertThrows(MissingPluginException.class, () -> view.render("index", null));
        assertEquals("Blog", e.getPlugin());
    }

    @Test
    public void testMissingTemplate() {
        View view = posts().setTheme("Dark").build(null);
        MissingTemplateException e = assertThrows(MissingTemplateException.class,
                () -> view.render("archive", null));
        assertEquals("Posts/archive.html", e.getFile());
        assertEquals(Arrays.asList("templates/themes/Dark/", "templates/"), e.getAttribute("paths"));
    }

    @Test
    public void testLayout() {
        String html = posts().enableAutoLayout(true).setLayoutPath("admin").build(vars("title", "x"))
                .render("index", "main");
        assertTrue(html.startsWith("<div id=\"admin\"><h1>x</h1>"), html);
    }

    @Test
    public void testMissingLayout() {
        View view = posts().enableAutoLayout(true).build(vars("title", "x"));
        MissingLayoutException e = assertThrows(MissingLayoutException.class, () -> view.render("index", "none"));
        assertEquals("Layout/none.html", e.getFile());
    }

    @Test
    public void testRenderEvents() {
        EventManager eventManager = new EventManager();
        List<String> events = new ArrayList<>();
        eventManager.on(View.BEFORE_RENDER, e -> events.add(e.getName() + " " + e.getData("file")));
        eventManager.on(View.AFTER_RENDER, e -> events.add(e.getName() + " " + e.getData("file")));
        eventManager.on(View.BEFORE_LAYOUT, e -> events.add(e.getName() + " " + e.getData("file")));
        posts().enableAutoLayout(true).setLayoutPath("admin")
                .build(vars("title", "x"), Request.fromDefaults(), new Response(), eventManager).render("index",
                        "main");
        assertEquals(Arrays.asList("View.beforeRender Posts/index.html", "View.afterRender Posts/index.html",
                "View.beforeLayout Layout/admin/main.html"), events);
    }

    @Test
    public void testJsonViewSerializesNamedVariables() {
        View view = new ViewBuilder().setClassName("Json")
                .build(vars("id", 3, "title", "Hi", "secret", "s", "_serialize", Arrays.asList("id", "title")));
        assertEquals("{\"id\":3,\"title\":\"Hi\"}", view.render());
        assertEquals("json", view.getContentType());

        view = new ViewBuilder().setClassName("Json").build(vars("tags", Arrays.asList("a", "b"), "_serialize",
                "tags"));
        assertEquals("[\"a\",\"b\"]", view.render());
    }

    @Test
    public void testJsonViewWithoutSerializeRendersTemplate() {
        String html = posts().setClassName("Json").build(vars("title", "x")).render("index", null);
        assertTrue(html.contains("<h1>x</h1>"), html);
    }
}
