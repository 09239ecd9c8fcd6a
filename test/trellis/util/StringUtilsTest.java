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
package trellis.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class StringUtilsTest {

    @Test
    public void testStripExceptionSuffix() {
        assertEquals("MissingTemplate", StringUtils.stripExceptionSuffix("MissingTemplateException"));
        assertEquals("", StringUtils.stripExceptionSuffix("Exception"));
        assertEquals("AssertionError", StringUtils.stripExceptionSuffix("AssertionError"));
    }

    @Test
    public void testVariableName() {
        assertEquals("missingWidget", StringUtils.variableName("MissingWidget"));
        assertEquals("someThing", StringUtils.variableName("Some_thing"));
        assertEquals("", StringUtils.variableName(""));
        assertEquals("x", StringUtils.variableName("_X"));
    }

    @Test
    public void testHumanizeExceptionName() {
        assertEquals("Method Not Allowed", StringUtils.humanizeExceptionName("MethodNotAllowedException"));
        assertEquals("Forbidden", StringUtils.humanizeExceptionName("ForbiddenException"));
    }

    @Test
    public void testIsBlank() {
        assertTrue(StringUtils.isBlank(null));
        assertTrue(StringUtils.isBlank(" \t\n" + StringUtils.NBSP_CHAR));
        assertFalse(StringUtils.isBlank(" {} "));
    }

    @Test
    public void testEncodeForHTML() {
        assertEquals("&lt;a href=&quot;x&quot;&gt;Tom &amp; Jerry&#x27;s&lt;/a&gt;",
                WebUtils.encodeForHTML("<a href=\"x\">Tom & Jerry's</a>"));
        StringBuilder buf = new StringBuilder();
        WebUtils.encodeForHTML("&lt; & &amp;", WebUtils.EscapeAmpersand.IF_NOT_VALID_ENTITY, true, buf);
        assertEquals("&lt; &amp; &amp;", buf.toString());
    }

    @Test
    public void testEscapeJSONString() {
        assertEquals("say \\\"hi\\\"\\n", WebUtils.escapeJSONString("say \"hi\"\n"));
    }
}
