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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class JSONTest {

    @Test
    public void testNumbers() {
        assertEquals("[1,2.5,0.5,7]", JSON.toJSON(Arrays.asList(1, 2.5, 0.5f, (byte) 7), false));
    }

    @Test
    public void testNonFiniteNumbersRenderAsNull() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("mean", Double.NaN);
        stats.put("max", Double.POSITIVE_INFINITY);
        stats.put("min", Float.NEGATIVE_INFINITY);
        stats.put("count", 0);
        assertEquals("{\"mean\":null,\"max\":null,\"min\":null,\"count\":0}", JSON.toJSON(stats, false));
    }
}
