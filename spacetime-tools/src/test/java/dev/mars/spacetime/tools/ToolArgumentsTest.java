package dev.mars.spacetime.tools;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class ToolArgumentsTest {

    @Test
    void testParsesParametersFlagsAndOverwrite() {
        ToolArguments arguments = ToolArguments.parse("input=precip", "maps=a, b,,c", "-rf", "--o",
            "expression=R = A + B");

        assertEquals("precip", arguments.get("input"));
        assertEquals(List.of("a", "b", "c"), arguments.getList("maps"));
        assertEquals("R = A + B", arguments.get("expression"));
        assertTrue(arguments.hasFlag('r'));
        assertTrue(arguments.hasFlag('f'));
        assertFalse(arguments.hasFlag('i'));
        assertTrue(arguments.isOverwrite());
    }

    @Test
    void testDefaultsAndRequiredValues() {
        ToolArguments arguments = ToolArguments.parse("nprocs=4", "title= ");

        assertEquals("strds", arguments.get("type", "strds"));
        assertEquals(4, arguments.getInt("nprocs", 1));
        assertEquals(2, arguments.getInt("missing", 2));
        assertTrue(arguments.getList("maps").isEmpty());
        assertFalse(arguments.isOverwrite());

        TemporalSyntaxException blank = assertThrows(TemporalSyntaxException.class, () -> arguments.require("title"));
        assertEquals(SpaceTimeErrorCodes.INVALID_ARGUMENT, blank.getCode());
        assertThrows(TemporalSyntaxException.class, () -> arguments.require("output"));
    }

    @Test
    void testMalformedArguments() {
        assertThrows(TemporalSyntaxException.class, () -> ToolArguments.parse("precip"));
        assertThrows(TemporalSyntaxException.class, () -> ToolArguments.parse("=value"));
        assertThrows(TemporalSyntaxException.class, () -> ToolArguments.parse("--force"));
        assertThrows(TemporalSyntaxException.class, () -> ToolArguments.parse("input=a", "input=b"));
        assertThrows(TemporalSyntaxException.class, () -> ToolArguments.parse("nprocs=four").getInt("nprocs", 1));
    }

    @Test
    void testNegativeValueIsNotAFlag() {
        ToolArguments arguments = ToolArguments.parse("start=-5");

        assertEquals("-5", arguments.get("start"));
        assertFalse(arguments.hasFlag('5'));
    }

    @Test
    void testCheckAllowedRejectsUnknownNames() {
        ToolArguments arguments = ToolArguments.parse("input=a", "-g");
        arguments.checkAllowed(Set.of("input"), "gt");

        TemporalSyntaxException parameter = assertThrows(TemporalSyntaxException.class,
            () -> arguments.checkAllowed(Set.of("maps"), "g"));
        assertTrue(parameter.getMessage().contains("<input>"));
        TemporalSyntaxException flag = assertThrows(TemporalSyntaxException.class,
            () -> arguments.checkAllowed(Set.of("input"), "t"));
        assertTrue(flag.getMessage().contains("-g"));
    }
}
