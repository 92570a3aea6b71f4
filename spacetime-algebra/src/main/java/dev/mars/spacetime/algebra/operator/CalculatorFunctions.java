package dev.mars.spacetime.algebra.operator;

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

import java.util.Map;

/**
 * One-argument map calculator functions accepted by the algebra.
 */
public final class CalculatorFunctions {

    private static final Map<String, String> RENDERED = Map.ofEntries(
        Map.entry("abs", "abs"),
        Map.entry("log", "log"),
        Map.entry("sqrt", "sqrt"),
        Map.entry("exp", "exp"),
        Map.entry("cos", "cos"),
        Map.entry("acos", "acos"),
        Map.entry("sin", "sin"),
        Map.entry("asin", "asin"),
        Map.entry("tan", "tan"),
        Map.entry("double", "double"),
        Map.entry("float", "float"),
        Map.entry("int", "int"),
        Map.entry("isnull", "isnull"),
        Map.entry("isntnull", "!isnull"),
        Map.entry("exist", "exist"));

    private CalculatorFunctions() {
    }

    public static boolean isKnown(String function) {
        return RENDERED.containsKey(function);
    }

    /** {@code isntnull(x)} renders as {@code !isnull(x)}. */
    public static String render(String function, String argument) {
        String name = RENDERED.get(function);
        if (name == null) {
            throw new IllegalArgumentException("Unknown calculator function " + function);
        }
        return name + "(" + argument + ")";
    }
}
