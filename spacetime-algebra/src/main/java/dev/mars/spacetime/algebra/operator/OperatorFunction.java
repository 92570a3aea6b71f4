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

/**
 * The function part of a temporal operator.
 */
public enum OperatorFunction {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    AND("&&"),
    OR("||"),
    SELECT(":"),
    NOT_SELECT("!:"),
    HASH("#");

    private final String symbol;

    OperatorFunction(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isSelection() {
        return this == SELECT || this == NOT_SELECT;
    }

    /** Null when {@code text} is not a function symbol. */
    public static OperatorFunction fromSymbol(String text) {
        String value = text.trim();
        for (OperatorFunction function : values()) {
            if (function.symbol.equals(value)) {
                return function;
            }
        }
        return null;
    }
}
