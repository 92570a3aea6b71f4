package dev.mars.spacetime.api.database;

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
 * Bind-parameter placeholder style reported by a database backend.
 */
public enum ParamStyle {
    /** {@code ?} placeholders (JDBC, SQLite). */
    QMARK("?"),
    /** {@code %s} placeholders (psycopg style drivers). */
    FORMAT("%s");

    private final String placeholder;

    ParamStyle(String placeholder) {
        this.placeholder = placeholder;
    }

    public String placeholder() {
        return placeholder;
    }

    /**
     * Rewrites a statement written with {@code ?} placeholders into this style.
     */
    public String apply(String sqlWithQmarks) {
        return this == QMARK ? sqlWithQmarks : sqlWithQmarks.replace("?", placeholder);
    }
}
