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

import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One SQL statement with its bind parameters. Statements are collected by the
 * registration engine and executed together, or returned to callers in dry-run mode.
 *
 * @param sql        statement text with placeholders in the backend's style
 * @param parameters positional bind values
 */
public record SqlStatement(String sql, List<Object> parameters) {

    public SqlStatement {
        parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static SqlStatement of(String sql, Object... parameters) {
        return new SqlStatement(sql, Arrays.asList(parameters));
    }

    /**
     * Human readable form with parameters inlined, for logs and dry-run output only.
     */
    public String render() {
        String text = sql;
        for (Object parameter : parameters) {
            int idx = findPlaceholder(text);
            if (idx < 0) {
                break;
            }
            int length = text.startsWith("%s", idx) ? 2 : 1;
            text = text.substring(0, idx) + literal(parameter) + text.substring(idx + length);
        }
        return text;
    }

    private static int findPlaceholder(String text) {
        int q = text.indexOf('?');
        int f = text.indexOf("%s");
        if (q < 0) return f;
        if (f < 0) return q;
        return Math.min(q, f);
    }

    private static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof LocalDateTime) {
            return "'" + ((LocalDateTime) value).format(AbsoluteTemporalExtent.SQL_FORMAT) + "'";
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? sql : sql + " " + parameters.stream().map(String::valueOf)
            .collect(Collectors.joining(", ", "[", "]"));
    }
}
