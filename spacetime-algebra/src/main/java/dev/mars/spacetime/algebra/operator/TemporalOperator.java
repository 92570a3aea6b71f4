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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.relation.TemporalRelation;

import java.util.EnumSet;
import java.util.Set;

/**
 * A braced temporal operator {@code {function, relation|relation, mode[, aggregate]}}.
 * <p>
 * Only the function is positional; relations default to {@code equal}, the
 * mode to {@code l}. A leading relation list without a function, such as
 * {@code {equal}}, stands for {@code {+,equal}}.
 *
 * @param function   the operation applied to related maps
 * @param relations  temporal relations that pair a left map with right maps
 * @param mode       how the result extent is derived
 * @param aggregate  {@code |} or {@code &} joining several related maps of a logical operator, or null
 */
public record TemporalOperator(OperatorFunction function, Set<TemporalRelation> relations, ExtentMode mode,
                               String aggregate) {

    public TemporalOperator {
        relations = relations.isEmpty() ? EnumSet.of(TemporalRelation.EQUAL) : EnumSet.copyOf(relations);
    }

    /** Operator of an unbraced binary expression. */
    public static TemporalOperator simple(OperatorFunction function) {
        return new TemporalOperator(function, EnumSet.of(TemporalRelation.EQUAL), ExtentMode.LEFT, null);
    }

    /**
     * @param content the text between the braces
     * @throws TemporalSyntaxException for unknown relations, modes or extra parts
     */
    public static TemporalOperator parse(String content) {
        String[] parts = content.split(",", -1);
        int index = 0;

        OperatorFunction function = OperatorFunction.fromSymbol(parts[0]);
        if (function != null) {
            index++;
        } else {
            function = OperatorFunction.ADD;
        }

        Set<TemporalRelation> relations = EnumSet.noneOf(TemporalRelation.class);
        if (index < parts.length && !parts[index].trim().isEmpty() && !ExtentMode.isMode(parts[index])) {
            relations.addAll(TemporalRelation.parseList(parts[index]));
            index++;
        } else if (index < parts.length && parts[index].trim().isEmpty()) {
            index++;
        }

        ExtentMode mode = ExtentMode.LEFT;
        if (index < parts.length && !parts[index].trim().isEmpty()) {
            mode = ExtentMode.fromText(parts[index]);
        }
        index++;

        String aggregate = null;
        if (index < parts.length) {
            aggregate = parts[index].trim();
            if (!aggregate.equals("|") && !aggregate.equals("&")) {
                throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
                    "Unknown aggregation operator '" + aggregate + "' in {" + content + "}");
            }
            if (!function.isLogical()) {
                throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
                    "Aggregation is only allowed for && and || in {" + content + "}");
            }
            index++;
        }
        if (index < parts.length) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
                "Too many parts in temporal operator {" + content + "}");
        }
        return new TemporalOperator(function, relations, mode, aggregate);
    }

    /** A braced relation list as used by temporal conditions, {@code {equal|during}}. */
    public static Set<TemporalRelation> parseRelations(String content) {
        Set<TemporalRelation> relations = TemporalRelation.parseList(content);
        if (relations.isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
                "Empty relation list {" + content + "}");
        }
        return relations;
    }
}
