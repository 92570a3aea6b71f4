package dev.mars.spacetime.algebra.ast;

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
 * Operation over the algebra syntax tree, one method per node type.
 *
 * @param <R> result of visiting a node
 */
public interface ExpressionVisitor<R> {

    R visitDataset(DatasetReference node);

    R visitNumber(NumberLiteral node);

    R visitMap(MapReference node);

    R visitNull(NullLiteral node);

    R visitFunction(FunctionCall node);

    R visitBinary(BinaryExpression node);

    R visitTemporal(TemporalExpression node);

    R visitConditional(Conditional node);
}
