package dev.mars.spacetime.algebra.parser;

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

import dev.mars.spacetime.algebra.ast.Assignment;
import dev.mars.spacetime.algebra.ast.BinaryExpression;
import dev.mars.spacetime.algebra.ast.Conditional;
import dev.mars.spacetime.algebra.ast.DatasetReference;
import dev.mars.spacetime.algebra.ast.Expression;
import dev.mars.spacetime.algebra.ast.FunctionCall;
import dev.mars.spacetime.algebra.ast.MapReference;
import dev.mars.spacetime.algebra.ast.NullLiteral;
import dev.mars.spacetime.algebra.ast.NumberLiteral;
import dev.mars.spacetime.algebra.ast.TemporalExpression;
import dev.mars.spacetime.algebra.operator.CalculatorFunctions;
import dev.mars.spacetime.algebra.operator.OperatorFunction;
import dev.mars.spacetime.algebra.operator.TemporalOperator;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.relation.TemporalRelation;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for temporal algebra statements.
 * <p>
 * Precedence from loosest to tightest binding:
 * <ol>
 *   <li>temporal selection and hash: {@code :} {@code !:} {@code #} and their braced forms</li>
 *   <li>{@code ||}</li>
 *   <li>{@code &&}</li>
 *   <li>comparison: {@code == != < > <= >=}</li>
 *   <li>{@code + -}</li>
 *   <li>{@code * / %}</li>
 *   <li>unary minus, literals, names, function calls and parentheses</li>
 * </ol>
 * All binary levels associate to the left. Braced operators bind at the level
 * of their function.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-21
 * @version 1.0
 */
public final class AlgebraParser {

    private static final Set<OperatorFunction> SELECTION =
        EnumSet.of(OperatorFunction.SELECT, OperatorFunction.NOT_SELECT, OperatorFunction.HASH);
    private static final Set<OperatorFunction> ADDITIVE = EnumSet.of(OperatorFunction.ADD, OperatorFunction.SUBTRACT);
    private static final Set<OperatorFunction> MULTIPLICATIVE =
        EnumSet.of(OperatorFunction.MULTIPLY, OperatorFunction.DIVIDE, OperatorFunction.MODULO);

    private final String source;
    private final List<Token> tokens;
    private int current;

    private AlgebraParser(String source) {
        this.source = source;
        this.tokens = AlgebraLexer.tokenize(source);
    }

    /**
     * Parses {@code Result = expression}.
     *
     * @throws TemporalSyntaxException on any lexical, syntactic or relation name error
     */
    public static Assignment parse(String statement) {
        return new AlgebraParser(statement).statement();
    }

    /**
     * Parses a bare expression without assignment.
     */
    public static Expression parseExpression(String expression) {
        AlgebraParser parser = new AlgebraParser(expression);
        Expression result = parser.selection();
        parser.expect(TokenType.EOF, "end of expression");
        return result;
    }

    private Assignment statement() {
        Token target = expect(TokenType.NAME, "result dataset name");
        expect(TokenType.ASSIGN, "'='");
        Expression expression = selection();
        expect(TokenType.EOF, "end of expression");
        return new Assignment(target.text(), expression);
    }

    private Expression selection() {
        Expression left = logicalOr();
        while (true) {
            if (match(TokenType.SELECT)) {
                left = new TemporalExpression(TemporalOperator.simple(OperatorFunction.SELECT), left, logicalOr());
            } else if (match(TokenType.NOT_SELECT)) {
                left = new TemporalExpression(TemporalOperator.simple(OperatorFunction.NOT_SELECT), left, logicalOr());
            } else if (match(TokenType.HASH)) {
                left = new TemporalExpression(TemporalOperator.simple(OperatorFunction.HASH), left, logicalOr());
            } else {
                TemporalOperator operator = matchTemporal(SELECTION);
                if (operator == null) {
                    return left;
                }
                left = new TemporalExpression(operator, left, logicalOr());
            }
        }
    }

    private Expression logicalOr() {
        Expression left = logicalAnd();
        while (true) {
            if (match(TokenType.OR)) {
                left = new BinaryExpression("||", left, logicalAnd());
                continue;
            }
            TemporalOperator operator = matchTemporal(EnumSet.of(OperatorFunction.OR));
            if (operator == null) {
                return left;
            }
            left = new TemporalExpression(operator, left, logicalAnd());
        }
    }

    private Expression logicalAnd() {
        Expression left = comparison();
        while (true) {
            if (match(TokenType.AND)) {
                left = new BinaryExpression("&&", left, comparison());
                continue;
            }
            TemporalOperator operator = matchTemporal(EnumSet.of(OperatorFunction.AND));
            if (operator == null) {
                return left;
            }
            left = new TemporalExpression(operator, left, comparison());
        }
    }

    private Expression comparison() {
        Expression left = additive();
        while (peekAny(TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE)) {
            String operator = advance().text();
            left = new BinaryExpression(operator, left, additive());
        }
        return left;
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (true) {
            if (peekAny(TokenType.ADD, TokenType.SUB)) {
                String operator = advance().text();
                left = new BinaryExpression(operator, left, multiplicative());
                continue;
            }
            TemporalOperator operator = matchTemporal(ADDITIVE);
            if (operator == null) {
                return left;
            }
            left = new TemporalExpression(operator, left, multiplicative());
        }
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (true) {
            if (peekAny(TokenType.MULT, TokenType.DIV, TokenType.MOD)) {
                String operator = advance().text();
                left = new BinaryExpression(operator, left, unary());
                continue;
            }
            TemporalOperator operator = matchTemporal(MULTIPLICATIVE);
            if (operator == null) {
                return left;
            }
            left = new TemporalExpression(operator, left, unary());
        }
    }

    private Expression unary() {
        if (match(TokenType.SUB)) {
            Expression operand = unary();
            if (operand instanceof NumberLiteral number) {
                return new NumberLiteral(number.text().startsWith("-") ? number.text().substring(1) : "-" + number.text());
            }
            return new BinaryExpression("*", new NumberLiteral("-1"), operand);
        }
        return primary();
    }

    private Expression primary() {
        Token token = peek();
        if (match(TokenType.NUMBER)) {
            return new NumberLiteral(token.text());
        }
        if (match(TokenType.LPAREN)) {
            Expression inner = selection();
            expect(TokenType.RPAREN, "')'");
            return inner;
        }
        if (match(TokenType.NAME)) {
            if (!peek().is(TokenType.LPAREN)) {
                return new DatasetReference(token.text());
            }
            return call(token);
        }
        throw error("Unexpected " + token, token);
    }

    private Expression call(Token name) {
        String function = name.text();
        expect(TokenType.LPAREN, "'('");
        switch (function) {
            case "if":
                return conditional();
            case "map": {
                Token map = expect(TokenType.NAME, "map name");
                expect(TokenType.RPAREN, "')'");
                return new MapReference(map.text());
            }
            case "null":
                expect(TokenType.RPAREN, "')'");
                return new NullLiteral();
            default:
                break;
        }
        if (!CalculatorFunctions.isKnown(function)) {
            throw error("Unknown function '" + function + "'", name);
        }
        Expression argument = selection();
        expect(TokenType.RPAREN, "')'");
        return new FunctionCall(function, argument);
    }

    private Expression conditional() {
        Set<TemporalRelation> relations = EnumSet.of(TemporalRelation.EQUAL);
        if (peek().is(TokenType.TEMPORAL_OPERATOR)) {
            relations = TemporalOperator.parseRelations(advance().text());
            expect(TokenType.COMMA, "','");
        }
        Expression condition = selection();
        expect(TokenType.COMMA, "','");
        Expression then = selection();
        Expression otherwise = null;
        if (match(TokenType.COMMA)) {
            otherwise = selection();
        }
        expect(TokenType.RPAREN, "')'");
        return new Conditional(relations, condition, then, otherwise);
    }

    private TemporalOperator matchTemporal(Set<OperatorFunction> functions) {
        if (!peek().is(TokenType.TEMPORAL_OPERATOR)) {
            return null;
        }
        TemporalOperator operator = TemporalOperator.parse(peek().text());
        if (!functions.contains(operator.function())) {
            return null;
        }
        advance();
        return operator;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean peekAny(TokenType... types) {
        for (TokenType type : types) {
            if (peek().is(type)) {
                return true;
            }
        }
        return false;
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String description) {
        Token token = peek();
        if (!token.is(type)) {
            throw error("Expected " + description + " but found " + token, token);
        }
        return advance();
    }

    private TemporalSyntaxException error(String message, Token at) {
        return new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
            message + " at position " + at.position() + " in expression: " + source);
    }
}
