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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an algebra expression into tokens.
 * <p>
 * Names may contain letters, digits, underscores, dots and one {@code @mapset}
 * suffix. Everything between a pair of braces is kept as a single
 * {@link TokenType#TEMPORAL_OPERATOR} token and interpreted by the parser.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-21
 * @version 1.0
 */
public final class AlgebraLexer {

    private final String input;
    private int position;

    private AlgebraLexer(String input) {
        this.input = input;
    }

    public static List<Token> tokenize(String expression) {
        if (expression == null) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR, "Expression must not be null");
        }
        return new AlgebraLexer(expression).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", position));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private Token next() {
        int start = position;
        char c = input.charAt(position);

        if (Character.isLetter(c) || c == '_') {
            return name(start);
        }
        if (Character.isDigit(c) || (c == '.' && position + 1 < input.length()
                && Character.isDigit(input.charAt(position + 1)))) {
            return number(start);
        }
        if (c == '{') {
            int close = input.indexOf('}', position);
            if (close < 0) {
                throw error("Unterminated temporal operator", start);
            }
            position = close + 1;
            return new Token(TokenType.TEMPORAL_OPERATOR, input.substring(start + 1, close).trim(), start);
        }

        switch (c) {
            case '(': return single(TokenType.LPAREN);
            case ')': return single(TokenType.RPAREN);
            case ',': return single(TokenType.COMMA);
            case '+': return single(TokenType.ADD);
            case '-': return single(TokenType.SUB);
            case '*': return single(TokenType.MULT);
            case '/': return single(TokenType.DIV);
            case '%': return single(TokenType.MOD);
            case ':': return single(TokenType.SELECT);
            case '#': return single(TokenType.HASH);
            case '=': return pair('=', TokenType.EQ, TokenType.ASSIGN);
            case '<': return pair('=', TokenType.LE, TokenType.LT);
            case '>': return pair('=', TokenType.GE, TokenType.GT);
            case '!':
                if (peek(1) == '=') {
                    return fixed(TokenType.NE, 2);
                }
                if (peek(1) == ':') {
                    return fixed(TokenType.NOT_SELECT, 2);
                }
                break;
            case '&':
                if (peek(1) == '&') {
                    return fixed(TokenType.AND, 2);
                }
                break;
            case '|':
                if (peek(1) == '|') {
                    return fixed(TokenType.OR, 2);
                }
                break;
            default:
                break;
        }
        throw error("Unexpected character '" + c + "'", start);
    }

    private Token name(int start) {
        boolean mapset = false;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                position++;
            } else if (c == '@' && !mapset) {
                mapset = true;
                position++;
            } else {
                break;
            }
        }
        return new Token(TokenType.NAME, input.substring(start, position), start);
    }

    private Token number(int start) {
        boolean dot = false;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isDigit(c)) {
                position++;
            } else if (c == '.' && !dot) {
                dot = true;
                position++;
            } else {
                break;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, position), start);
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private Token single(TokenType type) {
        return fixed(type, 1);
    }

    private Token fixed(TokenType type, int length) {
        Token token = new Token(type, input.substring(position, position + length), position);
        position += length;
        return token;
    }

    private Token pair(char second, TokenType twoChar, TokenType oneChar) {
        return peek(1) == second ? fixed(twoChar, 2) : fixed(oneChar, 1);
    }

    private TemporalSyntaxException error(String message, int at) {
        return new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
            message + " at position " + at + " in expression: " + input);
    }
}
