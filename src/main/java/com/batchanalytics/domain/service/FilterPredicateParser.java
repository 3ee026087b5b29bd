package com.batchanalytics.domain.service;

import com.batchanalytics.domain.exception.InvalidFilterPredicateException;
import com.batchanalytics.domain.model.FilterPredicate;
import com.batchanalytics.domain.model.FilterPredicate.Condition;
import com.batchanalytics.domain.model.FilterPredicate.Connector;
import com.batchanalytics.domain.model.FilterPredicate.Operator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the resource filter text stored with a rule.
 *
 * Accepted grammar:
 * <pre>
 * predicate := condition ((AND | OR) condition)*
 * condition := column op value | column IN '(' value (',' value)* ')'
 * op        := = | != | &lt;&gt; | &lt; | &lt;= | &gt; | &gt;= | LIKE
 * value     := 'text' | number | TRUE | FALSE
 * </pre>
 * Rule content is untrusted, so anything outside the grammar is rejected rather than
 * passed through to SQL.
 */
@Component
public class FilterPredicateParser {

    public FilterPredicate parse(String ruleId, String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return new Cursor(ruleId, text).parsePredicate();
    }

    private static final class Cursor {
        private final String ruleId;
        private final String text;
        private int pos;

        Cursor(String ruleId, String text) {
            this.ruleId = ruleId;
            this.text = text;
        }

        FilterPredicate parsePredicate() {
            List<Condition> conditions = new ArrayList<>();
            List<Connector> connectors = new ArrayList<>();
            conditions.add(parseCondition());
            skipWhitespace();
            while (!atEnd()) {
                String word = readWord();
                Connector connector = switch (word.toUpperCase(Locale.ROOT)) {
                    case "AND" -> Connector.AND;
                    case "OR" -> Connector.OR;
                    default -> throw error("expected AND or OR but found '" + word + "'");
                };
                connectors.add(connector);
                conditions.add(parseCondition());
                skipWhitespace();
            }
            return new FilterPredicate(conditions, connectors);
        }

        private Condition parseCondition() {
            String column = parseIdentifier();
            Operator operator = parseOperator();
            List<Object> values = new ArrayList<>();
            if (operator == Operator.IN) {
                expect('(');
                values.add(parseValue());
                skipWhitespace();
                while (peek() == ',') {
                    pos++;
                    values.add(parseValue());
                    skipWhitespace();
                }
                expect(')');
            } else {
                values.add(parseValue());
            }
            return new Condition(column, operator, values);
        }

        private String parseIdentifier() {
            skipWhitespace();
            if (peek() == '"') {
                pos++;
                StringBuilder name = new StringBuilder();
                while (true) {
                    if (atEnd()) {
                        throw error("unterminated quoted identifier");
                    }
                    char c = text.charAt(pos++);
                    if (c == '"') {
                        if (peek() == '"') {
                            name.append('"');
                            pos++;
                            continue;
                        }
                        break;
                    }
                    name.append(c);
                }
                if (name.length() == 0) {
                    throw error("empty identifier");
                }
                return name.toString();
            }
            String word = readWord();
            if (word.isEmpty() || !Character.isLetter(word.charAt(0)) && word.charAt(0) != '_') {
                throw error("expected a column name at position " + pos);
            }
            return word;
        }

        private Operator parseOperator() {
            skipWhitespace();
            if (atEnd()) {
                throw error("missing operator");
            }
            char c = text.charAt(pos);
            if (c == '=') {
                pos++;
                return Operator.EQ;
            }
            if (c == '!' && next() == '=') {
                pos += 2;
                return Operator.NE;
            }
            if (c == '<') {
                pos++;
                if (peek() == '=') {
                    pos++;
                    return Operator.LE;
                }
                if (peek() == '>') {
                    pos++;
                    return Operator.NE;
                }
                return Operator.LT;
            }
            if (c == '>') {
                pos++;
                if (peek() == '=') {
                    pos++;
                    return Operator.GE;
                }
                return Operator.GT;
            }
            String word = readWord().toUpperCase(Locale.ROOT);
            return switch (word) {
                case "LIKE" -> Operator.LIKE;
                case "IN" -> Operator.IN;
                default -> throw error("unsupported operator '" + word + "'");
            };
        }

        private Object parseValue() {
            skipWhitespace();
            if (atEnd()) {
                throw error("missing value");
            }
            char c = text.charAt(pos);
            if (c == '\'') {
                return parseString();
            }
            if (c == '-' || Character.isDigit(c)) {
                return parseNumber();
            }
            String word = readWord().toUpperCase(Locale.ROOT);
            return switch (word) {
                case "TRUE" -> Boolean.TRUE;
                case "FALSE" -> Boolean.FALSE;
                default -> throw error("unsupported value '" + word + "'");
            };
        }

        private String parseString() {
            pos++;
            StringBuilder value = new StringBuilder();
            while (true) {
                if (atEnd()) {
                    throw error("unterminated string literal");
                }
                char c = text.charAt(pos++);
                if (c == '\'') {
                    if (peek() == '\'') {
                        value.append('\'');
                        pos++;
                        continue;
                    }
                    return value.toString();
                }
                value.append(c);
            }
        }

        private Object parseNumber() {
            int start = pos;
            if (peek() == '-') {
                pos++;
            }
            while (!atEnd() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
                pos++;
            }
            String literal = text.substring(start, pos);
            try {
                if (literal.contains(".")) {
                    return new BigDecimal(literal);
                }
                return Long.parseLong(literal);
            } catch (NumberFormatException e) {
                throw error("malformed number '" + literal + "'");
            }
        }

        private String readWord() {
            skipWhitespace();
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            if (start == pos && !atEnd()) {
                throw error("unexpected character '" + text.charAt(pos) + "' at position " + pos);
            }
            return text.substring(start, pos);
        }

        private void expect(char expected) {
            skipWhitespace();
            if (peek() != expected) {
                throw error("expected '" + expected + "' at position " + pos);
            }
            pos++;
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private char peek() {
            return atEnd() ? '\0' : text.charAt(pos);
        }

        private char next() {
            return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private InvalidFilterPredicateException error(String message) {
            return new InvalidFilterPredicateException(ruleId, message);
        }
    }
}
