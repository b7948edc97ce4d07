package com.rapidlayout.constraint;

import java.util.ArrayList;
import java.util.List;

public final class RelationParser {

    private final String sideText;
    private final List<Token> tokens;
    private final boolean relative;
    private int index = 0;

    private RelationParser(String sideText, boolean relative) {
        this.sideText = sideText;
        this.tokens = Tokenizer.tokenize(sideText);
        this.relative = relative;
    }

    // compiles a comma-separated list of relations
    public static List<Relation> parse(String constraintText, boolean relative) {
        if (constraintText == null || constraintText.isBlank()) {
            throw new GrammarException("Empty constraint");
        }
        List<Relation> relations = new ArrayList<>();
        for (String relationText : constraintText.split(",", -1)) {
            relations.add(parseRelation(relationText, relative));
        }
        return relations;
    }

    public static Relation parseRelation(String relationText, boolean relative) {
        String text = relationText.trim();
        if (text.isEmpty()) {
            throw new GrammarException("Empty relation");
        }

        RelationOperator operator = null;
        int opIndex = -1;
        for (RelationOperator candidate : RelationOperator.values()) {
            opIndex = text.indexOf(candidate.getSymbol());
            if (opIndex >= 0) {
                operator = candidate;
                break;
            }
        }
        if (operator == null) {
            throw new GrammarException(String.format("No comparison operator in relation '%s'", text));
        }

        String leftText = text.substring(0, opIndex);
        String rightText = text.substring(opIndex + operator.getSymbol().length());
        try {
            LinearExpression left = new RelationParser(leftText, relative).parseSide(text);
            LinearExpression right = new RelationParser(rightText, relative).parseSide(text);
            return Relation.of(text, left, operator, right);
        } catch (ArithmeticException e) {
            throw new GrammarException(String.format("Numeric overflow in relation '%s'", text), e);
        }
    }

    private LinearExpression parseSide(String relationText) {
        if (peek().getType() == Token.Type.END) {
            throw new GrammarException(String.format("Missing operand in relation '%s'", relationText));
        }
        LinearExpression expr = parseExpr();
        if (peek().getType() != Token.Type.END) {
            throw error("Unexpected token " + peek());
        }
        return expr;
    }

    private LinearExpression parseExpr() {
        LinearExpression expr = parseTerm();
        while (true) {
            Token.Type type = peek().getType();
            if (type == Token.Type.PLUS) {
                next();
                expr = expr.add(parseTerm());
            } else if (type == Token.Type.MINUS) {
                next();
                expr = expr.subtract(parseTerm());
            } else {
                return expr;
            }
        }
    }

    private LinearExpression parseTerm() {
        LinearExpression term = parseFactor();
        while (true) {
            Token.Type type = peek().getType();
            if (type == Token.Type.STAR) {
                next();
                term = term.multiply(parseFactor());
            } else if (type == Token.Type.SLASH) {
                next();
                term = term.divide(parseFactor());
            } else if (type == Token.Type.IDENTIFIER) {
                // juxtaposition such as 2sx1
                term = term.multiply(parseCoordinate(next()));
            } else {
                return term;
            }
        }
    }

    private LinearExpression parseFactor() {
        Token token = next();
        switch (token.getType()) {
            case PLUS:
                return parseFactor();
            case MINUS:
                return parseFactor().negate();
            case NUMBER:
                return LinearExpression.constant(token.getNumerator(), token.getDenominator());
            case IDENTIFIER:
                return parseCoordinate(token);
            case LPAREN:
                LinearExpression inner = parseExpr();
                if (next().getType() != Token.Type.RPAREN) {
                    throw error("Unbalanced parenthesis");
                }
                return inner;
            case END:
                throw error("Unexpected end of expression");
            default:
                throw error("Unexpected token " + token);
        }
    }

    private LinearExpression parseCoordinate(Token token) {
        CoordinateRef ref = CoordinateRef.resolve(token.getText(), relative);
        if (ref == null) {
            String allowed = relative ? "sx1|sy1|sx2|sy2|ox1|oy1|ox2|oy2" : "x1|y1|x2|y2|sx1|sy1|sx2|sy2";
            throw error(String.format("Unknown coordinate '%s' (expected %s)", token.getText(), allowed));
        }
        return LinearExpression.variable(ref);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.getType() != Token.Type.END) {
            index++;
        }
        return token;
    }

    private GrammarException error(String msg) {
        return new GrammarException(String.format("%s in '%s'", msg, sideText.trim()));
    }
}
