package com.rapidlayout.constraint;

import java.util.ArrayList;
import java.util.List;

public final class Tokenizer {

    private final String text;
    private int pos = 0;

    private Tokenizer(String text) {
        this.text = text;
    }

    public static List<Token> tokenize(String text) {
        return new Tokenizer(text).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                tokens.add(readNumber());
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(readIdentifier());
            } else {
                tokens.add(readSymbol(c));
                pos++;
            }
        }
        tokens.add(Token.of(Token.Type.END, "", pos));
        return tokens;
    }

    private Token readNumber() {
        int start = pos;
        long numerator = 0;
        long denominator = 1;
        boolean seenDot = false;
        try {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.isDigit(c)) {
                    numerator = Math.addExact(Math.multiplyExact(numerator, 10), c - '0');
                    if (seenDot) {
                        denominator = Math.multiplyExact(denominator, 10);
                    }
                } else if (c == '.' && !seenDot) {
                    seenDot = true;
                } else {
                    break;
                }
                pos++;
            }
        } catch (ArithmeticException e) {
            throw new GrammarException(String.format("Number starting at column %d of '%s' is too large", start, text), e);
        }
        return Token.number(text.substring(start, pos), start, numerator, denominator);
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        return Token.of(Token.Type.IDENTIFIER, text.substring(start, pos), start);
    }

    private Token readSymbol(char c) {
        Token.Type type;
        switch (c) {
            case '+':
                type = Token.Type.PLUS;
                break;
            case '-':
                type = Token.Type.MINUS;
                break;
            case '*':
                type = Token.Type.STAR;
                break;
            case '/':
                type = Token.Type.SLASH;
                break;
            case '(':
                type = Token.Type.LPAREN;
                break;
            case ')':
                type = Token.Type.RPAREN;
                break;
            default:
                throw new GrammarException(String.format("Unexpected character '%c' at column %d of '%s'", c, pos, text));
        }
        return Token.of(type, String.valueOf(c), pos);
    }
}
