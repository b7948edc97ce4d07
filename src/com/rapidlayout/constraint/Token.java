package com.rapidlayout.constraint;

public final class Token {

    public enum Type {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        LPAREN,
        RPAREN,
        END
    }

    private final Type type;
    private final String text;
    private final int position;
    private final long numerator;
    private final long denominator;

    private Token(Type type, String text, int position, long numerator, long denominator) {
        this.type = type;
        this.text = text;
        this.position = position;
        this.numerator = numerator;
        this.denominator = denominator;
    }

    static Token of(Type type, String text, int position) {
        return new Token(type, text, position, 0, 1);
    }

    static Token number(String text, int position, long numerator, long denominator) {
        return new Token(Type.NUMBER, text, position, numerator, denominator);
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    public long getNumerator() {
        return numerator;
    }

    public long getDenominator() {
        return denominator;
    }

    @Override
    public String toString() {
        return type == Type.END ? "<end>" : "'" + text + "'";
    }
}
