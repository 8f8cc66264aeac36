package com.raditha.approx.transform;

/**
 * One lexical unit of a C/C++ source line.
 */
public record Token(Type type, String text) {

    public enum Type {
        IDENTIFIER,
        NUMBER,
        LITERAL,
        COMMENT,
        WHITESPACE,
        PUNCTUATION
    }

    public boolean is(String punctuation) {
        return type == Type.PUNCTUATION && text.equals(punctuation);
    }

    public boolean isWhitespace() {
        return type == Type.WHITESPACE;
    }
}
