package com.scipatom.atomizer.span;

/**
 * A lexical token. {@code line} is where it starts and {@code endLine} where it ends,
 * both 1-based; they differ only for multi-line literals and block doc comments.
 */
public record Token(Type type, String text, int line, int endLine) {

    public enum Type { IDENT, PUNCT, OPEN, CLOSE, LITERAL, LIFETIME, DOC_COMMENT }

    public boolean is(String s) {
        return text.equals(s) && type != Type.LITERAL && type != Type.DOC_COMMENT;
    }

    public boolean isIdent(String s) {
        return type == Type.IDENT && text.equals(s);
    }
}
