package com.scipatom.atomizer.span;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for Rust and its Verus superset. Verus operators such as {@code ==>},
 * {@code &&&} and {@code |||} come out as runs of single-character punctuation,
 * which is all the item parser needs. Ordinary comments and inner doc comments are
 * dropped; outer doc comments ({@code ///}, {@code /** *}{@code /}) are kept as tokens so
 * they can be attached to the following item.
 */
public class RustLexer {

    private final String src;
    private final int n;
    private int pos;
    private int line = 1;
    private final List<Token> tokens = new ArrayList<>();

    private RustLexer(String src) {
        this.src = src;
        this.n = src.length();
    }

    /**
     * @throws SpanParseException on an unterminated block comment, string or character literal
     */
    public static List<Token> tokenize(String source) {
        RustLexer lexer = new RustLexer(source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                lineComment();
            } else if (c == '/' && peek(1) == '*') {
                blockComment();
            } else if (c == '"') {
                quoted(pos, pos + 1);
            } else if (c == '\'') {
                quoteOrLifetime();
            } else if (isRawStringStart()) {
                rawString();
            } else if ((c == 'b' || c == 'c') && peek(1) == '"') {
                quoted(pos, pos + 2);
            } else if (c == 'b' && peek(1) == '\'') {
                charLiteral(pos, pos + 2);
            } else if (c == 'r' && peek(1) == '#' && isIdentStart(peek(2))) {
                int start = pos;
                pos += 2;
                while (pos < n && isIdentPart(src.charAt(pos))) pos++;
                tokens.add(new Token(Token.Type.IDENT, src.substring(start + 2, pos), line, line));
            } else if (isIdentStart(c)) {
                int start = pos;
                while (pos < n && isIdentPart(src.charAt(pos))) pos++;
                tokens.add(new Token(Token.Type.IDENT, src.substring(start, pos), line, line));
            } else if (Character.isDigit(c)) {
                number();
            } else if (c == '(' || c == '[' || c == '{') {
                tokens.add(new Token(Token.Type.OPEN, String.valueOf(c), line, line));
                pos++;
            } else if (c == ')' || c == ']' || c == '}') {
                tokens.add(new Token(Token.Type.CLOSE, String.valueOf(c), line, line));
                pos++;
            } else {
                tokens.add(new Token(Token.Type.PUNCT, String.valueOf(c), line, line));
                pos++;
            }
        }
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < n ? src.charAt(i) : '\0';
    }

    private void lineComment() {
        int start = pos;
        while (pos < n && src.charAt(pos) != '\n') pos++;
        String text = src.substring(start, pos);
        if (text.startsWith("///") && !text.startsWith("////")) {
            tokens.add(new Token(Token.Type.DOC_COMMENT, text, line, line));
        }
    }

    private void blockComment() {
        int start = pos;
        int startLine = line;
        int depth = 0;
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '/' && peek(1) == '*') {
                depth++;
                pos += 2;
            } else if (c == '*' && peek(1) == '/') {
                depth--;
                pos += 2;
                if (depth == 0) break;
            } else {
                if (c == '\n') line++;
                pos++;
            }
        }
        if (depth != 0) {
            throw new SpanParseException("unterminated block comment", startLine);
        }
        String text = src.substring(start, pos);
        boolean outerDoc = text.startsWith("/**") && !text.startsWith("/***") && !text.equals("/**/");
        if (outerDoc) {
            tokens.add(new Token(Token.Type.DOC_COMMENT, text, startLine, line));
        }
    }

    /** A "..." literal whose body starts at {@code bodyStart}; backslash escapes apply. */
    private void quoted(int start, int bodyStart) {
        int startLine = line;
        pos = bodyStart;
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\\') {
                if (peek(1) == '\n') line++;
                pos += 2;
                continue;
            }
            if (c == '\n') line++;
            pos++;
            if (c == '"') {
                tokens.add(new Token(Token.Type.LITERAL, src.substring(start, pos), startLine, line));
                return;
            }
        }
        throw new SpanParseException("unterminated string literal", startLine);
    }

    private boolean isRawStringStart() {
        int i = pos;
        char c = src.charAt(i);
        if (c == 'b' || c == 'c') {
            i++;
            if (i >= n || src.charAt(i) != 'r') return false;
        } else if (c != 'r') {
            return false;
        }
        i++;
        while (i < n && src.charAt(i) == '#') i++;
        return i < n && src.charAt(i) == '"';
    }

    private void rawString() {
        int start = pos;
        int startLine = line;
        while (src.charAt(pos) != '#' && src.charAt(pos) != '"') pos++;
        int hashes = 0;
        while (src.charAt(pos) == '#') {
            hashes++;
            pos++;
        }
        pos++; // opening quote
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\n') line++;
            pos++;
            if (c == '"' && closesRaw(hashes)) {
                pos += hashes;
                tokens.add(new Token(Token.Type.LITERAL, src.substring(start, pos), startLine, line));
                return;
            }
        }
        throw new SpanParseException("unterminated raw string literal", startLine);
    }

    private boolean closesRaw(int hashes) {
        for (int k = 0; k < hashes; k++) {
            if (pos + k >= n || src.charAt(pos + k) != '#') return false;
        }
        return true;
    }

    private void quoteOrLifetime() {
        // 'x' or '\n' is a char literal; 'a followed by anything but a quote is a lifetime or label
        if (peek(1) == '\\') {
            charLiteral(pos, pos + 1);
            return;
        }
        if (pos + 1 < n) {
            int cp = src.codePointAt(pos + 1);
            int after = pos + 1 + Character.charCount(cp);
            if (after < n && src.charAt(after) == '\'') {
                tokens.add(new Token(Token.Type.LITERAL, src.substring(pos, after + 1), line, line));
                pos = after + 1;
                return;
            }
        }
        if (isIdentStart(peek(1))) {
            int start = pos;
            pos++;
            while (pos < n && isIdentPart(src.charAt(pos))) pos++;
            tokens.add(new Token(Token.Type.LIFETIME, src.substring(start, pos), line, line));
            return;
        }
        tokens.add(new Token(Token.Type.PUNCT, "'", line, line));
        pos++;
    }

    private void charLiteral(int start, int bodyStart) {
        int startLine = line;
        pos = bodyStart;
        while (pos < n) {
            char c = src.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '\n') break;
            pos++;
            if (c == '\'') {
                tokens.add(new Token(Token.Type.LITERAL, src.substring(start, pos), startLine, line));
                return;
            }
        }
        throw new SpanParseException("unterminated character literal", startLine);
    }

    private void number() {
        int start = pos;
        while (pos < n) {
            char c = src.charAt(pos);
            if (isIdentPart(c)) {
                pos++;
            } else if (c == '.' && Character.isDigit(peek(1))) {
                pos++;
            } else if ((c == '+' || c == '-') && (src.charAt(pos - 1) == 'e' || src.charAt(pos - 1) == 'E')
                    && !src.substring(start, pos).startsWith("0x")) {
                pos++;
            } else {
                break;
            }
        }
        tokens.add(new Token(Token.Type.LITERAL, src.substring(start, pos), line, line));
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
