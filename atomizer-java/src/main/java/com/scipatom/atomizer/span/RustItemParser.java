package com.scipatom.atomizer.span;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Structural parser for Rust source extended with Verus specification syntax.
 *
 * It does not build expressions. It only needs to find where items start and end:
 * functions (with any qualifiers or Verus mode keywords, and with requires/ensures/
 * decreases clauses between signature and body), impl blocks, traits, inline modules,
 * extern blocks, item-list macros such as {@code verus! { ... }}, and functions nested
 * in function bodies. Anything else at item level is skipped token by token, which is
 * what lets the parser tolerate Verus-only item forms.
 *
 * Strict failures (unbalanced delimiters, unterminated literals, a {@code fn} with no
 * name or no body) raise {@link SpanParseException}.
 */
public class RustItemParser {

    static final Set<String> QUALIFIERS = Set.of(
        "pub", "const", "async", "unsafe", "extern", "default",
        "spec", "proof", "exec", "open", "closed", "tracked", "ghost",
        "broadcast", "axiom", "uninterp"
    );

    /** Verus clauses that may sit between a signature and its body. */
    static final Set<String> CLAUSE_KEYWORDS = Set.of(
        "requires", "ensures", "recommends", "decreases", "returns", "opens_invariants", "no_unwind"
    );

    private static final Set<String> CONST_FN_FOLLOWERS = Set.of("fn", "unsafe", "async", "extern");

    private final Set<String> itemListMacros;

    public RustItemParser(Collection<String> itemListMacros) {
        this.itemListMacros = Set.copyOf(itemListMacros);
    }

    /**
     * @return top-level items in source order
     * @throws SpanParseException if the file is not structurally well formed
     */
    public List<ItemSpan> parse(String source) {
        List<Token> tokens = RustLexer.tokenize(source);
        int[] match = matchDelimiters(tokens);
        return new Run(tokens, match).items(0, tokens.size());
    }

    static int[] matchDelimiters(List<Token> tokens) {
        int[] match = new int[tokens.size()];
        Arrays.fill(match, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == Token.Type.OPEN) {
                stack.push(i);
            } else if (t.type() == Token.Type.CLOSE) {
                if (stack.isEmpty()) {
                    throw new SpanParseException("unmatched '" + t.text() + "'", t.line());
                }
                int open = stack.pop();
                if (!pairs(tokens.get(open).text(), t.text())) {
                    throw new SpanParseException("'" + tokens.get(open).text() + "' opened on line "
                        + tokens.get(open).line() + " closed by '" + t.text() + "'", t.line());
                }
                match[open] = i;
                match[i] = open;
            }
        }
        if (!stack.isEmpty()) {
            Token t = tokens.get(stack.peek());
            throw new SpanParseException("unclosed '" + t.text() + "'", t.line());
        }
        return match;
    }

    private static boolean pairs(String open, String close) {
        return (open.equals("(") && close.equals(")"))
            || (open.equals("[") && close.equals("]"))
            || (open.equals("{") && close.equals("}"));
    }

    private record Parsed(ItemSpan item, int next) {}

    private final class Run {

        private final List<Token> tokens;
        private final int[] match;

        Run(List<Token> tokens, int[] match) {
            this.tokens = tokens;
            this.match = match;
        }

        private Token tok(int i) {
            return tokens.get(i);
        }

        List<ItemSpan> items(int from, int to) {
            List<ItemSpan> out = new ArrayList<>();
            int i = from;
            while (i < to) {
                int start = i;
                while (i < to) {
                    Token t = tok(i);
                    if (t.type() == Token.Type.DOC_COMMENT) {
                        i++;
                        continue;
                    }
                    if (t.is("#") && i + 1 < to) {
                        if (tok(i + 1).is("[")) {
                            i = match[i + 1] + 1;
                            continue;
                        }
                        if (tok(i + 1).is("!") && i + 2 < to && tok(i + 2).is("[")) {
                            // inner attribute: belongs to the enclosing item, not the next one
                            i = match[i + 2] + 1;
                            start = i;
                            continue;
                        }
                    }
                    break;
                }
                if (i >= to) break;
                Parsed parsed = item(start, i, to);
                if (parsed.item() != null) out.add(parsed.item());
                i = Math.max(parsed.next(), i + 1);
            }
            return out;
        }

        private Parsed item(int start, int i, int to) {
            int j = i;
            while (j < to && tok(j).type() == Token.Type.IDENT && QUALIFIERS.contains(tok(j).text())) {
                String q = tok(j).text();
                if (q.equals("const") && !(j + 1 < to && tok(j + 1).type() == Token.Type.IDENT
                        && CONST_FN_FOLLOWERS.contains(tok(j + 1).text()))) {
                    return new Parsed(null, skipToSemicolon(j, to));
                }
                if (q.equals("extern")) {
                    if (j + 1 < to && tok(j + 1).isIdent("crate")) {
                        return new Parsed(null, skipToSemicolon(j, to));
                    }
                    int k = j + 1;
                    if (k < to && tok(k).type() == Token.Type.LITERAL) k++;
                    if (k < to && tok(k).is("{")) {
                        return container(ItemKind.EXTERN_BLOCK, "extern", start, k);
                    }
                    j = k;
                    continue;
                }
                if ((q.equals("pub") || q.equals("spec")) && j + 1 < to && tok(j + 1).is("(")) {
                    j = match[j + 1] + 1;
                    continue;
                }
                j++;
            }
            if (j >= to) return new Parsed(null, to);

            Token kw = tok(j);
            if (kw.type() == Token.Type.OPEN) {
                return new Parsed(null, match[j] + 1);
            }
            if (kw.type() != Token.Type.IDENT) {
                return new Parsed(null, j + 1);
            }
            switch (kw.text()) {
                case "fn":
                    return function(start, j, to);
                case "impl": {
                    int open = findBodyOpen(j + 1, to);
                    if (open < 0) return new Parsed(null, skipToSemicolon(j, to));
                    return container(ItemKind.IMPL, "impl", start, open);
                }
                case "trait": {
                    int open = findBodyOpen(j + 1, to);
                    if (open < 0) return new Parsed(null, skipToSemicolon(j, to));
                    String name = j + 1 < to && tok(j + 1).type() == Token.Type.IDENT ? tok(j + 1).text() : "trait";
                    return container(ItemKind.TRAIT, name, start, open);
                }
                case "mod": {
                    if (j + 2 < to && tok(j + 1).type() == Token.Type.IDENT && tok(j + 2).is("{")) {
                        return container(ItemKind.MODULE, tok(j + 1).text(), start, j + 2);
                    }
                    return new Parsed(null, skipToSemicolon(j, to));
                }
                case "struct":
                case "enum":
                case "union":
                    return new Parsed(null, skipStructLike(j, to));
                case "use":
                case "type":
                case "static":
                    return new Parsed(null, skipToSemicolon(j, to));
                default:
                    return macroOrSkip(start, j, to);
            }
        }

        private Parsed macroOrSkip(int start, int j, int to) {
            int k = j;
            while (k + 3 < to && tok(k).type() == Token.Type.IDENT
                    && tok(k + 1).is(":") && tok(k + 2).is(":") && tok(k + 3).type() == Token.Type.IDENT) {
                k += 3;
            }
            if (k + 2 < to && tok(k).type() == Token.Type.IDENT && tok(k + 1).is("!")) {
                int open = k + 2;
                if (tok(open).type() == Token.Type.IDENT) {
                    // macro_rules! name { ... }
                    open++;
                }
                if (open < to && tok(open).type() == Token.Type.OPEN) {
                    int close = match[open];
                    int next = close + 1;
                    if (next < to && tok(next).is(";")) next++;
                    if (itemListMacros.contains(tok(k).text())) {
                        List<ItemSpan> children = items(open + 1, close);
                        return new Parsed(new ItemSpan(ItemKind.MACRO, tok(k).text(),
                            tok(start).line(), tok(close).line(), children), next);
                    }
                    return new Parsed(null, next);
                }
            }
            return new Parsed(null, j + 1);
        }

        private Parsed container(ItemKind kind, String name, int start, int open) {
            int close = match[open];
            List<ItemSpan> children = items(open + 1, close);
            return new Parsed(new ItemSpan(kind, name, tok(start).line(), tok(close).line(), children), close + 1);
        }

        /**
         * Parses a function whose {@code fn} keyword is at {@code fnIdx}. Everything between the
         * name and the body (generics, parameters, return type, where clauses, Verus
         * requires/ensures/decreases clauses, quantifiers) belongs to the declaration.
         */
        private Parsed function(int start, int fnIdx, int to) {
            if (fnIdx + 1 >= to || tok(fnIdx + 1).type() != Token.Type.IDENT) {
                throw new SpanParseException("fn without a name", tok(fnIdx).line());
            }
            String name = tok(fnIdx + 1).text();
            boolean inClause = false;
            int clauseBlocks = 0;
            for (int k = fnIdx + 2; k < to; k++) {
                Token t = tok(k);
                if (t.type() == Token.Type.IDENT) {
                    if (CLAUSE_KEYWORDS.contains(t.text())) {
                        inClause = true;
                    } else if (inClause && (t.text().equals("match") || t.text().equals("if"))) {
                        clauseBlocks++;
                    } else if (inClause && t.text().equals("else") && k + 1 < to && tok(k + 1).is("{")) {
                        clauseBlocks++;
                    }
                }
                if (t.is("{") && clauseBlocks > 0) {
                    // match arms or an if/else branch of a clause expression
                    clauseBlocks--;
                    k = match[k];
                    continue;
                }
                if (t.is("{")) {
                    int close = match[k];
                    List<ItemSpan> nested = nestedFunctions(k + 1, close);
                    return new Parsed(new ItemSpan(ItemKind.FUNCTION, name,
                        tok(start).line(), tok(close).endLine(), nested), close + 1);
                }
                if (t.type() == Token.Type.OPEN) {
                    k = match[k];
                    continue;
                }
                if (t.is(";")) {
                    return new Parsed(new ItemSpan(ItemKind.FUNCTION, name,
                        tok(start).line(), t.line(), Collections.emptyList()), k + 1);
                }
            }
            throw new SpanParseException("fn " + name + " has no body", tok(fnIdx).line());
        }

        private List<ItemSpan> nestedFunctions(int from, int to) {
            List<ItemSpan> out = new ArrayList<>();
            int k = from;
            while (k < to) {
                if (tok(k).isIdent("fn") && k + 1 < to && tok(k + 1).type() == Token.Type.IDENT) {
                    Parsed p = function(leadingStart(k, from), k, to);
                    out.add(p.item());
                    k = p.next();
                    continue;
                }
                k++;
            }
            return out;
        }

        /** Walks back from a nested {@code fn} over its qualifiers, attributes and doc comments. */
        private int leadingStart(int fnIdx, int lowerBound) {
            int idx = fnIdx;
            while (idx - 1 >= lowerBound) {
                Token p = tok(idx - 1);
                if (p.type() == Token.Type.IDENT && QUALIFIERS.contains(p.text())) {
                    idx--;
                } else if (p.type() == Token.Type.LITERAL && idx - 2 >= lowerBound && tok(idx - 2).isIdent("extern")) {
                    idx -= 2;
                } else if (p.type() == Token.Type.DOC_COMMENT) {
                    idx--;
                } else if (p.is(")")) {
                    int open = match[idx - 1];
                    if (open - 1 >= lowerBound && (tok(open - 1).isIdent("pub") || tok(open - 1).isIdent("spec"))) {
                        idx = open - 1;
                    } else {
                        break;
                    }
                } else if (p.is("]")) {
                    int open = match[idx - 1];
                    if (open - 1 >= lowerBound && tok(open - 1).is("#")) {
                        idx = open - 1;
                    } else {
                        break;
                    }
                } else {
                    break;
                }
            }
            return idx;
        }

        private int findBodyOpen(int from, int to) {
            for (int k = from; k < to; k++) {
                Token t = tok(k);
                if (t.is("{")) return k;
                if (t.type() == Token.Type.OPEN) {
                    k = match[k];
                } else if (t.is(";")) {
                    return -1;
                }
            }
            return -1;
        }

        private int skipToSemicolon(int from, int to) {
            for (int k = from; k < to; k++) {
                Token t = tok(k);
                if (t.type() == Token.Type.OPEN) {
                    k = match[k];
                } else if (t.is(";")) {
                    return k + 1;
                }
            }
            return to;
        }

        private int skipStructLike(int from, int to) {
            for (int k = from; k < to; k++) {
                Token t = tok(k);
                if (t.is("{")) return match[k] + 1;
                if (t.type() == Token.Type.OPEN) {
                    k = match[k];
                } else if (t.is(";")) {
                    return k + 1;
                }
            }
            return to;
        }
    }
}
