package com.scipatom.atomizer.span;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-based span heuristic for files the item parser rejected. Searches upward from
 * the anchor for a {@code fn} header, pulls in doc comment and attribute lines above it,
 * then counts braces forward until the body closes.
 */
public class FallbackSpanLocator {

    private static final Pattern FN_HEADER = Pattern.compile("\\bfn\\s+[A-Za-z_]");

    private final int searchWindow;
    private final int maxLines;

    public FallbackSpanLocator(int searchWindow, int maxLines) {
        this.searchWindow = searchWindow;
        this.maxLines = maxLines;
    }

    public SpanResult locate(List<String> lines, int anchorLine) {
        int anchor = anchorLine - 1;
        if (anchor < 0 || anchor >= lines.size()) {
            return SpanResult.notFound();
        }
        int header = anchor;
        for (int i = anchor; i >= 0 && i >= anchor - searchWindow; i--) {
            if (FN_HEADER.matcher(lines.get(i)).find()) {
                header = i;
                break;
            }
        }
        int start = header;
        while (start > 0) {
            String above = lines.get(start - 1).trim();
            if (above.startsWith("///") || above.startsWith("#[")) {
                start--;
            } else {
                break;
            }
        }
        int end = scanEnd(lines, header);
        if (end < anchor) {
            // the header found belongs to an earlier function
            start = anchor;
            end = scanEnd(lines, anchor);
        }
        return new SpanResult(start + 1, end + 1,
            String.join("\n", lines.subList(start, end + 1)), Confidence.APPROXIMATE_FALLBACK);
    }

    /** Index of the line closing the item that starts at {@code from}, bounded by {@code maxLines}. */
    int scanEnd(List<String> lines, int from) {
        int limit = Math.min(lines.size() - 1, from + maxLines - 1);
        int braces = 0;
        int parens = 0;
        boolean opened = false;
        boolean inBlockComment = false;
        boolean inString = false;
        for (int i = from; i <= limit; i++) {
            String line = lines.get(i);
            for (int j = 0; j < line.length(); j++) {
                char c = line.charAt(j);
                char next = j + 1 < line.length() ? line.charAt(j + 1) : '\0';
                if (inBlockComment) {
                    if (c == '*' && next == '/') {
                        inBlockComment = false;
                        j++;
                    }
                } else if (inString) {
                    if (c == '\\') {
                        j++;
                    } else if (c == '"') {
                        inString = false;
                    }
                } else if (c == '/' && next == '/') {
                    break;
                } else if (c == '/' && next == '*') {
                    inBlockComment = true;
                    j++;
                } else if (c == '"') {
                    inString = true;
                } else if (c == '\'') {
                    if (next == '\\') {
                        int close = line.indexOf('\'', j + 3);
                        if (close > 0) j = close;
                    } else if (j + 2 < line.length() && line.charAt(j + 2) == '\'') {
                        j += 2;
                    }
                } else if (c == '(' || c == '[') {
                    parens++;
                } else if (c == ')' || c == ']') {
                    parens--;
                } else if (c == '{') {
                    braces++;
                    opened = true;
                } else if (c == '}') {
                    braces--;
                    if (opened && braces <= 0) return i;
                } else if (c == ';' && !opened && braces == 0 && parens <= 0) {
                    return i;
                }
            }
        }
        return limit;
    }
}
