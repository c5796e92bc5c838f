package com.scipatom.atomizer.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed form of a SCIP symbol string:
 * {@code <scheme> <manager> <package-name> <version> <descriptors>} or {@code local <id>}.
 */
public record ScipSymbol(
    String scheme,
    String manager,
    String packageName,
    String version,
    List<Descriptor> descriptors,
    boolean local
) {

    public enum Suffix { NAMESPACE, TYPE, TERM, METHOD, TYPE_PARAMETER, PARAMETER, META, MACRO }

    public record Descriptor(String name, Suffix suffix, String disambiguator) {}

    public static boolean isLocal(String symbol) {
        return symbol != null && symbol.startsWith("local ");
    }

    /**
     * Parses {@code symbol}. Unparseable descriptor tails are dropped, so the result is
     * always usable; a symbol with no recognizable descriptors has an empty list.
     */
    public static ScipSymbol parse(String symbol) {
        if (isLocal(symbol)) {
            return new ScipSymbol("local", "", "", "", Collections.emptyList(), true);
        }
        List<String> header = new ArrayList<>();
        int i = 0;
        int n = symbol.length();
        while (header.size() < 4 && i < n) {
            StringBuilder part = new StringBuilder();
            while (i < n) {
                char c = symbol.charAt(i);
                if (c == ' ') {
                    // a doubled space escapes a literal space inside a header field
                    if (i + 1 < n && symbol.charAt(i + 1) == ' ') {
                        part.append(' ');
                        i += 2;
                        continue;
                    }
                    i++;
                    break;
                }
                part.append(c);
                i++;
            }
            header.add(part.toString());
        }
        while (header.size() < 4) header.add("");
        List<Descriptor> descriptors = parseDescriptors(i < n ? symbol.substring(i) : "");
        return new ScipSymbol(header.get(0), header.get(1), header.get(2), header.get(3),
            Collections.unmodifiableList(descriptors), false);
    }

    static List<Descriptor> parseDescriptors(String text) {
        List<Descriptor> out = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '[' || c == '(') {
                char close = c == '[' ? ']' : ')';
                int end = text.indexOf(close, i + 1);
                if (end < 0) break;
                String name = unquote(text.substring(i + 1, end));
                out.add(new Descriptor(name, c == '[' ? Suffix.TYPE_PARAMETER : Suffix.PARAMETER, null));
                i = end + 1;
                continue;
            }
            StringBuilder name = new StringBuilder();
            if (c == '`') {
                i++;
                while (i < n) {
                    char q = text.charAt(i);
                    if (q == '`') {
                        if (i + 1 < n && text.charAt(i + 1) == '`') {
                            name.append('`');
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    name.append(q);
                    i++;
                }
            } else {
                while (i < n && isIdentifierChar(text.charAt(i))) {
                    name.append(text.charAt(i));
                    i++;
                }
            }
            if (i >= n) break;
            char suffix = text.charAt(i);
            switch (suffix) {
                case '/' -> { out.add(new Descriptor(name.toString(), Suffix.NAMESPACE, null)); i++; }
                case '#' -> { out.add(new Descriptor(name.toString(), Suffix.TYPE, null)); i++; }
                case '.' -> { out.add(new Descriptor(name.toString(), Suffix.TERM, null)); i++; }
                case ':' -> { out.add(new Descriptor(name.toString(), Suffix.META, null)); i++; }
                case '!' -> { out.add(new Descriptor(name.toString(), Suffix.MACRO, null)); i++; }
                case '(' -> {
                    int end = text.indexOf(')', i + 1);
                    if (end < 0 || end + 1 >= n || text.charAt(end + 1) != '.') {
                        return out;
                    }
                    String disambiguator = text.substring(i + 1, end);
                    out.add(new Descriptor(name.toString(), Suffix.METHOD,
                        disambiguator.isEmpty() ? null : disambiguator));
                    i = end + 2;
                }
                default -> { return out; }
            }
        }
        return out;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '+' || c == '-' || c == '$';
    }

    private static String unquote(String name) {
        if (name.length() >= 2 && name.startsWith("`") && name.endsWith("`")) {
            return name.substring(1, name.length() - 1).replace("``", "`");
        }
        return name;
    }

    public Descriptor last() {
        return descriptors.isEmpty() ? null : descriptors.get(descriptors.size() - 1);
    }
}
