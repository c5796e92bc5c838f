package com.scipatom.atomizer.index;

/**
 * One occurrence of a symbol in a document, after validation.
 *
 * @param enclosingRange range of the whole enclosing syntax node, when the analyzer emits one
 */
public record OccurrenceRecord(
    String symbol,
    String path,
    SourceRange range,
    int roles,
    SourceRange enclosingRange
) {
    public static final int ROLE_DEFINITION = 0x1;
    public static final int ROLE_IMPORT = 0x2;
    public static final int ROLE_WRITE_ACCESS = 0x4;
    public static final int ROLE_READ_ACCESS = 0x8;
    public static final int ROLE_GENERATED = 0x10;
    public static final int ROLE_TEST = 0x20;
    public static final int ROLE_FORWARD_DEFINITION = 0x40;

    public boolean isDefinition() {
        return (roles & ROLE_DEFINITION) != 0;
    }

    public boolean isImport() {
        return (roles & ROLE_IMPORT) != 0;
    }

    /** Identity of the textual call site; duplicate records of the same site share it. */
    public String siteKey() {
        return path + ":" + range.startLine() + ":" + range.startChar();
    }
}
