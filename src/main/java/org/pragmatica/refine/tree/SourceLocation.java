package org.pragmatica.refine.tree;

/**
 * A position in source text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Shift this location so that {@link #START} maps onto {@code base}.
     * Columns move only on the first line.
     */
    public SourceLocation relativeTo(SourceLocation base) {
        var newColumn = line == 1 ? column + base.column() - 1 : column;
        return new SourceLocation(line + base.line() - 1, newColumn, offset + base.offset());
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
