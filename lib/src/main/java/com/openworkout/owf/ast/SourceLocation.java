package com.openworkout.owf.ast;

import java.util.Objects;

/** Position of the first character of a node: source name plus 1-based line and column. */
public final class SourceLocation {
    private final String sourceName;
    private final int line;
    private final int column;

    public SourceLocation(String sourceName, int line, int column) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based: " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public SourceLocation withColumn(int newColumn) {
        return new SourceLocation(sourceName, line, newColumn);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        return line == other.line
                && column == other.column
                && sourceName.equals(other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line, column);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
