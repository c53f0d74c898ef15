package com.openworkout.owf.parser;

import com.openworkout.owf.ast.SourceLocation;
import java.util.Objects;

/**
 * One classified source line. For headings, steps and notes {@link #getContent()} is the text after
 * the marker; for every other kind it is the whole line without trailing whitespace.
 */
public final class ScannedLine {
    private final String sourceName;
    private final int lineNumber;
    private final LineKind kind;
    private final int depth;
    private final int markerColumn;
    private final String content;
    private final int contentColumn;
    private final String text;

    ScannedLine(
            String sourceName,
            int lineNumber,
            LineKind kind,
            int depth,
            int markerColumn,
            String content,
            int contentColumn,
            String text) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.lineNumber = lineNumber;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.depth = depth;
        this.markerColumn = markerColumn;
        this.content = Objects.requireNonNull(content, "content");
        this.contentColumn = contentColumn;
        this.text = Objects.requireNonNull(text, "text");
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public LineKind getKind() {
        return kind;
    }

    /** Nesting level (indent / 2) of a step or note; 0 for every other kind. */
    public int getDepth() {
        return depth;
    }

    public String getContent() {
        return content;
    }

    /** 1-based column of the first character of {@link #getContent()}. */
    public int getContentColumn() {
        return contentColumn;
    }

    /** The line without its terminator and trailing whitespace. */
    public String getText() {
        return text;
    }

    /** Location of the line's marker ({@code -}, {@code >}, {@code #}) or first character. */
    public SourceLocation getLocation() {
        return new SourceLocation(sourceName, lineNumber, markerColumn);
    }

    public SourceLocation locationAt(int column) {
        return new SourceLocation(sourceName, lineNumber, column);
    }

    @Override
    public String toString() {
        return kind + "@" + lineNumber + ": " + text;
    }
}
