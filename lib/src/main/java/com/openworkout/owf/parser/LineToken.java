package com.openworkout.owf.parser;

import java.util.Objects;

/** A whitespace-delimited word of a line together with its 1-based column. */
final class LineToken {
    private final String text;
    private final int column;

    LineToken(String text, int column) {
        this.text = Objects.requireNonNull(text, "text");
        this.column = column;
    }

    String getText() {
        return text;
    }

    int getColumn() {
        return column;
    }

    boolean startsWith(char c) {
        return !text.isEmpty() && text.charAt(0) == c;
    }

    @Override
    public String toString() {
        return text + "@" + column;
    }
}
