package com.openworkout.owf.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Classifies source lines by prefix, one line at a time. Each call to {@link #iterator()} starts a
 * fresh pass over the same text. Classification never fails: anything unrecognized is
 * {@link LineKind#TEXT} and left for the parser to reject.
 */
public final class LineScanner implements Iterable<ScannedLine> {
    private final String sourceName;
    private final String[] rawLines;

    public LineScanner(String sourceName, String text) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.rawLines = Objects.requireNonNull(text, "text").split("\r?\n", -1);
    }

    @Override
    public Iterator<ScannedLine> iterator() {
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < rawLines.length;
            }

            @Override
            public ScannedLine next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int current = index++;
                return classify(sourceName, current + 1, rawLines[current]);
            }
        };
    }

    public List<ScannedLine> scanAll() {
        List<ScannedLine> lines = new ArrayList<>(rawLines.length);
        for (ScannedLine line : this) {
            lines.add(line);
        }
        return lines;
    }

    static ScannedLine classify(String sourceName, int lineNumber, String raw) {
        String text = raw.stripTrailing();
        if (text.isEmpty()) {
            return new ScannedLine(sourceName, lineNumber, LineKind.BLANK, 0, 1, "", 1, text);
        }
        if (text.equals("---")) {
            return new ScannedLine(sourceName, lineNumber, LineKind.METADATA_FENCE, 0, 1, text, 1, text);
        }
        if (text.equals("##") || text.startsWith("## ")) {
            return marked(sourceName, lineNumber, LineKind.SESSION_HEADING, 0, text, 0, 2);
        }
        if (text.equals("#") || text.startsWith("# ")) {
            return marked(sourceName, lineNumber, LineKind.WORKOUT_HEADING, 0, text, 0, 1);
        }
        int indent = 0;
        while (indent < text.length() && text.charAt(indent) == ' ') {
            indent++;
        }
        if (text.charAt(indent) == '\t' || indent % 2 != 0) {
            return text(sourceName, lineNumber, text);
        }
        String rest = text.substring(indent);
        if (rest.equals("-") || rest.startsWith("- ")) {
            return marked(sourceName, lineNumber, LineKind.STEP, indent / 2, text, indent, 1);
        }
        if (rest.equals(">") || rest.startsWith("> ")) {
            return marked(sourceName, lineNumber, LineKind.NOTE, indent / 2, text, indent, 1);
        }
        return text(sourceName, lineNumber, text);
    }

    private static ScannedLine marked(
            String sourceName,
            int lineNumber,
            LineKind kind,
            int depth,
            String text,
            int indent,
            int markerLength) {
        int start = indent + markerLength;
        while (start < text.length() && text.charAt(start) == ' ') {
            start++;
        }
        return new ScannedLine(
                sourceName, lineNumber, kind, depth, indent + 1, text.substring(start), start + 1, text);
    }

    private static ScannedLine text(String sourceName, int lineNumber, String text) {
        return new ScannedLine(sourceName, lineNumber, LineKind.TEXT, 0, 1, text, 1, text);
    }
}
