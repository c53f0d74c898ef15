package com.openworkout.owf.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A heading or step line with the step lines nested under it and the notes it owns, before any
 * semantic interpretation. The preamble scope has no line.
 */
public final class RawBlock {
    private final ScannedLine line;
    private final List<RawBlock> children = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    RawBlock(ScannedLine line) {
        this.line = line;
    }

    /** The heading or step line; {@code null} for the preamble before the first heading. */
    public ScannedLine getLine() {
        return line;
    }

    public int getDepth() {
        return line == null || line.getKind() != LineKind.STEP ? -1 : line.getDepth();
    }

    public List<RawBlock> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<String> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public boolean isEmpty() {
        return children.isEmpty() && notes.isEmpty();
    }

    void addChild(RawBlock child) {
        children.add(child);
    }

    void addNote(String note) {
        notes.add(note);
    }

    void describe(List<String> out, String indent) {
        out.add(indent + (line == null ? "(preamble)" : line.getKind() + " " + line.getContent()));
        for (String note : notes) {
            out.add(indent + "  > " + note);
        }
        for (RawBlock child : children) {
            child.describe(out, indent + "  ");
        }
    }
}
