package com.openworkout.owf.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups body lines into heading scopes and nests step lines by indentation.
 *
 * <p>Note ownership is decided per scope once the scope is complete: notes ahead of the first step
 * go to the scope, notes between steps go to the preceding step, and notes after the last step go
 * to the preceding step up to the first blank line and to the scope from there on. The preceding
 * step is the deepest open step whose depth does not exceed the note's depth.</p>
 */
public final class BlockStructurer {

    private BlockStructurer() {}

    public static BlockForest structure(List<ScannedLine> lines) throws OwfParseException {
        RawBlock preamble = new RawBlock(null);
        List<RawBlock> headings = new ArrayList<>();
        Scope scope = new Scope(preamble);
        for (ScannedLine line : lines) {
            switch (line.getKind()) {
                case SESSION_HEADING, WORKOUT_HEADING -> {
                    scope.finish();
                    RawBlock heading = new RawBlock(line);
                    headings.add(heading);
                    scope = new Scope(heading);
                }
                case STEP -> scope.step(line);
                case NOTE -> scope.note(line);
                case BLANK -> scope.blank();
                case METADATA_FENCE ->
                        throw new OwfParseException(
                                line.getLocation(), "Unexpected '---' outside of frontmatter");
                case TEXT ->
                        throw new OwfParseException(
                                line.getLocation(),
                                "Unrecognized line: '" + line.getText().strip() + "'");
                default -> throw new IllegalStateException("Unhandled line kind " + line.getKind());
            }
        }
        scope.finish();
        BlockForest forest = new BlockForest(preamble, headings);
        if (DebugFlags.isBlockDebugEnabled()) {
            DebugFlags.logBlocks(forest);
        }
        return forest;
    }

    private static final class Scope {
        private final RawBlock owner;
        private final List<RawBlock> open = new ArrayList<>();
        private final List<PendingNote> pending = new ArrayList<>();
        private boolean blankSinceStep;

        Scope(RawBlock owner) {
            this.owner = owner;
        }

        void step(ScannedLine line) throws OwfParseException {
            int depth = line.getDepth();
            if (depth > open.size()) {
                throw new OwfParseException(line.getLocation(), "Unexpected indentation");
            }
            flushBetweenSteps();
            while (open.size() > depth) {
                open.remove(open.size() - 1);
            }
            RawBlock block = new RawBlock(line);
            if (depth == 0) {
                owner.addChild(block);
            } else {
                open.get(depth - 1).addChild(block);
            }
            open.add(block);
            blankSinceStep = false;
        }

        void note(ScannedLine line) {
            pending.add(new PendingNote(line.getContent(), precedingStep(line.getDepth()), blankSinceStep));
        }

        void blank() {
            if (!open.isEmpty()) {
                blankSinceStep = true;
            }
        }

        private RawBlock precedingStep(int noteDepth) {
            if (open.isEmpty()) {
                return null;
            }
            return open.get(Math.min(noteDepth, open.size() - 1));
        }

        private void flushBetweenSteps() {
            for (PendingNote note : pending) {
                (note.step == null ? owner : note.step).addNote(note.text);
            }
            pending.clear();
        }

        void finish() {
            for (PendingNote note : pending) {
                if (note.step == null || note.afterBlank) {
                    owner.addNote(note.text);
                } else {
                    note.step.addNote(note.text);
                }
            }
            pending.clear();
        }
    }

    private static final class PendingNote {
        private final String text;
        private final RawBlock step;
        private final boolean afterBlank;

        PendingNote(String text, RawBlock step, boolean afterBlank) {
            this.text = text;
            this.step = step;
            this.afterBlank = afterBlank;
        }
    }
}
