package com.openworkout.owf.parser;

import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.DocumentEntry;
import com.openworkout.owf.ast.Heading;
import com.openworkout.owf.ast.Session;
import com.openworkout.owf.ast.Step;
import com.openworkout.owf.ast.Workout;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the parsing pipeline: line classification, frontmatter, block structuring and
 * semantic parsing of headings and steps.
 *
 * <p>Headings are read in one forward pass. {@code #} headings before the first {@code ##} are
 * top-level workouts; after it they belong to the most recent session.</p>
 */
public final class DocumentParser {
    private static final Logger LOGGER = Logger.getLogger(DocumentParser.class.getName());

    private final String sourceName;

    public DocumentParser(String sourceName) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    }

    public Document parse(String text) throws OwfParseException {
        LineScanner scanner = new LineScanner(sourceName, text);
        if (DebugFlags.isLineDebugEnabled()) {
            DebugFlags.logLines(scanner);
        }
        List<ScannedLine> lines = scanner.scanAll();
        FrontmatterReader.Frontmatter frontmatter = FrontmatterReader.read(lines);
        BlockForest forest =
                BlockStructurer.structure(lines.subList(frontmatter.getBodyStart(), lines.size()));

        List<DocumentEntry> entries = new ArrayList<>();
        RawBlock preamble = forest.getPreamble();
        if (!preamble.isEmpty()) {
            entries.add(
                    new Workout(
                            Heading.anonymous(null),
                            StepParser.parseAll(preamble.getChildren()),
                            preamble.getNotes()));
        }

        SessionBuilder session = null;
        for (RawBlock block : forest.getHeadings()) {
            ScannedLine line = block.getLine();
            Heading heading = HeadingParser.parse(line);
            List<Step> steps = StepParser.parseAll(block.getChildren());
            if (line.getKind() == LineKind.SESSION_HEADING) {
                if (session != null) {
                    entries.add(session.build());
                }
                session = new SessionBuilder(heading, steps, block.getNotes());
                continue;
            }
            Workout workout = new Workout(heading, steps, block.getNotes());
            if (workout.isEmpty()) {
                continue;
            }
            if (session != null) {
                session.workouts.add(workout);
            } else {
                entries.add(workout);
            }
        }
        if (session != null) {
            entries.add(session.build());
        }

        Document document = new Document(frontmatter.getMetadata(), entries);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(
                    Level.FINE,
                    "Parsed {0}: {1} entries, {2} workouts, {3} metadata keys",
                    new Object[] {
                        sourceName,
                        entries.size(),
                        document.getAllWorkouts().size(),
                        frontmatter.getMetadata().size()
                    });
        }
        return document;
    }

    private static final class SessionBuilder {
        private final Heading heading;
        private final List<Step> steps;
        private final List<String> notes;
        private final List<Workout> workouts = new ArrayList<>();

        SessionBuilder(Heading heading, List<Step> steps, List<String> notes) {
            this.heading = heading;
            this.steps = steps;
            this.notes = notes;
        }

        Session build() {
            return new Session(heading, steps, workouts, notes);
        }
    }
}
