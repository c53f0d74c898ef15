package com.openworkout.owf.loader;

import com.openworkout.owf.ast.ContainerStep;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.DocumentEntry;
import com.openworkout.owf.ast.IncludeStep;
import com.openworkout.owf.ast.Session;
import com.openworkout.owf.ast.SourceLocation;
import com.openworkout.owf.ast.Step;
import com.openworkout.owf.ast.Workout;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces include steps with the steps of their target workouts, recursively. One expander is
 * used per top-level load so sibling files are read at most once.
 */
final class IncludeExpander {
    private static final Logger LOGGER = Logger.getLogger(IncludeExpander.class.getName());

    private final List<LoaderMessage> messages;
    private final Map<Path, Document> documents = new HashMap<>();
    // Workouts currently being expanded, outermost first, as "file#name".
    private final List<String> active = new ArrayList<>();
    private final List<String> activeNames = new ArrayList<>();

    IncludeExpander(List<LoaderMessage> messages) {
        this.messages = messages;
    }

    Document expand(Path path, Document document) throws LoaderException {
        Path file = canonical(path);
        documents.put(file, document);
        List<DocumentEntry> entries = new ArrayList<>();
        for (DocumentEntry entry : document.getEntries()) {
            if (entry instanceof Workout workout) {
                entries.add(expandWorkout(file, document, workout));
            } else if (entry instanceof Session session) {
                entries.add(expandSession(file, document, session));
            }
        }
        return document.withEntries(entries);
    }

    private Session expandSession(Path file, Document document, Session session)
            throws LoaderException {
        String key = enter(file, session.getName(), session.getHeading().getLocation());
        List<Step> steps;
        try {
            steps = expandSteps(file, document, session.getSteps());
        } finally {
            leave(key);
        }
        List<Workout> workouts = new ArrayList<>();
        for (Workout workout : session.getWorkouts()) {
            workouts.add(expandWorkout(file, document, workout));
        }
        return session.withContent(steps, workouts);
    }

    private Workout expandWorkout(Path file, Document document, Workout workout)
            throws LoaderException {
        String key = enter(file, workout.getName(), workout.getHeading().getLocation());
        try {
            return workout.withSteps(expandSteps(file, document, workout.getSteps()));
        } finally {
            leave(key);
        }
    }

    private List<Step> expandSteps(Path file, Document document, List<Step> steps)
            throws LoaderException {
        List<Step> expanded = new ArrayList<>(steps.size());
        for (Step step : steps) {
            if (step instanceof IncludeStep include) {
                expanded.addAll(expandInclude(file, document, include));
            } else if (step instanceof ContainerStep container) {
                List<Step> children = expandSteps(file, document, container.getChildren());
                if (children.isEmpty()) {
                    throw new LoaderException(
                            where(container.getLocation())
                                    + "Container has no steps after expanding includes");
                }
                expanded.add(container.withChildren(children));
            } else {
                expanded.add(step);
            }
        }
        return expanded;
    }

    private List<Step> expandInclude(Path file, Document document, IncludeStep include)
            throws LoaderException {
        String name = include.getWorkoutName();
        Path targetFile = file;
        Document targetDocument = document;
        Workout target = findWorkout(document, name);
        if (target == null) {
            targetFile = canonical(file.resolveSibling(OwfLoader.fileNameFor(name)));
            if (!Files.isRegularFile(targetFile)) {
                throw new LoaderException(
                        where(include.getLocation())
                                + "Cannot resolve include '"
                                + name
                                + "' (not found in document or as "
                                + targetFile
                                + ")");
            }
            targetDocument = documents.get(targetFile);
            if (targetDocument == null) {
                targetDocument = OwfLoader.readDocument(targetFile);
                documents.put(targetFile, targetDocument);
            }
            target = findWorkout(targetDocument, name);
            List<Workout> all = targetDocument.getAllWorkouts();
            if (target == null && all.size() == 1) {
                target = all.get(0);
            }
            if (target == null) {
                throw new LoaderException(
                        where(include.getLocation())
                                + "Cannot find workout '"
                                + name
                                + "' in "
                                + targetFile);
            }
        }
        if (!include.getNotes().isEmpty()) {
            messages.add(
                    LoaderMessage.at(
                            LoaderMessage.Level.WARNING,
                            "Notes on include of '" + name + "' are dropped when it is expanded",
                            include.getLocation()));
        }
        LOGGER.log(
                Level.FINE,
                "Expanding include of {0} from {1}",
                new Object[] {name, targetFile.getFileName()});
        return expandWorkout(targetFile, targetDocument, target).getSteps();
    }

    private String enter(Path file, String name, SourceLocation location) throws LoaderException {
        String key = file + "#" + name;
        int start = active.indexOf(key);
        if (start >= 0) {
            StringBuilder chain = new StringBuilder();
            for (String entered : activeNames.subList(start, activeNames.size())) {
                chain.append(entered).append(" -> ");
            }
            chain.append(name);
            throw new LoaderException(where(location) + "Include cycle detected: " + chain);
        }
        active.add(key);
        activeNames.add(name);
        return key;
    }

    private void leave(String key) {
        int index = active.lastIndexOf(key);
        active.remove(index);
        activeNames.remove(index);
    }

    private static Workout findWorkout(Document document, String name) {
        for (Workout workout : document.getAllWorkouts()) {
            if (workout.getName().equals(name)) {
                return workout;
            }
        }
        return null;
    }

    private static String where(SourceLocation location) {
        return location == null ? "" : location + ": ";
    }

    private static Path canonical(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
