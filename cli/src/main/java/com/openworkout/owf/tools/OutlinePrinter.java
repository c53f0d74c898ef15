package com.openworkout.owf.tools;

import com.openworkout.owf.ast.ContainerStep;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.DocumentEntry;
import com.openworkout.owf.ast.Heading;
import com.openworkout.owf.ast.Session;
import com.openworkout.owf.ast.Step;
import com.openworkout.owf.ast.Workout;
import com.openworkout.owf.serialize.Serializer;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/** Human-readable outline of a document: underlined titles and indented steps. */
final class OutlinePrinter {
    private static final String UNTITLED = "(untitled)";

    private final PrintStream out;

    OutlinePrinter(PrintStream out) {
        this.out = out;
    }

    void print(Document document) {
        if (!document.getMetadata().isEmpty()) {
            out.println("Variables:");
            for (Map.Entry<String, String> entry : document.getMetadata().entrySet()) {
                out.println("  " + entry.getKey() + ": " + entry.getValue());
            }
            out.println();
        }
        for (DocumentEntry entry : document.getEntries()) {
            if (entry instanceof Session session) {
                printSession(session);
            } else if (entry instanceof Workout workout) {
                printWorkout(workout, "");
            }
        }
    }

    private void printSession(Session session) {
        String title = "Session: " + title(session.getHeading(), session.getModality());
        out.println(title);
        out.println("=".repeat(title.length()));
        printSteps(session.getSteps(), 1);
        printNotes(session.getNotes(), "  ");
        out.println();
        for (Workout workout : session.getWorkouts()) {
            printWorkout(workout, "  ");
        }
    }

    private void printWorkout(Workout workout, String indent) {
        String title = title(workout.getHeading(), workout.getHeading().getModality());
        out.println(indent + title);
        out.println(indent + "-".repeat(title.length()));
        printSteps(workout.getSteps(), indent.length() / 2 + 1);
        printNotes(workout.getNotes(), indent + "  ");
        out.println();
    }

    private void printSteps(List<Step> steps, int depth) {
        String indent = "  ".repeat(depth);
        for (Step step : steps) {
            out.println(indent + Serializer.formatStep(step));
            printNotes(step.getNotes(), indent + "  ");
            if (step instanceof ContainerStep container) {
                printSteps(container.getChildren(), depth + 1);
            }
        }
    }

    private void printNotes(List<String> notes, String indent) {
        for (String note : notes) {
            out.println(indent + "> " + note);
        }
    }

    private static String title(Heading heading, String modality) {
        String name = heading.getName().isEmpty() ? UNTITLED : heading.getName();
        return modality == null ? name : name + " [" + modality + "]";
    }
}
