package com.openworkout.owf.loader;

import com.openworkout.owf.Owf;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.loader.validation.ValidationRunner;
import com.openworkout.owf.parser.OwfParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@code .owf} files from disk. Loading parses the file, runs the validation rules, then
 * splices every {@code include:} step with the steps of the workout it names.
 *
 * <p>An include is looked up among the workouts of the same document first, then in a sibling
 * file named after the workout ({@code "Warm Up"} becomes {@code warm-up.owf}).
 */
public final class OwfLoader {
    private static final Logger LOGGER = Logger.getLogger(OwfLoader.class.getName());

    private final ValidationRunner validation;

    public OwfLoader() {
        this(ValidationRunner.defaultRules());
    }

    public OwfLoader(ValidationRunner validation) {
        this.validation = Objects.requireNonNull(validation, "validation");
    }

    public LoaderResult load(Path path) throws LoaderException {
        Objects.requireNonNull(path, "path");
        Document document = readDocument(path);
        List<LoaderMessage> messages = new ArrayList<>(validation.run(document));
        IncludeExpander expander = new IncludeExpander(messages);
        Document expanded = expander.expand(path, document);
        for (LoaderMessage message : messages) {
            if (message.getLevel() != LoaderMessage.Level.INFO) {
                LOGGER.log(Level.WARNING, "{0}", message);
            }
        }
        return new LoaderResult(expanded, messages);
    }

    /** Reads and parses one file without expanding its includes. */
    public static Document readDocument(Path path) throws LoaderException {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoaderException("Failed to read workout file: " + path, e);
        }
        try {
            return Owf.parse(path.toString(), text);
        } catch (OwfParseException e) {
            throw new LoaderException(e.getMessage(), e);
        }
    }

    /** File name an include of {@code workoutName} is looked up under. */
    public static String fileNameFor(String workoutName) {
        return workoutName.trim().toLowerCase(Locale.ROOT).replace(' ', '-') + ".owf";
    }
}
