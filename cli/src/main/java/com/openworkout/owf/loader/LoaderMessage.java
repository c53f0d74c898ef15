package com.openworkout.owf.loader;

import com.openworkout.owf.ast.SourceLocation;
import java.util.Locale;
import java.util.Objects;

/** A non-fatal diagnostic produced while loading a workout file. */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceName;
    private final int line;

    public LoaderMessage(Level level, String message, String sourceName, int line) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.sourceName = sourceName == null ? "" : sourceName;
        this.line = line;
    }

    public static LoaderMessage at(Level level, String message, SourceLocation location) {
        if (location == null) {
            return new LoaderMessage(level, message, "", 0);
        }
        return new LoaderMessage(level, message, location.getSourceName(), location.getLine());
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        String where = line > 0 ? sourceName + ":" + line + ": " : "";
        return where + level.name().toLowerCase(Locale.ROOT) + ": " + message;
    }
}
