package com.openworkout.owf.parser;

import com.openworkout.owf.ast.SourceLocation;

/** Raised for the first syntax error in a document; no partial tree is produced. */
public final class OwfParseException extends Exception {
    private final SourceLocation location;
    private final String reason;

    public OwfParseException(String message) {
        super(message);
        this.location = null;
        this.reason = message;
    }

    public OwfParseException(String message, Throwable cause) {
        super(message, cause);
        this.location = null;
        this.reason = message;
    }

    public OwfParseException(SourceLocation location, String reason) {
        super(location + ": " + reason);
        this.location = location;
        this.reason = reason;
    }

    public OwfParseException(SourceLocation location, String reason, Throwable cause) {
        super(location + ": " + reason, cause);
        this.location = location;
        this.reason = reason;
    }

    /** Where the error was detected, or {@code null} when unknown. */
    public SourceLocation getLocation() {
        return location;
    }

    /** Error text without the location prefix. */
    public String getReason() {
        return reason;
    }
}
