package com.openworkout.owf.resolve;

import com.openworkout.owf.ast.SourceLocation;

/** Raised when an expression cannot be reduced to a literal. */
public final class OwfResolveException extends Exception {
    private final SourceLocation location;

    public OwfResolveException(String message) {
        super(message);
        this.location = null;
    }

    public OwfResolveException(String message, Throwable cause) {
        super(message, cause);
        this.location = null;
    }

    public OwfResolveException(SourceLocation location, String message) {
        super(location == null ? message : location + ": " + message);
        this.location = location;
    }

    /** Location of the failing expression, or {@code null} when unknown. */
    public SourceLocation getLocation() {
        return location;
    }
}
