package com.openworkout.owf.loader;

/**
 * Checked exception signalling that a workout file could not be read, parsed, or have its includes
 * expanded. Parse failures are wrapped so callers see a single failure type per file.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
