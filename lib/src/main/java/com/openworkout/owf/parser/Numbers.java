package com.openworkout.owf.parser;

import com.openworkout.owf.ast.SourceLocation;

/** Integer conversion for digit runs already matched by a grammar pattern. */
final class Numbers {

    private Numbers() {}

    /**
     * Parses {@code digits} as an {@code int}.
     *
     * @throws OwfParseException at {@code location} when the value does not fit
     */
    static int toInt(String digits, SourceLocation location, String what) throws OwfParseException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw new OwfParseException(location, what + " '" + digits + "' is too large", ex);
        }
    }
}
