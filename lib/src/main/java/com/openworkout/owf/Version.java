package com.openworkout.owf;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 1;
    static final int PATCH = 0;

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH;
    /** Revision of the workout text format this library reads and writes. */
    public static final String FORMAT = "1";
    public static final String RUNTIME = FULL + " (OWF format " + FORMAT + ")";

    private Version() {}
}
