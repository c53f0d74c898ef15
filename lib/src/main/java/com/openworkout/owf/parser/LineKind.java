package com.openworkout.owf.parser;

public enum LineKind {
    METADATA_FENCE,
    SESSION_HEADING,
    WORKOUT_HEADING,
    STEP,
    NOTE,
    BLANK,
    TEXT
}
