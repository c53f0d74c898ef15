package com.openworkout.owf.ast;

import java.util.List;

/** Top-level item of a document: a workout or a session of workouts. */
public sealed interface DocumentEntry permits Workout, Session {

    Heading getHeading();

    List<Step> getSteps();

    List<String> getNotes();

    <R> R accept(EntryVisitor<R> visitor);
}
