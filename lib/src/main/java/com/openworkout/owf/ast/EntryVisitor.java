package com.openworkout.owf.ast;

public interface EntryVisitor<R> {
    R visitWorkout(Workout workout);

    R visitSession(Session session);
}
