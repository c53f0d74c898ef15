package com.openworkout.owf.loader.validation;

import com.openworkout.owf.ast.Document;
import com.openworkout.owf.ast.SourceLocation;
import com.openworkout.owf.ast.Workout;
import com.openworkout.owf.loader.LoaderMessage;
import com.openworkout.owf.loader.LoaderMessage.Level;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Warns about workouts sharing a name. Includes resolve to the first workout with a matching
 * name, so later ones can never be included. Anonymous workouts are ignored.
 */
final class DuplicateWorkoutNameRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(Document document) {
        Map<String, SourceLocation> firstSeen = new HashMap<>();
        List<LoaderMessage> messages = new ArrayList<>();
        for (Workout workout : document.getAllWorkouts()) {
            String name = workout.getName();
            if (name.isEmpty()) {
                continue;
            }
            SourceLocation location = workout.getHeading().getLocation();
            if (!firstSeen.containsKey(name)) {
                firstSeen.put(name, location);
            } else {
                SourceLocation previous = firstSeen.get(name);
                String message = "Duplicate workout name '" + name + "'";
                if (previous != null) {
                    message += " (first defined on line " + previous.getLine() + ")";
                }
                messages.add(LoaderMessage.at(Level.WARNING, message, location));
            }
        }
        return messages;
    }
}
