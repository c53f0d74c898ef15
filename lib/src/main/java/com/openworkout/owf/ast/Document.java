package com.openworkout.owf.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Parsed workout file: frontmatter metadata plus the ordered workouts and sessions. */
public final class Document {
    private final Map<String, String> metadata;
    private final List<DocumentEntry> entries;

    public Document(Map<String, String> metadata, List<DocumentEntry> entries) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.entries = List.copyOf(entries);
    }

    /** Frontmatter key/value pairs in file order. Informational; never used for resolution. */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    public List<DocumentEntry> getEntries() {
        return entries;
    }

    /** Every workout in document order, session children included. */
    public List<Workout> getAllWorkouts() {
        List<Workout> result = new ArrayList<>();
        for (DocumentEntry entry : entries) {
            if (entry instanceof Workout workout) {
                result.add(workout);
            } else if (entry instanceof Session session) {
                result.addAll(session.getWorkouts());
            }
        }
        return result;
    }

    public Document withEntries(List<DocumentEntry> newEntries) {
        return new Document(metadata, newEntries);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Document)) {
            return false;
        }
        Document other = (Document) obj;
        return metadata.equals(other.metadata) && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, entries);
    }

    @Override
    public String toString() {
        return "Document[" + entries.size() + " entries]";
    }
}
