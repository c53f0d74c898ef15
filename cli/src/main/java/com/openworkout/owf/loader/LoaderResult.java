package com.openworkout.owf.loader;

import com.openworkout.owf.ast.Document;
import java.util.List;
import java.util.Objects;

/** A loaded document with every include expanded, plus the diagnostics collected on the way. */
public final class LoaderResult {
    private final Document document;
    private final List<LoaderMessage> messages;

    public LoaderResult(Document document, List<LoaderMessage> messages) {
        this.document = Objects.requireNonNull(document, "document");
        this.messages = List.copyOf(messages);
    }

    public Document getDocument() {
        return document;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public boolean hasErrors() {
        for (LoaderMessage message : messages) {
            if (message.getLevel() == LoaderMessage.Level.ERROR) {
                return true;
            }
        }
        return false;
    }
}
