package com.openworkout.owf.loader.validation;

import com.openworkout.owf.ast.Document;
import com.openworkout.owf.loader.LoaderMessage;
import java.util.List;

/**
 * A single check over a parsed document that emits diagnostics. Rules report problems in the
 * order they appear in the document.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against the given document.
     *
     * @param document Parsed document, before include expansion.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<LoaderMessage> validate(Document document);
}
