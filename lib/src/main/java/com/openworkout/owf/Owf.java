package com.openworkout.owf;

import com.openworkout.owf.ast.Document;
import com.openworkout.owf.parser.DocumentParser;
import com.openworkout.owf.parser.OwfParseException;
import com.openworkout.owf.resolve.OwfResolveException;
import com.openworkout.owf.resolve.Resolver;
import com.openworkout.owf.serialize.Serializer;
import java.util.Map;

/**
 * Entry points of the library: text to tree, variable resolution, and tree back to text. All
 * methods are stateless and safe to call from several threads.
 */
public final class Owf {
    /** Source name used in error locations when the caller does not supply one. */
    public static final String DEFAULT_SOURCE = "<string>";

    private Owf() {}

    public static Document parse(String text) throws OwfParseException {
        return parse(DEFAULT_SOURCE, text);
    }

    public static Document parse(String sourceName, String text) throws OwfParseException {
        return new DocumentParser(sourceName).parse(text);
    }

    /**
     * Returns a copy of {@code document} with every expression replaced by a literal.
     *
     * @throws OwfResolveException for an undefined variable, an unreadable variable value or
     *     incompatible units
     */
    public static Document resolve(Document document, Map<String, String> variables)
            throws OwfResolveException {
        return new Resolver(variables).resolve(document);
    }

    public static String dumps(Document document) {
        return Serializer.dumps(document);
    }
}
