package com.openworkout.owf.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class TestResources {

    private TestResources() {}

    /** Reads a UTF-8 classpath resource such as {@code examples/full.owf}. */
    public static String read(String resourceName) {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(normalized)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + normalized);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + normalized, ex);
        }
    }
}
