package com.openworkout.owf.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String LINES_PROPERTY = "owf.debugLines";
    private static final String BLOCKS_PROPERTY = "owf.debugBlocks";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String LINES_ENV = "OWF_DEBUG_LINES";
    private static final String BLOCKS_ENV = "OWF_DEBUG_BLOCKS";
    private static final ThreadLocal<List<String>> CAPTURED_LINES =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_BLOCKS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isLineDebugEnabled() {
        return isEnabled(LINES_PROPERTY, LINES_ENV);
    }

    public static boolean isBlockDebugEnabled() {
        return isEnabled(BLOCKS_PROPERTY, BLOCKS_ENV);
    }

    private static boolean isEnabled(String property, String env) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(env));
    }

    static void logLines(Iterable<ScannedLine> lines) {
        LOGGER.info("[OWF] Line classification dump:");
        for (ScannedLine line : lines) {
            String entry =
                    String.format(
                            Locale.ROOT,
                            "%-16s @ %4d depth=%d -> %s",
                            line.getKind(),
                            line.getLineNumber(),
                            line.getDepth(),
                            line.getContent());
            LOGGER.log(Level.INFO, "  {0}", entry);
            CAPTURED_LINES.get().add(entry);
        }
    }

    static void logBlocks(BlockForest forest) {
        LOGGER.info("[OWF] Block tree dump:");
        List<String> rendered = forest.describe();
        for (String entry : rendered) {
            LOGGER.log(Level.INFO, "  {0}", entry);
        }
        CAPTURED_BLOCKS.get().addAll(rendered);
    }

    public static List<String> drainCapturedLines() {
        List<String> captured = new ArrayList<>(CAPTURED_LINES.get());
        CAPTURED_LINES.get().clear();
        return captured;
    }

    public static List<String> drainCapturedBlocks() {
        List<String> captured = new ArrayList<>(CAPTURED_BLOCKS.get());
        CAPTURED_BLOCKS.get().clear();
        return captured;
    }
}
