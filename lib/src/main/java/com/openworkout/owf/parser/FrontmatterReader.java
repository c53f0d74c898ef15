package com.openworkout.owf.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the optional {@code ---} fenced block of {@code key: value} lines at the top of a
 * document. The opening fence must be the first non-blank line; otherwise the document has no
 * frontmatter.
 */
final class FrontmatterReader {
    private static final Pattern KEY_VALUE = Pattern.compile("(.+?):\\s*(.+)");

    private FrontmatterReader() {}

    static Frontmatter read(List<ScannedLine> lines) throws OwfParseException {
        int start = 0;
        while (start < lines.size() && lines.get(start).getKind() == LineKind.BLANK) {
            start++;
        }
        if (start == lines.size() || lines.get(start).getKind() != LineKind.METADATA_FENCE) {
            return new Frontmatter(Map.of(), 0);
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        for (int i = start + 1; i < lines.size(); i++) {
            ScannedLine line = lines.get(i);
            if (line.getKind() == LineKind.METADATA_FENCE) {
                return new Frontmatter(metadata, i + 1);
            }
            String text = line.getText().strip();
            if (text.isEmpty()) {
                continue;
            }
            Matcher matcher = KEY_VALUE.matcher(text);
            if (!matcher.matches()) {
                throw new OwfParseException(
                        line.locationAt(1), "Invalid frontmatter line: '" + text + "'");
            }
            metadata.put(matcher.group(1).strip(), matcher.group(2).strip());
        }
        throw new OwfParseException(
                lines.get(start).getLocation(), "Unclosed frontmatter: missing closing '---'");
    }

    static final class Frontmatter {
        private final Map<String, String> metadata;
        private final int bodyStart;

        private Frontmatter(Map<String, String> metadata, int bodyStart) {
            this.metadata = Collections.unmodifiableMap(metadata);
            this.bodyStart = bodyStart;
        }

        Map<String, String> getMetadata() {
            return metadata;
        }

        /** Index of the first line after the closing fence (0 without frontmatter). */
        int getBodyStart() {
            return bodyStart;
        }
    }
}
