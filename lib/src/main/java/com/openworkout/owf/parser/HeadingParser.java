package com.openworkout.owf.parser;

import com.openworkout.owf.ast.Heading;
import com.openworkout.owf.ast.WorkoutDate;
import com.openworkout.owf.units.DecimalParser;
import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses {@code name [type] (YYYY-MM-DD HH:MM-HH:MM) @RPE n @RIR n}; parts appear in that order. */
final class HeadingParser {
    private static final Pattern RPE =
            Pattern.compile("@RPE\\s*(\\d+(?:\\.\\d+)?)(?=\\s|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RIR =
            Pattern.compile("@RIR\\s*(\\d+)(?=\\s|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_RPE = Pattern.compile("@RPE", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_RIR = Pattern.compile("@RIR", Pattern.CASE_INSENSITIVE);

    private HeadingParser() {}

    static Heading parse(ScannedLine line) throws OwfParseException {
        String content = line.getContent();
        Cursor cursor = new Cursor(line, content);

        String name = cursor.takeName();
        String modality = null;
        WorkoutDate date = null;
        BigDecimal rpe = null;
        Integer rir = null;

        if (cursor.startsWith('[')) {
            String tag = cursor.takeEnclosed('[', ']');
            if (tag.isEmpty()) {
                throw cursor.error("Empty workout type '[]'");
            }
            modality = tag;
        }
        if (cursor.startsWith('(')) {
            int column = cursor.column();
            String spec = cursor.takeEnclosed('(', ')');
            try {
                date = WorkoutDate.parse(spec);
            } catch (IllegalArgumentException ex) {
                throw new OwfParseException(line.locationAt(column), ex.getMessage(), ex);
            }
        }
        Matcher rpeMatcher = cursor.match(RPE);
        if (rpeMatcher != null) {
            rpe = DecimalParser.parse(rpeMatcher.group(1));
        }
        int rirColumn = cursor.column();
        Matcher rirMatcher = cursor.match(RIR);
        if (rirMatcher != null) {
            rir = Numbers.toInt(rirMatcher.group(1), line.locationAt(rirColumn), "@RIR value");
        }
        if (!cursor.atEnd()) {
            if (cursor.matches(ANY_RPE)) {
                if (rir != null) {
                    throw cursor.error("@RPE must come before @RIR");
                }
                throw cursor.error(rpe != null ? "Duplicate @RPE in heading" : "Invalid @RPE value");
            }
            if (cursor.matches(ANY_RIR)) {
                throw cursor.error(rir != null ? "Duplicate @RIR in heading" : "Invalid @RIR value");
            }
            throw cursor.error("Unexpected '" + cursor.remaining() + "' in heading");
        }
        return new Heading(line.getLocation(), name, modality, date, rpe, rir);
    }

    /** Position within the heading content; remaining text never has leading whitespace. */
    private static final class Cursor {
        private final ScannedLine line;
        private final String content;
        private String rest;

        Cursor(ScannedLine line, String content) {
            this.line = line;
            this.content = content;
            this.rest = content;
        }

        String takeName() {
            int end = rest.length();
            for (char stop : new char[] {'[', '(', '@'}) {
                int index = rest.indexOf(stop);
                if (index >= 0 && index < end) {
                    end = index;
                }
            }
            String name = rest.substring(0, end).strip();
            advance(end);
            return name;
        }

        boolean startsWith(char c) {
            return !rest.isEmpty() && rest.charAt(0) == c;
        }

        String takeEnclosed(char open, char close) throws OwfParseException {
            int end = rest.indexOf(close);
            if (end < 0) {
                throw error("Missing '" + close + "' after '" + open + "'");
            }
            String inner = rest.substring(1, end).strip();
            advance(end + 1);
            return inner;
        }

        Matcher match(Pattern pattern) {
            Matcher matcher = pattern.matcher(rest);
            if (!matcher.lookingAt()) {
                return null;
            }
            advance(matcher.end());
            return matcher;
        }

        boolean matches(Pattern pattern) {
            return pattern.matcher(rest).lookingAt();
        }

        boolean atEnd() {
            return rest.isEmpty();
        }

        String remaining() {
            return rest;
        }

        int column() {
            return line.getContentColumn() + content.length() - rest.length();
        }

        OwfParseException error(String reason) {
            return new OwfParseException(line.locationAt(column()), reason);
        }

        private void advance(int count) {
            rest = rest.substring(count).stripLeading();
        }
    }
}
