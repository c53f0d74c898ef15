package com.openworkout.owf.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

final class LineTokenizer {
    private LineTokenizer() {}

    static List<LineToken> tokenize(String content, int firstColumn) {
        List<LineToken> tokens = new ArrayList<>();
        int i = 0;
        int length = content.length();
        while (i < length) {
            while (i < length && Character.isWhitespace(content.charAt(i))) {
                i++;
            }
            int start = i;
            while (i < length && !Character.isWhitespace(content.charAt(i))) {
                i++;
            }
            if (i > start) {
                tokens.add(new LineToken(content.substring(start, i), firstColumn + start));
            }
        }
        return tokens;
    }

    static String join(List<LineToken> tokens) {
        StringJoiner joiner = new StringJoiner(" ");
        for (LineToken token : tokens) {
            joiner.add(token.getText());
        }
        return joiner.toString();
    }
}
