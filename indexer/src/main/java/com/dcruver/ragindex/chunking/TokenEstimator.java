package com.dcruver.ragindex.chunking;

import java.util.List;

/**
 * Word-count heuristic for token counts. Used for sizing decisions only;
 * callers must treat the result as approximate and leave margin.
 */
public final class TokenEstimator {

    private static final double LONG_WORD_CHARS = 5.0;
    private static final double LONG_WORD_TOKENS = 1.3;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }

        int words = 0;
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            boolean space = isSpace(text.charAt(i));
            if (!space && !inWord) {
                words++;
                inWord = true;
            } else if (space) {
                inWord = false;
            }
        }

        if (words == 0) {
            return 0;
        }

        double charsPerWord = (double) text.length() / words;
        double tokensPerWord = charsPerWord > LONG_WORD_CHARS ? LONG_WORD_TOKENS : 1.0;
        return (int) Math.ceil(words * tokensPerWord);
    }

    public static int estimate(List<String> texts) {
        int total = 0;
        for (String text : texts) {
            total += estimate(text);
        }
        return total;
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\u00A0';
    }
}
