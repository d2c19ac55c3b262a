package com.dcruver.ragindex.chunking;

import com.dcruver.ragindex.domain.TextUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits text into windows of a fixed number of characters.
 * A window that does not reach the end of the text is cut after the first
 * sentence end found in its last 100 characters, unless that period belongs
 * to a common abbreviation.
 */
public class FixedSizeChunker implements Chunker {

    private static final int LOOKBACK_CHARS = 100;

    private static final Set<String> ABBREVIATIONS = Set.of(
        "dr", "mr", "mrs", "ms", "prof", "sr", "jr", "vs", "etc",
        "inc", "ltd", "corp", "st", "ave", "blvd", "rd"
    );

    @Override
    public List<TextUnit> chunk(String text, String sourcePath, ChunkingOptions options) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<TextUnit> units = new ArrayList<>();
        LineIndex lineIndex = new LineIndex(text);
        int size = options.getSize();
        int overlap = options.getOverlap();

        int start = 0;
        while (start < text.length()) {
            int windowEnd = Math.min(start + size, text.length());
            int end = windowEnd;
            if (windowEnd < text.length()) {
                int sentenceEnd = findSentenceEnd(text, Math.max(start, windowEnd - LOOKBACK_CHARS), windowEnd);
                if (sentenceEnd > 0) {
                    end = sentenceEnd;
                }
            }

            String trimmed = text.substring(start, end).strip();
            if (!trimmed.isEmpty()) {
                units.add(TextUnit.builder()
                    .text(trimmed)
                    .sourcePath(sourcePath)
                    .startLine(lineIndex.lineNumber(start))
                    .endLine(lineIndex.lineNumber(end - 1))
                    .startOffset(start)
                    .endOffset(end)
                    .build());
            }

            if (end >= text.length()) {
                break;
            }
            int next = Math.max(start + 1, end - overlap);
            start = Math.min(next, Math.max(end, start + 1));
        }

        return units;
    }

    /**
     * Offset just past the first sentence terminator in {@code [from, to)} that is
     * followed by whitespace or sits at {@code to}, or -1 when there is none.
     */
    private static int findSentenceEnd(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c != '.' && c != '!' && c != '?') {
                continue;
            }
            boolean boundary = i + 1 == to || isWhitespace(text.charAt(i + 1));
            if (!boundary) {
                continue;
            }
            if (c == '.' && isAbbreviation(text, i)) {
                continue;
            }
            return i + 1;
        }
        return -1;
    }

    private static boolean isAbbreviation(String text, int periodIndex) {
        int wordStart = periodIndex;
        while (wordStart > 0 && Character.isLetter(text.charAt(wordStart - 1))) {
            wordStart--;
        }
        if (wordStart == periodIndex) {
            return false;
        }
        if (wordStart > 0 && Character.isLetterOrDigit(text.charAt(wordStart - 1))) {
            return false;
        }
        String word = text.substring(wordStart, periodIndex).toLowerCase(Locale.ROOT);
        return ABBREVIATIONS.contains(word);
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || c == '\u00A0';
    }
}
