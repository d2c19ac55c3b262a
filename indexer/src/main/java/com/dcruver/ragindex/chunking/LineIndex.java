package com.dcruver.ragindex.chunking;

import java.util.Arrays;

/**
 * Line-start offset table for one document, answering "which line holds offset n".
 */
final class LineIndex {

    private final int[] lineStarts;

    LineIndex(String text) {
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }

        // One extra entry marks the position just past the last line
        lineStarts = new int[lines + 1];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
        lineStarts[lines] = text.length() + 1;
    }

    /**
     * 1-indexed line number containing the character at {@code offset}.
     * Offsets past the end map to the last line.
     */
    int lineNumber(int offset) {
        int lastLine = lineStarts.length - 2;
        if (offset <= 0) {
            return 1;
        }
        if (offset >= lineStarts[lastLine + 1]) {
            return lastLine + 1;
        }

        int found = Arrays.binarySearch(lineStarts, 0, lastLine + 1, offset);
        int lineIndex = found >= 0 ? found : -found - 2;
        return lineIndex + 1;
    }
}
