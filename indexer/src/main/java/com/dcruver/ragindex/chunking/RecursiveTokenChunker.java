package com.dcruver.ragindex.chunking;

import com.dcruver.ragindex.domain.TextUnit;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits text against a token budget, preferring coarse boundaries.
 *
 * Separators are tried from coarse to fine: paragraph break, line break,
 * sentence terminators, secondary punctuation, single space and finally single
 * characters. A span that fits the budget is kept whole; otherwise its pieces
 * are greedily re-joined into groups that fit, and the first group is split
 * again until it fits.
 *
 * Units are produced by a cursor that re-runs the split over the remaining
 * suffix of the document on every step and keeps only the first group. The
 * rest of the suffix is recomputed on the next step, so each step costs a scan
 * of the remainder. Boundaries depend on where each step starts (overlap moves
 * the start back), which is why the full boundary list is never precomputed.
 */
public class RecursiveTokenChunker implements Chunker {

    private static final List<String> SEPARATORS = List.of(
        "\n\n",
        "\n",
        ". ",
        "! ",
        "? ",
        "; ",
        ", ",
        " ",
        ""
    );

    private static final double MAX_OVERLAP_RATIO = 0.5;

    @Override
    public List<TextUnit> chunk(String text, String sourcePath, ChunkingOptions options) {
        List<TextUnit> units = new ArrayList<>();
        iterate(text, sourcePath, options).forEachRemaining(units::add);
        return units;
    }

    /**
     * Lazily produce the units of {@code text}, one split per step.
     */
    public Iterator<TextUnit> iterate(String text, String sourcePath, ChunkingOptions options) {
        if (text == null || text.isBlank()) {
            return List.<TextUnit>of().iterator();
        }
        return new UnitCursor(text, sourcePath, options);
    }

    /**
     * Leading segment of {@code span} that fits {@code budget}.
     * Always a prefix of {@code span}.
     */
    static String firstSegment(String span, int budget) {
        int tokens = TokenEstimator.estimate(span);
        if (tokens <= budget) {
            return span;
        }

        for (String separator : SEPARATORS) {
            String group = leadingGroup(span, separator, budget);
            if (group != null) {
                return firstSegment(group, budget);
            }
        }

        // One unbreakable token: cut proportionally, possibly mid-word
        return span.substring(0, (int) Math.floor((double) span.length() * budget / tokens));
    }

    /**
     * First group produced by splitting {@code span} on {@code separator} and greedily
     * re-joining the pieces within {@code budget}, or null when the separator does not
     * break the span into more than one group.
     */
    private static String leadingGroup(String span, String separator, int budget) {
        int firstEnd = pieceEnd(span, separator, 0);
        // A leading separator belongs to the piece after it, so no group is ever empty
        if (firstEnd == 0) {
            firstEnd = pieceEnd(span, separator, separator.length());
        }
        if (firstEnd >= span.length()) {
            return null;
        }

        // A first piece over budget forms a group of its own
        if (!fits(span.substring(0, firstEnd), budget)) {
            return closeGroup(span, separator, firstEnd);
        }

        int groupEnd = firstEnd;
        int pieceStart = firstEnd + separator.length();
        while (true) {
            int end = pieceEnd(span, separator, pieceStart);
            // Pieces joined by their separator are exactly a prefix of the span
            if (!fits(span.substring(0, end), budget)) {
                return closeGroup(span, separator, groupEnd);
            }
            if (end >= span.length()) {
                return null;
            }
            groupEnd = end;
            pieceStart = end + separator.length();
        }
    }

    /**
     * The group ending at {@code groupEnd}, or null when nothing but empty pieces
     * follow it. Empty pieces never form a group, so such a span does not break
     * on this separator.
     */
    private static String closeGroup(String span, String separator, int groupEnd) {
        int rest = groupEnd;
        while (!separator.isEmpty() && span.startsWith(separator, rest)) {
            rest += separator.length();
        }
        return rest >= span.length() ? null : span.substring(0, groupEnd);
    }

    private static int pieceEnd(String span, String separator, int from) {
        if (separator.isEmpty()) {
            return Math.min(from + 1, span.length());
        }
        int index = span.indexOf(separator, from);
        return index < 0 ? span.length() : index;
    }

    private static boolean fits(String candidate, int budget) {
        return TokenEstimator.estimate(candidate) <= budget;
    }

    private static final class UnitCursor implements Iterator<TextUnit> {

        private final String text;
        private final String sourcePath;
        private final int targetTokens;
        private final int overlapTokens;
        private final LineIndex lineIndex;

        private int start;
        private boolean exhausted;
        private TextUnit next;

        private UnitCursor(String text, String sourcePath, ChunkingOptions options) {
            this.text = text;
            this.sourcePath = sourcePath;
            this.targetTokens = options.getSize();
            this.overlapTokens = options.getOverlap();
            this.lineIndex = new LineIndex(text);
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public TextUnit next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TextUnit unit = next;
            next = null;
            return unit;
        }

        private TextUnit advance() {
            while (!exhausted && start < text.length()) {
                String segment = firstSegment(text.substring(start), targetTokens);
                int segmentStart = start;
                int end = start + segment.length();

                if (end >= text.length()) {
                    exhausted = true;
                } else {
                    start = nextStart(segment, segmentStart, end);
                }

                String trimmed = segment.strip();
                if (!trimmed.isEmpty()) {
                    return TextUnit.builder()
                        .text(trimmed)
                        .sourcePath(sourcePath)
                        .startLine(lineIndex.lineNumber(segmentStart))
                        .endLine(lineIndex.lineNumber(end - 1))
                        .startOffset(segmentStart)
                        .endOffset(end)
                        .build();
                }
            }
            return null;
        }

        private int nextStart(String segment, int segmentStart, int end) {
            double overlapRatio = 0;
            if (overlapTokens > 0) {
                int segmentTokens = TokenEstimator.estimate(segment);
                overlapRatio = segmentTokens == 0
                    ? MAX_OVERLAP_RATIO
                    : Math.min((double) overlapTokens / segmentTokens, MAX_OVERLAP_RATIO);
            }
            int overlapChars = (int) Math.floor(segment.length() * overlapRatio);

            // At least one character of progress, never past the segment end
            int candidate = Math.max(segmentStart + 1, end - overlapChars);
            return Math.min(candidate, Math.max(end, segmentStart + 1));
        }
    }
}
