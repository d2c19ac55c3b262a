package com.dcruver.ragindex.reporting;

import com.dcruver.ragindex.domain.FileUnitCount;
import com.dcruver.ragindex.domain.IndexingReport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders indexing reports and store statistics as plain text for the shell.
 */
@Component
public class IndexReportFormatter {

    /**
     * Format the outcome of an indexing run
     */
    public String format(IndexingReport report) {
        StringBuilder sb = new StringBuilder();

        if (report.isSuccess()) {
            sb.append("Indexing complete.\n\n");
        } else {
            sb.append(String.format("Indexing FAILED during %s: %s\n", report.getFailedStage(), report.getFailureMessage()));
            sb.append("Counts below cover work done before the failure.\n\n");
        }

        sb.append("Files:\n");
        sb.append(String.format("- Scanned: %d\n", report.getFilesScanned()));
        sb.append(String.format("- Indexed: %d\n", report.getFilesIndexed()));
        sb.append(String.format("- Unchanged: %d\n", report.getFilesUnchanged()));
        sb.append(String.format("- Deleted: %d\n", report.getFilesDeleted()));
        if (report.getFilesFailed() > 0) {
            sb.append(String.format("- Unreadable: %d\n", report.getFilesFailed()));
        }
        sb.append("\n");

        sb.append("Units:\n");
        sb.append(String.format("- Added: %d\n", report.getUnitsAdded()));
        sb.append(String.format("- Skipped (duplicates): %d\n", report.getUnitsSkipped()));
        if (report.isSuccess()) {
            sb.append(String.format("- Total in store: %d\n", report.getTotalUnitsInStore()));
        }
        sb.append("\n");

        sb.append(String.format("Took %.1fs\n", report.getDuration().toMillis() / 1000.0));
        return sb.toString();
    }

    /**
     * Format per-file unit counts, largest files first
     */
    public String formatFileStats(List<FileUnitCount> stats) {
        if (stats.isEmpty()) {
            return "No files indexed.\n";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Indexed files (%d):\n\n", stats.size()));

        stats.stream()
            .sorted((a, b) -> Integer.compare(b.unitCount(), a.unitCount()))
            .forEach(stat -> sb.append(String.format("%6d  %s\n", stat.unitCount(), stat.sourcePath())));

        int total = stats.stream().mapToInt(FileUnitCount::unitCount).sum();
        sb.append(String.format("\nTotal units: %d\n", total));
        return sb.toString();
    }
}
