package com.dcruver.ragindex.sync;

import com.dcruver.ragindex.domain.IndexingException;
import com.dcruver.ragindex.domain.SourceFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Takes a snapshot of the indexable files under a source directory.
 * Hidden directories are skipped; files are matched by extension.
 */
@Slf4j
public class SourceScanner {

    private final Set<String> extensions;

    public SourceScanner(List<String> extensions) {
        this.extensions = extensions.stream()
            .map(ext -> ext.startsWith(".") ? ext : "." + ext)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Scan the directory and return every matching file with its modification time,
     * sorted by path.
     */
    public List<SourceFile> scan(Path root) {
        Path sourceDir = root.toAbsolutePath().normalize();

        if (!Files.exists(sourceDir)) {
            throw new IndexingException("Source directory does not exist: " + sourceDir);
        }
        if (!Files.isDirectory(sourceDir)) {
            throw new IndexingException("Source path is not a directory: " + sourceDir);
        }

        log.info("Scanning source directory: {}", sourceDir);
        List<SourceFile> files = new ArrayList<>();

        try {
            Files.walkFileTree(sourceDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(sourceDir) && dir.getFileName().toString().startsWith(".")) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && matches(file)) {
                        files.add(new SourceFile(file.toString(), attrs.lastModifiedTime().toMillis()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Skipping unreadable entry {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new IndexingException("Failed to scan " + sourceDir, e);
        }

        files.sort(Comparator.comparing(SourceFile::getPath));
        log.info("Found {} indexable files", files.size());
        return files;
    }

    private boolean matches(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot));
    }
}
