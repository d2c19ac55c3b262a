package com.dcruver.ragindex.sync;

import com.dcruver.ragindex.domain.SourceFile;
import com.dcruver.ragindex.domain.SyncPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares a directory snapshot with the persisted file index.
 *
 * Change detection is mtime-only: a file rewritten with an identical
 * modification time is treated as unchanged.
 */
@Component
@Slf4j
public class FileSynchronizer {

    public SyncPlan reconcile(List<SourceFile> currentFiles, Map<String, Long> persisted) {
        List<String> toIndex = new ArrayList<>();
        Set<String> currentPaths = new HashSet<>();
        int unchanged = 0;

        for (SourceFile file : currentFiles) {
            currentPaths.add(file.getPath());
            Long recorded = persisted.get(file.getPath());
            if (recorded == null || recorded != file.getModifiedTime()) {
                toIndex.add(file.getPath());
            } else {
                unchanged++;
            }
        }

        List<String> toDelete = new ArrayList<>();
        for (String path : persisted.keySet()) {
            if (!currentPaths.contains(path)) {
                toDelete.add(path);
            }
        }

        Collections.sort(toIndex);
        Collections.sort(toDelete);

        log.info("Reconciled {} files: {} to index, {} to delete, {} unchanged",
            currentFiles.size(), toIndex.size(), toDelete.size(), unchanged);
        return new SyncPlan(List.copyOf(toIndex), List.copyOf(toDelete), unchanged);
    }
}
