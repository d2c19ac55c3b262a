package com.dcruver.ragindex.pipeline;

import com.dcruver.ragindex.chunking.Chunker;
import com.dcruver.ragindex.chunking.ChunkingOptions;
import com.dcruver.ragindex.domain.Batch;
import com.dcruver.ragindex.domain.FingerprintedUnit;
import com.dcruver.ragindex.domain.IndexedUnit;
import com.dcruver.ragindex.domain.IndexingReport;
import com.dcruver.ragindex.domain.IndexingStage;
import com.dcruver.ragindex.domain.SourceFile;
import com.dcruver.ragindex.domain.SyncPlan;
import com.dcruver.ragindex.domain.TextUnit;
import com.dcruver.ragindex.embedding.BatchLimits;
import com.dcruver.ragindex.embedding.BatchPlanner;
import com.dcruver.ragindex.embedding.EmbeddingBackend;
import com.dcruver.ragindex.embedding.EmbeddingExecutor;
import com.dcruver.ragindex.store.StoreException;
import com.dcruver.ragindex.store.UnitStore;
import com.dcruver.ragindex.sync.DedupResult;
import com.dcruver.ragindex.sync.Deduplicator;
import com.dcruver.ragindex.sync.DocumentReader;
import com.dcruver.ragindex.sync.FileSynchronizer;
import com.dcruver.ragindex.sync.KnownFingerprints;
import com.dcruver.ragindex.sync.SourceScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one incremental indexing pass over a source directory.
 *
 * Stages run in order SCANNING, RECONCILING, PREPARING, EMBEDDING, WRITING and
 * end in DONE, or in FAILED from whichever stage raised the error. Deletions made
 * while preparing are not rolled back when a later stage fails.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexingOrchestrator {

    private final SourceScanner sourceScanner;
    private final FileSynchronizer fileSynchronizer;
    private final DocumentReader documentReader;
    private final Chunker chunker;
    private final ChunkingOptions chunkingOptions;
    private final Deduplicator deduplicator;
    private final BatchPlanner batchPlanner;
    private final BatchLimits batchLimits;
    private final EmbeddingExecutor embeddingExecutor;
    private final EmbeddingBackend embeddingBackend;
    private final UnitStore unitStore;

    /**
     * Index {@code root}, dropping everything already stored first when {@code clear} is set.
     * Never throws for pipeline errors; a failed run comes back as a FAILED report.
     */
    public IndexingReport index(Path root, boolean clear) {
        Run run = new Run();
        try {
            execute(root, clear, run);
            run.enter(IndexingStage.DONE);
        } catch (RuntimeException e) {
            log.error("Indexing failed during {}: {}", run.stage, e.getMessage(), e);
            run.fail(e);
        }

        IndexingReport report = run.toReport();
        log.info("Indexing finished in {} ms with stage {}: {} files indexed, {} deleted, {} units added, {} skipped",
            report.getDuration().toMillis(), report.getStage(), report.getFilesIndexed(),
            report.getFilesDeleted(), report.getUnitsAdded(), report.getUnitsSkipped());
        return report;
    }

    private void execute(Path root, boolean clear, Run run) {
        run.enter(IndexingStage.SCANNING);
        List<SourceFile> snapshot = sourceScanner.scan(root);
        run.filesScanned = snapshot.size();
        if (snapshot.isEmpty()) {
            log.warn("No indexable files found under {}", root);
        }

        run.enter(IndexingStage.RECONCILING);
        if (clear) {
            log.info("Clearing existing index before indexing");
            unitStore.clear();
        }
        SyncPlan plan = fileSynchronizer.reconcile(snapshot, unitStore.getFileRecords());
        run.filesUnchanged = plan.getUnchangedCount();

        if (plan.isNoOp()) {
            long stored = unitStore.countUnits();
            run.unitsSkipped = (int) stored;
            run.totalUnitsInStore = stored;
            log.info("Index is up to date, {} units already stored", stored);
            return;
        }

        run.enter(IndexingStage.PREPARING);
        Map<String, SourceFile> byPath = snapshot.stream()
            .collect(Collectors.toMap(SourceFile::getPath, Function.identity()));
        Map<String, SourceFile> processed = new LinkedHashMap<>();
        List<FingerprintedUnit> unique = prepare(plan, byPath, processed, run);

        run.enter(IndexingStage.EMBEDDING);
        List<Batch> batches = batchPlanner.plan(unique, batchLimits);
        log.info("Embedding {} units in {} batches", unique.size(), batches.size());
        List<IndexedUnit> indexed = embeddingExecutor.execute(batches, embeddingBackend);

        run.enter(IndexingStage.WRITING);
        unitStore.writeUnits(indexed);
        run.unitsAdded = indexed.size();
        for (SourceFile file : processed.values()) {
            unitStore.upsertFileRecord(file.getPath(), file.getModifiedTime());
            run.filesIndexed++;
        }
        run.totalUnitsInStore = unitStore.countUnits();
    }

    private List<FingerprintedUnit> prepare(SyncPlan plan, Map<String, SourceFile> byPath,
                                            Map<String, SourceFile> processed, Run run) {
        for (String path : plan.getToDelete()) {
            removeQuietly(path);
            run.filesDeleted++;
        }

        // Old units of modified files go before fingerprints are loaded, otherwise
        // their unchanged content would be skipped as already known and then lost
        Map<String, Long> recorded = unitStore.getFileRecords();
        for (String path : plan.getToIndex()) {
            if (recorded.containsKey(path)) {
                log.debug("Removing previous units of modified file {}", path);
                removeQuietly(path);
            }
        }

        KnownFingerprints known = KnownFingerprints.seededWith(unitStore.getKnownFingerprints());
        log.debug("Loaded {} known fingerprints", known.size());

        List<FingerprintedUnit> unique = new ArrayList<>();
        for (String path : plan.getToIndex()) {
            Optional<String> content = documentReader.read(path);
            if (content.isEmpty()) {
                run.filesFailed++;
                continue;
            }

            List<TextUnit> units = chunker.chunk(content.get(), path, chunkingOptions);
            DedupResult result = deduplicator.filter(units, known);
            unique.addAll(result.unique());
            run.unitsSkipped += result.skippedCount();
            processed.put(path, byPath.get(path));

            log.debug("Prepared {}: {} units, {} new", path, units.size(), result.unique().size());
        }

        log.info("Prepared {} files: {} new units, {} duplicates skipped",
            processed.size(), unique.size(), run.unitsSkipped);
        return unique;
    }

    private void removeQuietly(String path) {
        try {
            unitStore.deleteUnitsForPath(path);
        } catch (StoreException e) {
            log.warn("Could not delete units for {}: {}", path, e.getMessage());
        }
        try {
            unitStore.deleteFileRecord(path);
        } catch (StoreException e) {
            log.warn("Could not delete file record for {}: {}", path, e.getMessage());
        }
    }

    /**
     * Mutable progress of a single run.
     */
    private static final class Run {
        private final Instant started = Instant.now();
        private IndexingStage stage;
        private IndexingStage failedStage;
        private String failureMessage;

        private int filesScanned;
        private int filesIndexed;
        private int filesDeleted;
        private int filesUnchanged;
        private int filesFailed;
        private int unitsAdded;
        private int unitsSkipped;
        private long totalUnitsInStore;

        private void enter(IndexingStage next) {
            log.info("Stage {}", next);
            stage = next;
        }

        private void fail(RuntimeException e) {
            failedStage = stage;
            failureMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            stage = IndexingStage.FAILED;
        }

        private IndexingReport toReport() {
            return IndexingReport.builder()
                .stage(stage)
                .failedStage(failedStage)
                .failureMessage(failureMessage)
                .filesScanned(filesScanned)
                .filesIndexed(filesIndexed)
                .filesDeleted(filesDeleted)
                .filesUnchanged(filesUnchanged)
                .filesFailed(filesFailed)
                .unitsAdded(unitsAdded)
                .unitsSkipped(unitsSkipped)
                .totalUnitsInStore(totalUnitsInStore)
                .duration(Duration.between(started, Instant.now()))
                .build();
        }
    }
}
