package com.dcruver.ragindex.store;

import com.dcruver.ragindex.domain.FileUnitCount;
import com.dcruver.ragindex.domain.IndexedUnit;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stores indexed units and the file index in SQLite.
 * Vectors are kept as JSON arrays.
 */
@Component
@Slf4j
public class SqliteUnitStore implements UnitStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final String embedModel;

    public SqliteUnitStore(
        DataSource dataSource,
        ObjectMapper objectMapper,
        @Value("${spring.ai.ollama.embedding.options.model}") String embedModel
    ) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = objectMapper;
        this.embedModel = embedModel;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS units (
                id TEXT NOT NULL,
                fingerprint TEXT NOT NULL,
                source_path TEXT NOT NULL,
                start_line INTEGER NOT NULL,
                end_line INTEGER NOT NULL,
                start_offset INTEGER NOT NULL,
                end_offset INTEGER NOT NULL,
                text TEXT NOT NULL,
                model TEXT NOT NULL,
                vector_json TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_units_source_path
            ON units(source_path)
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_units_fingerprint
            ON units(fingerprint)
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS file_index (
                path TEXT PRIMARY KEY,
                modified_time INTEGER NOT NULL,
                indexed_at INTEGER NOT NULL
            )
            """);

        log.info("Initialized unit store");
    }

    @Override
    public Set<String> getKnownFingerprints() {
        try {
            return new HashSet<>(jdbcTemplate.queryForList("SELECT DISTINCT fingerprint FROM units", String.class));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to load known fingerprints", e);
        }
    }

    @Override
    public Map<String, Long> getFileRecords() {
        try {
            Map<String, Long> records = new HashMap<>();
            jdbcTemplate.query("SELECT path, modified_time FROM file_index",
                rs -> {
                    records.put(rs.getString("path"), rs.getLong("modified_time"));
                });
            return records;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to load file records", e);
        }
    }

    @Override
    public void deleteUnitsForPath(String path) {
        try {
            int deleted = jdbcTemplate.update("DELETE FROM units WHERE source_path = ?", path);
            log.debug("Deleted {} units for {}", deleted, path);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete units for " + path, e);
        }
    }

    @Override
    public void upsertFileRecord(String path, long modifiedTime) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM file_index WHERE path = ?", path);
                jdbcTemplate.update(
                    "INSERT INTO file_index (path, modified_time, indexed_at) VALUES (?, ?, ?)",
                    path, modifiedTime, Instant.now().toEpochMilli());
            });
        } catch (DataAccessException e) {
            throw new StoreException("Failed to record file " + path, e);
        }
    }

    @Override
    public void deleteFileRecord(String path) {
        try {
            jdbcTemplate.update("DELETE FROM file_index WHERE path = ?", path);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete file record for " + path, e);
        }
    }

    @Override
    public void writeUnits(List<IndexedUnit> units) {
        if (units.isEmpty()) {
            return;
        }

        List<Object[]> rows = new ArrayList<>(units.size());
        long timestamp = Instant.now().getEpochSecond();
        for (IndexedUnit unit : units) {
            rows.add(new Object[] {
                unit.getId(),
                unit.getFingerprint(),
                unit.getSourcePath(),
                unit.getStartLine(),
                unit.getEndLine(),
                unit.getStartOffset(),
                unit.getEndOffset(),
                unit.getText(),
                embedModel,
                toJson(unit.getVector()),
                timestamp
            });
        }

        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(
                "INSERT INTO units (id, fingerprint, source_path, start_line, end_line, start_offset, " +
                "end_offset, text, model, vector_json, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                rows));
            log.debug("Wrote {} units", units.size());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to write " + units.size() + " units", e);
        }
    }

    @Override
    public long countUnits() {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM units", Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to count units", e);
        }
    }

    @Override
    public void clear() {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM units");
                jdbcTemplate.update("DELETE FROM file_index");
            });
            log.info("Cleared unit store");
        } catch (DataAccessException e) {
            throw new StoreException("Failed to clear unit store", e);
        }
    }

    @Override
    public List<FileUnitCount> fileStats() {
        try {
            return jdbcTemplate.query(
                "SELECT source_path, COUNT(*) AS unit_count FROM units GROUP BY source_path ORDER BY source_path",
                (rs, rowNum) -> new FileUnitCount(rs.getString("source_path"), rs.getInt("unit_count")));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read file statistics", e);
        }
    }

    /**
     * Read back the stored vector of every unit for a path, in insertion order
     */
    public List<float[]> vectorsForPath(String path) {
        try {
            return jdbcTemplate.query(
                "SELECT vector_json FROM units WHERE source_path = ? ORDER BY rowid",
                (rs, rowNum) -> fromJson(rs.getString("vector_json")),
                path);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read vectors for " + path, e);
        }
    }

    private String toJson(float[] vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize vector", e);
        }
    }

    private float[] fromJson(String json) {
        try {
            return objectMapper.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize vector", e);
        }
    }
}
