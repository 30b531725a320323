package com.edge.align.repository;

import com.edge.align.model.AlignmentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlignmentRecordRepositoryTest {

    @TempDir
    Path dir;

    private AlignmentRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AlignmentRecordRepository(true, dir.resolve("records").toString());
        repository.init();
    }

    private static AlignmentRecord record(String batchId, LocalDateTime timestamp, String method) {
        AlignmentRecord record = new AlignmentRecord();
        record.setBatchId(batchId);
        record.setTimestamp(timestamp);
        record.setReferencePath("ref.png");
        record.setTargetPath("target.png");
        record.setStatus(AlignmentRecord.STATUS_SUCCESS);
        record.setMethod(method);
        record.setScore(12.5);
        record.setOffsetX(20);
        record.setOffsetY(-10);
        return record;
    }

    @Test
    void insertAssignsIdAndTimestamp() {
        AlignmentRecord record = new AlignmentRecord();
        repository.insert(record);

        assertNotNull(record.getId());
        assertNotNull(record.getTimestamp());
        assertTrue(Files.exists(dir.resolve("records").resolve(LocalDate.now() + ".jsonl")));
    }

    @Test
    void findsByDate() {
        LocalDateTime day1 = LocalDateTime.of(2024, 1, 15, 10, 30);
        LocalDateTime day2 = LocalDateTime.of(2024, 1, 16, 9, 0);
        repository.insert(record(null, day1, "target-in-ref"));
        repository.insert(record(null, day1, "edge-based"));
        repository.insert(record(null, day2, "multi-scale"));

        List<AlignmentRecord> first = repository.findByDate(LocalDate.of(2024, 1, 15));
        assertEquals(2, first.size());
        assertEquals("target-in-ref", first.get(0).getMethod());
        assertEquals(day1, first.get(0).getTimestamp());
        assertEquals(Integer.valueOf(-10), first.get(0).getOffsetY());

        assertEquals(1, repository.findByDate(LocalDate.of(2024, 1, 16)).size());
        assertTrue(repository.findByDate(LocalDate.of(2024, 1, 17)).isEmpty());
    }

    @Test
    void findsByIdAcrossDays() {
        AlignmentRecord old = record(null, LocalDateTime.of(2024, 1, 15, 10, 30), "cropped-region");
        repository.insert(old);
        repository.insert(record(null, LocalDateTime.of(2024, 2, 1, 8, 0), "target-in-ref"));

        Optional<AlignmentRecord> found = repository.findById(old.getId());
        assertTrue(found.isPresent());
        assertEquals("cropped-region", found.get().getMethod());
        assertFalse(repository.findById("unknown").isPresent());
    }

    @Test
    void findsByBatch() {
        LocalDateTime now = LocalDateTime.of(2024, 3, 1, 12, 0);
        repository.insert(record("batch-0a1b2c3d", now, "target-in-ref"));
        repository.insert(record("batch-4e5f6a7b", now, "edge-based"));
        repository.insert(record("batch-0a1b2c3d", now.plusDays(1), "multi-scale"));

        List<AlignmentRecord> batch = repository.findByBatchId("batch-0a1b2c3d");
        assertEquals(2, batch.size());
        assertTrue(batch.stream().allMatch(r -> "batch-0a1b2c3d".equals(r.getBatchId())));
        assertTrue(repository.findByBatchId("batch-00000000").isEmpty());
    }

    @Test
    void skipsMalformedLines() throws IOException {
        LocalDateTime when = LocalDateTime.of(2024, 4, 2, 12, 0);
        repository.insert(record(null, when, "target-in-ref"));
        Files.writeString(dir.resolve("records").resolve("2024-04-02.jsonl"), "{not json\n",
            StandardOpenOption.APPEND);

        assertEquals(1, repository.findByDate(LocalDate.of(2024, 4, 2)).size());
    }

    @Test
    void disabledStoreWritesNothing() {
        Path recordsDir = dir.resolve("disabled");
        AlignmentRecordRepository disabled = new AlignmentRecordRepository(false, recordsDir.toString());
        disabled.init();

        AlignmentRecord record = record(null, LocalDateTime.now(), "target-in-ref");
        disabled.insert(record);

        assertNotNull(record.getId());
        assertFalse(Files.exists(recordsDir));
        assertTrue(disabled.findByDate(LocalDate.now()).isEmpty());
        assertFalse(disabled.findById(record.getId()).isPresent());
    }

    @Test
    void skipsMalformedIndexLines() throws IOException {
        LocalDateTime when = LocalDateTime.of(2024, 5, 6, 9, 0);
        AlignmentRecord kept = record("batch-0a1b2c3d", when, "edge-based");
        repository.insert(kept);
        Path records = dir.resolve("records");
        Files.writeString(records.resolve("batch_index").resolve("batch-0a1b2c3d.txt"), "x,2024-13-45\n",
            StandardOpenOption.APPEND);
        Files.writeString(records.resolve("id_index.txt"), "y,not-a-date\n", StandardOpenOption.APPEND);

        List<AlignmentRecord> batch = repository.findByBatchId("batch-0a1b2c3d");
        assertEquals(1, batch.size());
        assertEquals(kept.getId(), batch.get(0).getId());
        assertTrue(repository.findById(kept.getId()).isPresent());
        assertFalse(repository.findById("y").isPresent());
    }

    @Test
    void rejectsBatchIdsOutsideGeneratedForm() throws IOException {
        Path outside = dir.resolve("leak.txt");
        Files.writeString(outside, "z," + LocalDate.now() + "\n");

        assertTrue(repository.findByBatchId("../../leak").isEmpty());
        assertTrue(repository.findByBatchId("batch-1").isEmpty());

        AlignmentRecord record = record("../escape", LocalDateTime.now(), "target-in-ref");
        repository.insert(record);
        assertFalse(Files.exists(dir.resolve("records").resolve("escape.txt")));
        assertFalse(Files.exists(dir.resolve("escape.txt")));
        assertTrue(repository.findById(record.getId()).isPresent());
    }
}
