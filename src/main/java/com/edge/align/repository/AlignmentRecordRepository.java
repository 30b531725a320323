package com.edge.align.repository;

import com.edge.align.model.AlignmentRecord;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 对齐记录存储
 * <p>
 * 按日期分文件追加 JSON 行：records/2024-01-15.jsonl，
 * 另有 ID 索引（id,日期）与批次索引（batch_index/{batchId}.txt）。
 * 写入失败只记录日志，不影响对齐结果
 */
@Repository
public class AlignmentRecordRepository {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentRecordRepository.class);

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    /** 批次 ID 同时是索引文件名，只接受服务生成的格式 */
    private static final Pattern BATCH_ID_PATTERN = Pattern.compile("batch-[0-9a-f]{8}");

    private final Gson gson = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class, (JsonSerializer<LocalDateTime>) (src, type, context) ->
                    new JsonPrimitive(src.format(ISO_FORMATTER)))
            .registerTypeAdapter(LocalDateTime.class, (JsonDeserializer<LocalDateTime>) (json, type, context) ->
                    LocalDateTime.parse(json.getAsString(), ISO_FORMATTER))
            .create();

    private final boolean saveRecords;
    private final Path recordsDir;
    private final Path idIndexFile;
    private final Path batchIndexDir;

    public AlignmentRecordRepository(@Value("${edge-align.system.save-records:true}") boolean saveRecords,
                                     @Value("${edge-align.system.records-dir:data/records}") String recordsDir) {
        this.saveRecords = saveRecords;
        this.recordsDir = Paths.get(recordsDir);
        this.idIndexFile = this.recordsDir.resolve("id_index.txt");
        this.batchIndexDir = this.recordsDir.resolve("batch_index");
    }

    @PostConstruct
    public void init() {
        if (!saveRecords) {
            logger.info("Alignment records disabled");
            return;
        }
        try {
            Files.createDirectories(recordsDir);
            Files.createDirectories(batchIndexDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize record store at " + recordsDir, e);
        }
    }

    public boolean isEnabled() {
        return saveRecords;
    }

    private Path getRecordsFileForDate(LocalDate date) {
        return recordsDir.resolve(date.toString() + ".jsonl");
    }

    /**
     * 追加一条记录（写入对应日期的文件）
     */
    public void insert(AlignmentRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        if (record.getTimestamp() == null) {
            record.setTimestamp(LocalDateTime.now());
        }
        if (!saveRecords) {
            return;
        }

        LocalDate date = record.getTimestamp().toLocalDate();
        String indexEntry = record.getId() + "," + date + "\n";
        try {
            synchronized (this) {
                try (BufferedWriter writer = Files.newBufferedWriter(getRecordsFileForDate(date),
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                    writer.write(gson.toJson(record));
                    writer.newLine();
                }
                Files.writeString(idIndexFile, indexEntry, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                if (isValidBatchId(record.getBatchId())) {
                    Files.writeString(batchIndexDir.resolve(record.getBatchId() + ".txt"), indexEntry,
                            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to save alignment record {}: {}", record.getId(), e.getMessage());
        }
    }

    /**
     * 根据日期查找（直接定位到对应日期文件）
     */
    public List<AlignmentRecord> findByDate(LocalDate date) {
        if (!saveRecords) {
            return Collections.emptyList();
        }
        return readRecords(getRecordsFileForDate(date), null);
    }

    /**
     * 根据 ID 查找（使用 id_index 定位日期文件）
     */
    public Optional<AlignmentRecord> findById(String id) {
        if (!saveRecords) {
            return Optional.empty();
        }
        Map<LocalDate, Set<String>> index = readIndex(idIndexFile, id);
        for (LocalDate date : index.keySet()) {
            List<AlignmentRecord> found = readRecords(getRecordsFileForDate(date), Collections.singleton(id));
            if (!found.isEmpty()) {
                return Optional.of(found.get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * 根据批次 ID 查找（使用批次索引）
     */
    public List<AlignmentRecord> findByBatchId(String batchId) {
        if (!saveRecords) {
            return Collections.emptyList();
        }
        if (!isValidBatchId(batchId)) {
            logger.debug("Rejecting batch id {}", batchId);
            return Collections.emptyList();
        }
        Map<LocalDate, Set<String>> idsByDate = readIndex(batchIndexDir.resolve(batchId + ".txt"), null);

        List<AlignmentRecord> results = new ArrayList<>();
        for (Map.Entry<LocalDate, Set<String>> entry : idsByDate.entrySet()) {
            results.addAll(readRecords(getRecordsFileForDate(entry.getKey()), entry.getValue()));
        }
        return results;
    }

    /**
     * 读取索引文件，按日期分组；onlyId 不为空时只保留该 ID
     */
    private Map<LocalDate, Set<String>> readIndex(Path indexFile, String onlyId) {
        Map<LocalDate, Set<String>> idsByDate = new HashMap<>();
        if (!Files.exists(indexFile)) {
            return idsByDate;
        }
        try (Stream<String> lines = Files.lines(indexFile)) {
            lines.filter(line -> !line.trim().isEmpty())
                    .map(line -> line.split(","))
                    .filter(parts -> parts.length == 2 && (onlyId == null || onlyId.equals(parts[0])))
                    .forEach(parts -> {
                        LocalDate date = parseIndexDate(parts[1]);
                        if (date != null) {
                            idsByDate.computeIfAbsent(date, k -> new HashSet<>()).add(parts[0]);
                        }
                    });
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to read index {}: {}", indexFile, e.getMessage());
        }
        return idsByDate;
    }

    private List<AlignmentRecord> readRecords(Path file, Set<String> ids) {
        if (!Files.exists(file)) {
            return Collections.emptyList();
        }
        try (Stream<String> lines = Files.lines(file)) {
            return lines
                    .filter(line -> !line.trim().isEmpty())
                    .map(this::parse)
                    .filter(Objects::nonNull)
                    .filter(record -> ids == null || ids.contains(record.getId()))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to read records {}: {}", file, e.getMessage());
            return Collections.emptyList();
        }
    }

    private LocalDate parseIndexDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            logger.debug("Skipping malformed index line: {}", e.getMessage());
            return null;
        }
    }

    static boolean isValidBatchId(String batchId) {
        return batchId != null && BATCH_ID_PATTERN.matcher(batchId).matches();
    }

    private AlignmentRecord parse(String line) {
        try {
            return gson.fromJson(line, AlignmentRecord.class);
        } catch (RuntimeException e) {
            logger.debug("Skipping malformed record line: {}", e.getMessage());
            return null;
        }
    }
}
