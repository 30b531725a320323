package com.edge.align.service;

import com.edge.align.config.YamlConfig;
import com.edge.align.core.AlignmentException;
import com.edge.align.core.ImageAligner;
import com.edge.align.core.model.AlignmentOptions;
import com.edge.align.core.model.AlignmentResult;
import com.edge.align.dto.AlignRequest;
import com.edge.align.dto.AlignResponse;
import com.edge.align.dto.BatchAlignRequest;
import com.edge.align.dto.BatchAlignResponse;
import com.edge.align.dto.BatchAlignResponse.PairResult;
import com.edge.align.model.AlignmentRecord;
import com.edge.align.repository.AlignmentRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 对齐服务
 * <p>
 * 单对对齐直接在调用线程执行；批量对齐在有界线程池上并行，
 * 单对失败（AlignmentException、参数错误、超时）只标记该对失败，不中断批次。
 * 超时的对不会被中断，后台跑完后结果直接丢弃
 */
@Service
public class AlignmentService {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentService.class);

    static final int MIN_CONCURRENCY = 1;
    static final int MAX_CONCURRENCY = 32;

    @Autowired
    private ImageAligner imageAligner;

    @Autowired
    private AlignmentRecordRepository recordRepository;

    @Autowired
    private YamlConfig yamlConfig;

    private ExecutorService batchExecutor;
    // 与线程数相同的许可：拿到许可的任务立即有线程执行，超时只计算运行时间
    private Semaphore slots;
    private int concurrency;
    private long pairTimeoutSeconds;
    private Path outputDir;

    @PostConstruct
    public void init() {
        YamlConfig.BatchConfig batch = yamlConfig.getBatch() != null
            ? yamlConfig.getBatch() : new YamlConfig.BatchConfig();
        YamlConfig.SystemConfig system = yamlConfig.getSystem() != null
            ? yamlConfig.getSystem() : new YamlConfig.SystemConfig();

        concurrency = batch.getConcurrency();
        if (concurrency < MIN_CONCURRENCY || concurrency > MAX_CONCURRENCY) {
            int clamped = Math.max(MIN_CONCURRENCY, Math.min(MAX_CONCURRENCY, concurrency));
            logger.warn("batch.concurrency {} out of range [{}, {}], using {}",
                concurrency, MIN_CONCURRENCY, MAX_CONCURRENCY, clamped);
            concurrency = clamped;
        }
        pairTimeoutSeconds = Math.max(0, batch.getPairTimeoutSeconds());
        outputDir = Paths.get(system.getOutputDir());

        AtomicInteger threadIndex = new AtomicInteger();
        batchExecutor = Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "Align-Worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        slots = new Semaphore(concurrency);

        logger.info("AlignmentService initialized - concurrency: {}, pair timeout: {}s, output dir: {}",
            concurrency, pairTimeoutSeconds == 0 ? "none" : pairTimeoutSeconds, outputDir);
    }

    @PreDestroy
    public void shutdown() {
        if (batchExecutor != null) {
            batchExecutor.shutdown();
            try {
                if (!batchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    batchExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                batchExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            batchExecutor = null;
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * 对齐一对图像
     *
     * @throws IllegalArgumentException 选项非法或输入文件不存在
     * @throws AlignmentException       对齐过程中的致命错误
     */
    public AlignResponse align(AlignRequest request) throws AlignmentException {
        return alignInternal(request, null, null);
    }

    /**
     * 批量对齐
     *
     * @throws IllegalArgumentException 请求中没有任何图像对
     */
    public BatchAlignResponse alignBatch(BatchAlignRequest request) {
        if (request == null || request.getPairs() == null || request.getPairs().isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one pair");
        }

        String batchId = "batch-" + UUID.randomUUID().toString().substring(0, 8);
        List<AlignRequest> pairs = request.getPairs();
        long start = System.currentTimeMillis();
        logger.info("[{}] Batch alignment started: {} pairs, concurrency {}", batchId, pairs.size(), concurrency);

        List<CompletableFuture<PairResult>> futures = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            AlignRequest pair = request.withDefaults(pairs.get(i));
            int index = i;

            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.add(CompletableFuture.completedFuture(
                    PairResult.failed(index, pair, "Batch interrupted before this pair started")));
                continue;
            }

            AtomicBoolean recorded = new AtomicBoolean(false);
            CompletableFuture<PairResult> future;
            try {
                future = CompletableFuture.supplyAsync(() -> {
                    try {
                        return runPair(index, pair, batchId, recorded);
                    } finally {
                        slots.release();
                    }
                }, batchExecutor);
            } catch (RuntimeException e) {
                slots.release();
                futures.add(CompletableFuture.completedFuture(
                    PairResult.failed(index, pair, "Could not schedule pair: " + e.getMessage())));
                continue;
            }

            if (pairTimeoutSeconds > 0) {
                future = future
                    .orTimeout(pairTimeoutSeconds, TimeUnit.SECONDS)
                    .exceptionally(ex -> onPairTimeout(index, pair, batchId, recorded, ex));
            }
            futures.add(future);
        }

        BatchAlignResponse response = new BatchAlignResponse();
        response.setBatchId(batchId);
        response.setTotal(pairs.size());
        for (CompletableFuture<PairResult> future : futures) {
            PairResult result = future.join();
            response.getResults().add(result);
            if (result.isSuccess()) {
                response.setSucceeded(response.getSucceeded() + 1);
            } else {
                response.setFailed(response.getFailed() + 1);
            }
        }
        response.setDurationMs(System.currentTimeMillis() - start);

        logger.info("[{}] Batch alignment finished in {}ms: {} succeeded, {} failed", batchId,
            response.getDurationMs(), response.getSucceeded(), response.getFailed());
        return response;
    }

    private PairResult runPair(int index, AlignRequest pair, String batchId, AtomicBoolean recorded) {
        try {
            return PairResult.success(index, pair, alignInternal(pair, batchId, recorded));
        } catch (AlignmentException | IllegalArgumentException e) {
            logger.warn("[{}] Pair {} failed: {}", batchId, index, e.getMessage());
            return PairResult.failed(index, pair, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("[{}] Pair {} failed unexpectedly", batchId, index, e);
            return PairResult.failed(index, pair, "Unexpected error: " + e.getMessage());
        }
    }

    private PairResult onPairTimeout(int index, AlignRequest pair, String batchId,
                                     AtomicBoolean recorded, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (!(cause instanceof TimeoutException)) {
            return PairResult.failed(index, pair, "Unexpected error: " + cause.getMessage());
        }
        String message = "Timed out after " + pairTimeoutSeconds + "s";
        // 与 save() 竞争同一个标志，只有先到的一方写记录
        if (!recorded.compareAndSet(false, true)) {
            logger.warn("[{}] Pair {} {}, but its record was already written", batchId, index, message);
            return PairResult.failed(index, pair, message);
        }
        logger.warn("[{}] Pair {} {}, result will be recorded", batchId, index, message);

        AlignmentRecord record = newRecord(pair, batchId);
        record.setStatus(AlignmentRecord.STATUS_FAILED);
        record.setErrorMessage(message);
        record.setDurationMs(TimeUnit.SECONDS.toMillis(pairTimeoutSeconds));
        recordRepository.insert(record);
        return PairResult.failed(index, pair, message);
    }

    private AlignResponse alignInternal(AlignRequest request, String batchId, AtomicBoolean recorded)
            throws AlignmentException {
        AlignmentOptions options = request.toOptions();
        Path reference = requireFile(request.getReferencePath(), "Reference");
        Path target = requireFile(request.getTargetPath(), "Target");
        Path output = StringUtils.hasText(request.getOutputPath())
            ? Paths.get(request.getOutputPath())
            : defaultOutputPath(target);

        AlignmentRecord record = newRecord(request, batchId);
        record.setOutputPath(output.toString());
        long start = System.currentTimeMillis();
        try {
            AlignmentResult result = imageAligner.alignImages(reference, target, output, options);
            long duration = System.currentTimeMillis() - start;

            record.setStatus(AlignmentRecord.STATUS_SUCCESS);
            record.setMethod(result.getMethod().getKey());
            record.setScore(Double.isInfinite(result.getScore()) ? null : result.getScore());
            record.setOffsetX(result.getOffset().getX());
            record.setOffsetY(result.getOffset().getY());
            record.setRegionX(result.getMatchingRegion().getX());
            record.setRegionY(result.getMatchingRegion().getY());
            record.setRegionWidth(result.getMatchingRegion().getWidth());
            record.setRegionHeight(result.getMatchingRegion().getHeight());
            record.setDurationMs(duration);
            save(record, recorded);
            return AlignResponse.from(result, duration);
        } catch (AlignmentException e) {
            record.setStatus(AlignmentRecord.STATUS_FAILED);
            record.setErrorMessage(e.getMessage());
            record.setDurationMs(System.currentTimeMillis() - start);
            save(record, recorded);
            throw e;
        }
    }

    private void save(AlignmentRecord record, AtomicBoolean recorded) {
        if (recorded != null && !recorded.compareAndSet(false, true)) {
            logger.info("Pair {} -> {} finished after timeout, discarding result",
                record.getReferencePath(), record.getTargetPath());
            return;
        }
        recordRepository.insert(record);
    }

    private AlignmentRecord newRecord(AlignRequest request, String batchId) {
        AlignmentRecord record = new AlignmentRecord();
        record.setBatchId(batchId);
        record.setReferencePath(request.getReferencePath());
        record.setTargetPath(request.getTargetPath());
        record.setRequestedMethod(request.getMethod());
        return record;
    }

    private static Path requireFile(String path, String role) {
        if (!StringUtils.hasText(path)) {
            throw new IllegalArgumentException(role + " path is required");
        }
        Path p = Paths.get(path);
        if (!Files.isRegularFile(p)) {
            throw new IllegalArgumentException(role + " image not found: " + path);
        }
        return p;
    }

    /**
     * 默认输出路径: {output-dir}/yyyy-MM-dd/{目标文件名}_aligned_{随机后缀}.png
     */
    Path defaultOutputPath(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return outputDir.resolve(LocalDate.now().toString()).resolve(base + "_aligned_" + suffix + ".png");
    }
}
