package com.edge.align.controller;

import com.edge.align.core.AlignmentException;
import com.edge.align.core.AlignmentSettings;
import com.edge.align.core.cascade.CascadeStep;
import com.edge.align.core.cascade.StrategyCascade;
import com.edge.align.core.model.StrategyId;
import com.edge.align.dto.AlignRequest;
import com.edge.align.dto.AlignResponse;
import com.edge.align.dto.BatchAlignRequest;
import com.edge.align.dto.BatchAlignResponse;
import com.edge.align.model.AlignmentRecord;
import com.edge.align.repository.AlignmentRecordRepository;
import com.edge.align.service.AlignmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 图像对齐控制器
 * <p>
 * 输入输出均为服务器本地路径；未指定输出路径时写入 output-dir，可通过 /api/aligned/** 访问
 */
@RestController
@RequestMapping("/api/align")
@Tag(name = "图像对齐", description = "UI 截图多策略对齐：单对对齐、批量对齐、策略说明与对齐记录查询")
public class AlignmentController {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentController.class);

    @Autowired
    private AlignmentService alignmentService;

    @Autowired
    private AlignmentRecordRepository recordRepository;

    @Autowired
    private StrategyCascade strategyCascade;

    @Autowired
    private AlignmentSettings alignmentSettings;

    /**
     * 对齐一对图像
     */
    @PostMapping
    @Operation(
            summary = "对齐一对图像",
            description = """
                    把目标图对齐到参考图，输出与参考图同尺寸的 PNG（目标图外区域透明）。

                    **请求字段**：
                    | 字段 | 类型 | 说明 |
                    |------|------|------|
                    | referencePath | string | 参考图路径（必填）|
                    | targetPath | string | 目标图路径（必填）|
                    | outputPath | string | 输出路径，为空时写入默认输出目录 |
                    | method | string | subimage（默认）/ feature / phase / opencv |
                    | threshold | number | 特征匹配保留比例 (0, 1]，默认 0.7 |
                    | opencvDetector | string | orb（默认）/ akaze / brisk |
                    | maxFeatures | number | 每张图最多特征点数，默认 1000 |

                    offset 为目标图需要的位移，x/y 为正表示向右/向下移动。
                    method 为 none 时表示所有策略均无结果，位移为 (0, 0)。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "对齐成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "alignedPath": "data/aligned/2024-01-15/home_aligned_1a2b3c4d.png",
                                                "offset": {"x": 20, "y": -10},
                                                "matchingRegion": {"x": 20, "y": 0, "width": 780, "height": 590},
                                                "method": "target-in-ref",
                                                "score": 0.0,
                                                "durationMs": 86
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> align(@RequestBody AlignRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            AlignResponse result = alignmentService.align(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid align request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (AlignmentException e) {
            logger.error("Alignment failed: {}", e.getMessage(), e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 批量对齐
     */
    @PostMapping("/batch")
    @Operation(
            summary = "批量对齐",
            description = """
                    在有界线程池上并行对齐多对图像（默认并发 4）。
                    单对失败只标记该对为 failed，不影响其他对。
                    批次级 method / threshold / opencvDetector 作为每一对的默认值。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "批次完成（可能包含失败的对）",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "batchId": "batch-1a2b3c4d",
                                                "total": 2,
                                                "succeeded": 1,
                                                "failed": 1,
                                                "results": [
                                                  {"index": 0, "status": "success", "result": {"offset": {"x": 0, "y": 120}}},
                                                  {"index": 1, "status": "failed", "error": "Target image not found: b.png"}
                                                ]
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> alignBatch(@RequestBody BatchAlignRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            BatchAlignResponse result = alignmentService.alignBatch(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
    }

    /**
     * 策略列表（级联顺序）
     */
    @GetMapping("/strategies")
    @Operation(summary = "获取对齐策略", description = "按级联顺序列出所有策略及其执行条件和阈值")
    public ResponseEntity<Map<String, Object>> getStrategies() {
        List<Map<String, Object>> strategies = new ArrayList<>();

        Map<String, Object> feature = new LinkedHashMap<>();
        feature.put("key", StrategyId.FEATURE_HOMOGRAPHY.getKey());
        feature.put("condition", "method is opencv; returns immediately when confidence > threshold");
        feature.put("threshold", alignmentSettings.getFeatureConfidence());
        strategies.add(feature);

        for (CascadeStep step : strategyCascade.getSteps()) {
            StrategyId id = step.getStrategy().id();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("key", id.getKey());
            item.put("condition", step.getCondition());
            Double threshold = thresholdOf(id);
            if (threshold != null) {
                item.put("threshold", threshold);
            }
            item.put("invertOffset", step.isInvertOffset());
            strategies.add(item);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", strategies);
        return ResponseEntity.ok(response);
    }

    /**
     * 查询对齐记录
     */
    @GetMapping("/records")
    @Operation(summary = "查询对齐记录", description = "按日期（yyyy-MM-dd，默认今天）或批次 ID 查询对齐记录")
    public ResponseEntity<Map<String, Object>> getRecords(
            @Parameter(description = "日期，格式 yyyy-MM-dd") @RequestParam(required = false) String date,
            @Parameter(description = "批次 ID") @RequestParam(required = false) String batchId) {
        Map<String, Object> response = new HashMap<>();
        List<AlignmentRecord> records;
        if (batchId != null && !batchId.isBlank()) {
            records = recordRepository.findByBatchId(batchId);
        } else {
            LocalDate day;
            try {
                day = date == null || date.isBlank() ? LocalDate.now() : LocalDate.parse(date);
            } catch (DateTimeParseException e) {
                response.put("status", "error");
                response.put("message", "Invalid date '" + date + "', expected yyyy-MM-dd");
                return ResponseEntity.badRequest().body(response);
            }
            records = recordRepository.findByDate(day);
        }
        response.put("status", "success");
        response.put("data", records);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/records/{id}")
    @Operation(summary = "获取单条对齐记录")
    public ResponseEntity<Map<String, Object>> getRecord(@PathVariable String id) {
        Map<String, Object> response = new HashMap<>();
        Optional<AlignmentRecord> record = recordRepository.findById(id);
        if (record.isEmpty()) {
            response.put("status", "error");
            response.put("message", "Record not found: " + id);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("status", "success");
        response.put("data", record.get());
        return ResponseEntity.ok(response);
    }

    private Double thresholdOf(StrategyId id) {
        switch (id) {
            case EDGE_BASED:
                return alignmentSettings.getEdgeThreshold();
            case CROPPED_REGION:
                return alignmentSettings.getCropThreshold();
            case MULTI_SCALE:
                return alignmentSettings.getMultiScaleThreshold();
            default:
                return null;
        }
    }
}
