package com.edge.align.model;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class AlignmentRecord {
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILED = "FAILED";

    private String id;
    // 批量对齐时同一批次共享
    private String batchId;
    private LocalDateTime timestamp;

    private String referencePath;
    private String targetPath;
    private String outputPath;
    private String requestedMethod;

    private String status; // SUCCESS/FAILED
    // 胜出策略 key，如 target-in-ref
    private String method;
    private Double score;
    private Integer offsetX;
    private Integer offsetY;

    // 重叠区域
    private Integer regionX;
    private Integer regionY;
    private Integer regionWidth;
    private Integer regionHeight;

    private String errorMessage;
    private long durationMs;
}
