package com.edge.align.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量对齐响应：逐对结果 + 汇总
 */
public class BatchAlignResponse {
    private String batchId;
    private int total;
    private int succeeded;
    private int failed;
    private long durationMs;
    private List<PairResult> results = new ArrayList<>();

    public String getBatchId() { return batchId; }
    public void setBatchId(String batchId) { this.batchId = batchId; }

    public int getTotal() { return total; }
    public void setTotal(int total) { this.total = total; }

    public int getSucceeded() { return succeeded; }
    public void setSucceeded(int succeeded) { this.succeeded = succeeded; }

    public int getFailed() { return failed; }
    public void setFailed(int failed) { this.failed = failed; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public List<PairResult> getResults() { return results; }
    public void setResults(List<PairResult> results) { this.results = results; }

    /**
     * 单对结果
     */
    public static class PairResult {
        private int index;
        private String referencePath;
        private String targetPath;
        private String status;  // success / failed
        private AlignResponse result;
        private String error;

        public static PairResult success(int index, AlignRequest pair, AlignResponse result) {
            PairResult r = new PairResult();
            r.index = index;
            r.referencePath = pair.getReferencePath();
            r.targetPath = pair.getTargetPath();
            r.status = "success";
            r.result = result;
            return r;
        }

        public static PairResult failed(int index, AlignRequest pair, String error) {
            PairResult r = new PairResult();
            r.index = index;
            r.referencePath = pair.getReferencePath();
            r.targetPath = pair.getTargetPath();
            r.status = "failed";
            r.error = error;
            return r;
        }

        public boolean isSuccess() { return "success".equals(status); }

        public int getIndex() { return index; }
        public void setIndex(int index) { this.index = index; }

        public String getReferencePath() { return referencePath; }
        public void setReferencePath(String referencePath) { this.referencePath = referencePath; }

        public String getTargetPath() { return targetPath; }
        public void setTargetPath(String targetPath) { this.targetPath = targetPath; }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }

        public AlignResponse getResult() { return result; }
        public void setResult(AlignResponse result) { this.result = result; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }
}
