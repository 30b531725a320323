package com.edge.align.core;

/**
 * 对齐致命错误：输入无法读取，或最终画布写出失败
 * <p>
 * 单个策略的失败不会产生此异常
 */
public class AlignmentException extends Exception {

    public AlignmentException(String message) {
        super(message);
    }

    public AlignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
