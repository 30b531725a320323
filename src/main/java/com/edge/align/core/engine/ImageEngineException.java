package com.edge.align.core.engine;

/**
 * 图像引擎调用失败（尺寸不兼容、解码失败、原生库异常等）
 */
public class ImageEngineException extends RuntimeException {

    public ImageEngineException(String message) {
        super(message);
    }

    public ImageEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
