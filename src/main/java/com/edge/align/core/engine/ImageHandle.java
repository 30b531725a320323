package com.edge.align.core.engine;

import com.edge.align.core.model.ImageSize;

/**
 * 图像引擎持有的已解码图像的不透明引用
 * <p>
 * 对齐流程只负责关闭自己派生出来的图像（边缘图、缩放图、裁剪图等），
 * close 必须可以重复调用
 */
public interface ImageHandle extends AutoCloseable {

    int width();

    int height();

    int channels();

    default ImageSize size() {
        return new ImageSize(width(), height());
    }

    @Override
    void close();
}
