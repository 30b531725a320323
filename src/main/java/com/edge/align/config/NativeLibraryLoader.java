package com.edge.align.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库，启动时与测试中都通过这里加载
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV native 库
     * 必须在任何使用 Mat 的代码之前调用，重复调用无副作用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        try {
            // JDK 12+ 上 loadShared 不可用，openpnp 推荐 loadLocally：解压到临时目录后 System.load
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV {} loaded via openpnp", org.opencv.core.Core.VERSION);
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV native library", e);
            throw new IllegalStateException("OpenCV native library not available: " + e.getMessage(), e);
        }
        loaded = true;
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
