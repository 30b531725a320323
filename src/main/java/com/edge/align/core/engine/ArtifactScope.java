package com.edge.align.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 中间产物作用域
 * <p>
 * 策略派生出的边缘图、缩放图、裁剪图、填充灰度图都登记到这里，
 * close 时按登记的逆序统一释放（包括循环中提前 return 与异常路径）。
 * 开启中间产物落盘时，每个产物写到工作目录，文件名以作用域 id 为前缀，
 * 关闭时删除（除非配置保留）
 */
public class ArtifactScope implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactScope.class);

    private final String id;
    private final ImageEngine engine;
    private final Path dumpDir;
    private final boolean keepFiles;

    private final Deque<AutoCloseable> resources = new ArrayDeque<>();
    private final List<Path> files = new ArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private boolean closed = false;

    /**
     * @param name     作用域名（一般是策略 key）
     * @param engine   用于中间产物落盘
     * @param dumpDir  落盘目录，null 表示不落盘
     * @param keepFiles 关闭后保留落盘文件
     */
    public ArtifactScope(String name, ImageEngine engine, Path dumpDir, boolean keepFiles) {
        this.id = newId(name);
        this.engine = engine;
        this.dumpDir = dumpDir;
        this.keepFiles = keepFiles;
    }

    /**
     * 仅在内存中管理产物的作用域
     */
    public static ArtifactScope inMemory(String name) {
        return new ArtifactScope(name, null, null, false);
    }

    /**
     * 不冲突的作用域 id：时间戳 + 随机后缀
     */
    static String newId(String name) {
        String suffix = Long.toHexString(ThreadLocalRandom.current().nextLong() & 0xFFFFFFFFFFL);
        return name + "-" + System.currentTimeMillis() + "-" + suffix;
    }

    public String getId() {
        return id;
    }

    /**
     * 登记一个图像产物
     */
    public <T extends ImageHandle> T track(T handle, String label) {
        checkOpen();
        resources.push(handle);
        if (dumpDir != null && engine != null) {
            dump(handle, label);
        }
        return handle;
    }

    /**
     * 登记任意需要释放的资源（如特征集）
     */
    public <T extends AutoCloseable> T track(T resource) {
        checkOpen();
        resources.push(resource);
        return resource;
    }

    public int size() {
        return resources.size();
    }

    public List<Path> getFiles() {
        return new ArrayList<>(files);
    }

    private void dump(ImageHandle handle, String label) {
        Path file = dumpDir.resolve(id + "-" + sequence.incrementAndGet() + "-" + label + ".png");
        try {
            engine.write(handle, file);
            files.add(file);
        } catch (ImageEngineException e) {
            logger.warn("Failed to dump intermediate {}: {}", file, e.getMessage());
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Artifact scope " + id + " already closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        while (!resources.isEmpty()) {
            AutoCloseable resource = resources.pop();
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("[{}] Failed to release artifact: {}", id, e.getMessage());
            }
        }

        if (!keepFiles) {
            for (Path file : files) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    logger.warn("[{}] Failed to delete intermediate {}: {}", id, file, e.getMessage());
                }
            }
            files.clear();
        }
    }
}
