package com.edge.align.core.strategy;

import com.edge.align.core.AlignmentSettings;
import com.edge.align.core.engine.ArtifactScope;
import com.edge.align.core.engine.ImageEngine;
import com.edge.align.core.engine.ImageHandle;
import com.edge.align.core.model.AlignmentOptions;
import com.edge.align.core.model.ImageSize;

/**
 * 单次对齐调用的上下文，随调用创建、调用结束丢弃
 */
public class AlignmentContext {
    private final String callId;
    private final ImageEngine engine;
    private final ImageHandle reference;
    private final ImageHandle target;
    private final AlignmentOptions options;
    private final AlignmentSettings settings;

    public AlignmentContext(String callId, ImageEngine engine, ImageHandle reference, ImageHandle target,
                            AlignmentOptions options, AlignmentSettings settings) {
        this.callId = callId;
        this.engine = engine;
        this.reference = reference;
        this.target = target;
        this.options = options != null ? options : AlignmentOptions.defaults();
        this.settings = settings != null ? settings : new AlignmentSettings();
    }

    public String getCallId() { return callId; }
    public ImageEngine getEngine() { return engine; }
    public ImageHandle getReference() { return reference; }
    public ImageHandle getTarget() { return target; }
    public AlignmentOptions getOptions() { return options; }
    public AlignmentSettings getSettings() { return settings; }

    public ImageSize getReferenceSize() {
        return reference.size();
    }

    public ImageSize getTargetSize() {
        return target.size();
    }

    /**
     * 为一个策略开一个中间产物作用域，调用方必须用 try-with-resources 关闭
     */
    public ArtifactScope openScope(String name) {
        if (settings.isDumpIntermediates() && settings.getWorkDir() != null) {
            return new ArtifactScope(callId + "-" + name, engine, settings.getWorkDir(),
                settings.isKeepIntermediates());
        }
        return ArtifactScope.inMemory(callId + "-" + name);
    }
}
