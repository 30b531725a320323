package com.edge.align.core.strategy;

import com.edge.align.core.AlignmentSettings;
import com.edge.align.core.engine.FakeImage;
import com.edge.align.core.engine.FakeImageEngine;
import com.edge.align.core.model.AlignmentOptions;

final class StrategyTestSupport {

    private StrategyTestSupport() {
    }

    static AlignmentContext context(FakeImageEngine engine, FakeImage reference, FakeImage target) {
        return context(engine, reference, target, AlignmentOptions.defaults(), new AlignmentSettings());
    }

    static AlignmentContext context(FakeImageEngine engine, FakeImage reference, FakeImage target,
                                    AlignmentOptions options, AlignmentSettings settings) {
        return new AlignmentContext("test", engine, reference, target, options, settings);
    }
}
