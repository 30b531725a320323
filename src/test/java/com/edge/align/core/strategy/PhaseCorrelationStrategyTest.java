package com.edge.align.core.strategy;

import com.edge.align.core.engine.FakeImage;
import com.edge.align.core.engine.FakeImageEngine;
import com.edge.align.core.model.Offset;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhaseCorrelationStrategyTest {

    @Test
    void scoreIsOneMinusCorrelationAndOffsetIsAlwaysZero() {
        FakeImageEngine engine = new FakeImageEngine().withNcc(0.8);
        FakeImage ref = FakeImageEngine.image("ref", 640, 480);
        FakeImage target = FakeImageEngine.image("target", 800, 400);

        Optional<StrategyResult> result = new PhaseCorrelationStrategy()
            .align(StrategyTestSupport.context(engine, ref, target));

        assertTrue(result.isPresent());
        assertEquals(0.2, result.get().getScore(), 1e-9);
        assertEquals(Offset.ZERO, result.get().getOffset());

        // 两张图都填充到 800x480
        for (FakeImage padded : engine.getCreated()) {
            assertEquals(800, padded.width());
            assertEquals(480, padded.height());
            assertTrue(padded.isClosed());
        }
        assertEquals(2, engine.getCreated().size());
    }
}
