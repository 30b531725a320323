package com.edge.align.core.strategy;

import com.edge.align.core.engine.FakeImage;
import com.edge.align.core.engine.FakeImageEngine;
import com.edge.align.core.engine.ImageEngineException;
import com.edge.align.core.engine.TemplateMatch;
import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CroppedRegionStrategyTest {

    private final CroppedRegionStrategy strategy = new CroppedRegionStrategy();

    @Test
    void offsetIsDifferenceOfCropOrigins() {
        FakeImageEngine engine = new FakeImageEngine()
            .withMatcher((haystack, needle) -> new TemplateMatch(42, 0, 0));
        FakeImage ref = FakeImageEngine.image("ref", 1000, 800);
        FakeImage target = FakeImageEngine.image("target", 900, 700);

        Optional<StrategyResult> result = strategy.align(StrategyTestSupport.context(engine, ref, target));

        // 只有 800x600 同时放得下；参考图裁剪原点 (100,100)，目标图 (50,50)
        assertTrue(result.isPresent());
        assertEquals(new Offset(-50, -50), result.get().getOffset());
        assertEquals(42, result.get().getScore());
        assertEquals(StrategyId.CROPPED_REGION, result.get().getMethod());
        assertEquals(1, engine.getTemplateCalls().size());
        assertEquals("crop(ref@100,100)|crop(target@50,50)", engine.getTemplateCalls().get(0));
    }

    @Test
    void picksLowestScoringCropSize() {
        FakeImageEngine engine = new FakeImageEngine().withMatcher((haystack, needle) -> {
            switch (needle.width()) {
                case 800: return new TemplateMatch(500, 0, 0);
                case 1000: return new TemplateMatch(100, 0, 0);
                default: return new TemplateMatch(300, 0, 0);
            }
        });
        FakeImage ref = FakeImageEngine.image("ref", 1300, 1000);
        FakeImage target = FakeImageEngine.image("target", 1250, 950);

        Optional<StrategyResult> result = strategy.align(StrategyTestSupport.context(engine, ref, target));

        assertTrue(result.isPresent());
        assertEquals(100, result.get().getScore());
        assertEquals(new Offset(-25, -25), result.get().getOffset());
        assertEquals(3, engine.getTemplateCalls().size());
    }

    @Test
    void failedCropSizeDoesNotStopTheLoop() {
        FakeImageEngine engine = new FakeImageEngine().withMatcher((haystack, needle) -> {
            if (needle.width() == 800) {
                throw new ImageEngineException("boom");
            }
            return new TemplateMatch(needle.width(), 0, 0);
        });
        FakeImage ref = FakeImageEngine.image("ref", 1300, 1000);
        FakeImage target = FakeImageEngine.image("target", 1300, 1000);

        Optional<StrategyResult> result = strategy.align(StrategyTestSupport.context(engine, ref, target));

        assertTrue(result.isPresent());
        assertEquals(1000, result.get().getScore());
        assertEquals(Offset.ZERO, result.get().getOffset());
        assertEquals(6, engine.getCreated().size());
        assertTrue(engine.liveImages().isEmpty());
    }

    @Test
    void skipsCropsLargerThanEitherImage() {
        FakeImageEngine engine = new FakeImageEngine();
        FakeImage ref = FakeImageEngine.image("ref", 1920, 1080);
        FakeImage target = FakeImageEngine.image("target", 640, 480);

        assertFalse(strategy.align(StrategyTestSupport.context(engine, ref, target)).isPresent());
        assertTrue(engine.getTemplateCalls().isEmpty());
        assertTrue(engine.getCreated().isEmpty());
    }
}
