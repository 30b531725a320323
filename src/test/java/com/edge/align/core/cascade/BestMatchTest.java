package com.edge.align.core.cascade;

import com.edge.align.core.model.Offset;
import com.edge.align.core.model.StrategyId;
import com.edge.align.core.strategy.StrategyResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BestMatchTest {

    @Test
    void startsEmpty() {
        BestMatch best = new BestMatch();
        assertFalse(best.hasCandidate());
        assertEquals(StrategyId.NONE, best.getMethod());
        assertEquals(Offset.ZERO, best.getOffset());
        assertTrue(best.worseThan(1000));
    }

    @Test
    void replacedOnlyOnStrictImprovement() {
        BestMatch best = new BestMatch();
        assertTrue(best.offer(new StrategyResult(10, new Offset(1, 1), StrategyId.DIRECT_SUBIMAGE)));
        assertFalse(best.offer(new StrategyResult(10, new Offset(2, 2), StrategyId.EDGE_BASED)));
        assertFalse(best.offer(new StrategyResult(11, new Offset(3, 3), StrategyId.CROPPED_REGION)));
        assertTrue(best.offer(new StrategyResult(9.99, new Offset(4, 4), StrategyId.MULTI_SCALE)));

        assertEquals(StrategyId.MULTI_SCALE, best.getMethod());
        assertEquals(new Offset(4, 4), best.getOffset());
    }

    @Test
    void thresholdComparisonIsStrict() {
        BestMatch best = new BestMatch();
        best.offer(new StrategyResult(1000, Offset.ZERO, StrategyId.DIRECT_SUBIMAGE));
        assertFalse(best.worseThan(1000));
        assertTrue(best.worseThan(999.9));
    }
}
