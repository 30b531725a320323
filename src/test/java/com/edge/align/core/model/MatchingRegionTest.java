package com.edge.align.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchingRegionTest {

    private static final ImageSize CANVAS = new ImageSize(800, 600);

    @Test
    void targetInsideCanvas() {
        MatchingRegion region = MatchingRegion.of(CANVAS, new ImageSize(400, 300), new Offset(20, 10));
        assertEquals(new MatchingRegion(20, 10, 400, 300), region);
    }

    @Test
    void negativeOffsetIsClippedAtOrigin() {
        MatchingRegion region = MatchingRegion.of(CANVAS, new ImageSize(800, 600), new Offset(-30, -40));
        assertEquals(new MatchingRegion(0, 0, 770, 560), region);
    }

    @Test
    void overhangIsClippedAtCanvasEdge() {
        MatchingRegion region = MatchingRegion.of(CANVAS, new ImageSize(400, 400), new Offset(700, 500));
        assertEquals(new MatchingRegion(700, 500, 100, 100), region);
    }

    @Test
    void noOverlapGivesEmptyRegionInsideCanvas() {
        MatchingRegion region = MatchingRegion.of(CANVAS, new ImageSize(100, 100), new Offset(900, 50));
        assertTrue(region.isEmpty());
        assertEquals(800, region.getX());
        assertEquals(0, region.getWidth());

        MatchingRegion above = MatchingRegion.of(CANVAS, new ImageSize(100, 100), new Offset(10, -200));
        assertTrue(above.isEmpty());
        assertEquals(0, above.getHeight());
    }

    @Test
    void regionAlwaysLiesWithinCanvas() {
        ImageSize target = new ImageSize(350, 420);
        for (int dx = -500; dx <= 900; dx += 70) {
            for (int dy = -500; dy <= 700; dy += 60) {
                MatchingRegion r = MatchingRegion.of(CANVAS, target, new Offset(dx, dy));
                assertTrue(r.getX() >= 0 && r.getY() >= 0, r.toString());
                assertTrue(r.getWidth() >= 0 && r.getHeight() >= 0, r.toString());
                assertTrue(r.getX() + r.getWidth() <= CANVAS.getWidth(), r.toString());
                assertTrue(r.getY() + r.getHeight() <= CANVAS.getHeight(), r.toString());
                assertTrue(r.getWidth() <= target.getWidth() && r.getHeight() <= target.getHeight(), r.toString());
            }
        }
    }
}
