package com.edge.align.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HomographyMatrixTest {

    private static final double EPS = 1e-9;

    @Test
    void translationProjectsAndDecomposes() {
        HomographyMatrix h = HomographyMatrix.translation(12.4, -7.6);

        Point p = h.project(new Point(100, 50));
        assertEquals(112.4, p.x, EPS);
        assertEquals(42.4, p.y, EPS);

        HomographyTransform t = h.decompose();
        assertEquals(1.0, t.getScaleX(), EPS);
        assertEquals(1.0, t.getScaleY(), EPS);
        assertEquals(0.0, t.getRotationDegrees(), EPS);
        assertEquals(new Offset(12, -8), t.toOffset());
    }

    @Test
    void rotationAndScaleAreRecovered() {
        double angle = Math.toRadians(30);
        double s = 2.0;
        HomographyMatrix h = new HomographyMatrix(new double[][]{
            {s * Math.cos(angle), -s * Math.sin(angle), 5},
            {s * Math.sin(angle), s * Math.cos(angle), 6},
            {0, 0, 1}
        });

        HomographyTransform t = h.decompose();
        assertEquals(2.0, t.getScaleX(), 1e-6);
        assertEquals(2.0, t.getScaleY(), 1e-6);
        assertEquals(30.0, t.getRotationDegrees(), 1e-6);
        assertEquals(5.0, t.getTranslationX(), EPS);
    }

    @Test
    void perspectiveDivideAndPointAtInfinity() {
        HomographyMatrix h = new HomographyMatrix(new double[][]{
            {1, 0, 0},
            {0, 1, 0},
            {0.01, 0, 1}
        });
        Point p = h.project(new Point(100, 100));
        assertEquals(50.0, p.x, EPS);
        assertEquals(50.0, p.y, EPS);
        assertNull(h.project(new Point(-100, 0)));
    }

    @Test
    void copiesInput() {
        double[][] values = {{1, 0, 3}, {0, 1, 4}, {0, 0, 1}};
        HomographyMatrix h = new HomographyMatrix(values);
        values[0][2] = 99;
        assertEquals(3.0, h.get(0, 2), EPS);
        h.toArray()[0][2] = 99;
        assertEquals(3.0, h.get(0, 2), EPS);
    }

    @Test
    void rejectsNonSquare() {
        assertThrows(IllegalArgumentException.class, () -> new HomographyMatrix(new double[][]{{1, 0}, {0, 1}}));
        assertThrows(IllegalArgumentException.class,
            () -> new HomographyMatrix(new double[][]{{1, 0, 0}, {0, 1}, {0, 0, 1}}));
    }
}
