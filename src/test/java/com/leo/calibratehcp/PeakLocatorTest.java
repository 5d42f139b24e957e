package com.leo.calibratehcp;

import ij.ImagePlus;
import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PeakLocatorTest {

    // 20x20, 0.5 per pixel, origin at pixel 10: the maximum at (10, 10) sits at (0, 0)
    private final ImagePlus field = TestImages.cone(20, 20, 10, 10, 0.5, 10, 10);

    @Test
    void testLocate_findsMaximumFromAnyStartInWindow() {
        int r = 3;
        for (int j0 = 10 - r + 1; j0 <= 10 + r; j0++) {
            for (int i0 = 10 - r + 1; i0 <= 10 + r; i0++) {
                RefinedPeak p = PeakLocator.locate(field, i0 * 0.5, j0 * 0.5, r);
                assertEquals(10, p.getColumn(), "start " + i0 + "," + j0);
                assertEquals(10, p.getRow(), "start " + i0 + "," + j0);
                assertEquals(0.0, p.getX(), 1e-12);
                assertEquals(0.0, p.getY(), 1e-12);
                assertEquals(100f, p.getValue());
            }
        }
    }

    @Test
    void testLocate_windowIsHalfOpen() {
        // starting at 7 the window is [4, 10): the maximum is just outside
        RefinedPeak p = PeakLocator.locate(field, 7 * 0.5, 10 * 0.5, 3);
        assertEquals(9, p.getColumn());
        assertEquals(10, p.getRow());
    }

    @Test
    void testLocate_zeroRadiusReturnsStartPixel() {
        RefinedPeak p = PeakLocator.locate(field, 3 * 0.5, 4 * 0.5, 0);
        assertEquals(3, p.getColumn());
        assertEquals(4, p.getRow());
        assertEquals(3 * 0.5 - 5, p.getX(), 1e-12);
        assertEquals(4 * 0.5 - 5, p.getY(), 1e-12);
    }

    @Test
    void testLocate_clipsAtBorderAndClampsStart() {
        RefinedPeak corner = PeakLocator.locate(field, 0, 0, 5);
        assertEquals(4, corner.getColumn());
        assertEquals(4, corner.getRow());

        RefinedPeak outside = PeakLocator.locate(field, 100, -3, 2);
        assertEquals(14, outside.getColumn());
        assertEquals(1, outside.getRow());
    }

    @Test
    void testLocate_tieKeepsFirstCandidate() {
        FloatProcessor fp = new FloatProcessor(8, 8);
        fp.setf(5, 5, 1f);
        fp.setf(6, 5, 1f);
        ImagePlus flat = new ImagePlus("flat", fp);
        assertEquals(5, PeakLocator.locate(flat, 5, 5, 2).getColumn());
        assertEquals(5, PeakLocator.locate(flat, 6, 6, 2).getColumn());
    }

    @Test
    void testLocate_rejectsNegativeRadius() {
        assertThrows(IllegalArgumentException.class, () -> PeakLocator.locate(field, 0, 0, -1));
    }

    @Test
    void testRefine_movesPointOntoPeak() {
        PeakSelection selection = new PeakSelection();
        selection.add(8 * 0.5, 11 * 0.5);
        int[] events = new int[1];
        selection.addListener(s -> events[0]++);

        RefinedPeak p = PeakLocator.refine(field, selection, 0, 3);

        assertEquals(10, p.getColumn());
        assertArrayEquals(new double[]{5.0, 5.0}, selection.get(0), 1e-12);
        assertEquals(1, events[0]);

        PeakLocator.refine(field, selection, 0, 3);
        assertEquals(1, events[0]);
    }
}
