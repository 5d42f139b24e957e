package com.leo.calibratehcp;

import ij.ImagePlus;
import ij.process.ImageProcessor;

/**
 * Snaps an approximate point to the brightest pixel of a square neighborhood.
 */
public final class PeakLocator {

    private PeakLocator() {
    }

    /**
     * Finds the maximum in the window {@code [i0-r, i0+r) x [j0-r, j0+r)} around the pixel
     * nearest to the local point (x, y), clipped to the image. The pixel under the point is
     * the starting candidate and only a strictly greater value replaces the current best, so
     * ties keep the first pixel met in row-major order. With {@code r == 0} the window is
     * empty and the pixel under the point is returned.
     */
    public static RefinedPeak locate(ImagePlus field, double x, double y, int radius) {
        if (radius < 0) throw new IllegalArgumentException("Negative search radius: " + radius);
        ImageProcessor ip = field.getProcessor();
        int w = ip.getWidth();
        int h = ip.getHeight();
        int i0 = FieldGeometry.toColumn(field, x);
        int j0 = FieldGeometry.toRow(field, y);

        int bestI = i0;
        int bestJ = j0;
        float best = ip.getf(i0, j0);

        int lowI = Math.max(0, i0 - radius);
        int highI = Math.min(w, i0 + radius);
        int lowJ = Math.max(0, j0 - radius);
        int highJ = Math.min(h, j0 + radius);
        for (int j = lowJ; j < highJ; j++) {
            for (int i = lowI; i < highI; i++) {
                float v = ip.getf(i, j);
                if (v > best) {
                    best = v;
                    bestI = i;
                    bestJ = j;
                }
            }
        }
        return new RefinedPeak(
                FieldGeometry.toLocalX(field, bestI) + FieldGeometry.xOffset(field),
                FieldGeometry.toLocalY(field, bestJ) + FieldGeometry.yOffset(field),
                best, bestI, bestJ);
    }

    /**
     * Refines selection point {@code index} against {@code field}. When the peak pixel differs
     * from the pixel under the point, the point is moved onto the peak pixel so the picked
     * marker follows the snap. Calling it again on the result changes nothing.
     */
    public static RefinedPeak refine(ImagePlus field, PeakSelection selection, int index, int radius) {
        double[] p = selection.get(index);
        RefinedPeak peak = locate(field, p[0], p[1], radius);
        if (peak.getColumn() != FieldGeometry.toColumn(field, p[0])
                || peak.getRow() != FieldGeometry.toRow(field, p[1])) {
            selection.set(index,
                    FieldGeometry.toLocalX(field, peak.getColumn()),
                    FieldGeometry.toLocalY(field, peak.getRow()));
        }
        return peak;
    }
}
