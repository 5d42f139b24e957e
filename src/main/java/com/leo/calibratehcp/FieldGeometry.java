package com.leo.calibratehcp;

import ij.ImagePlus;
import ij.measure.Calibration;

/**
 * Real-space geometry of an {@link ImagePlus} expressed the way the calibration code needs it:
 * extents, offsets and pixel/real conversions, all backed by the image's {@link Calibration}.
 * <p>
 * The offset is the real coordinate of the top-left pixel corner, so a pixel (i, j) sits at
 * {@code (i * dx + xOffset, j * dy + yOffset)}. ImageJ stores the same thing as an origin in
 * pixels: {@code xOffset = -xOrigin * pixelWidth}.
 */
public final class FieldGeometry {

    private FieldGeometry() {
    }

    public static double xReal(ImagePlus imp) {
        return imp.getCalibration().pixelWidth * imp.getWidth();
    }

    public static double yReal(ImagePlus imp) {
        return imp.getCalibration().pixelHeight * imp.getHeight();
    }

    public static double xOffset(ImagePlus imp) {
        Calibration cal = imp.getCalibration();
        return -cal.xOrigin * cal.pixelWidth;
    }

    public static double yOffset(ImagePlus imp) {
        Calibration cal = imp.getCalibration();
        return -cal.yOrigin * cal.pixelHeight;
    }

    public static double dx(ImagePlus imp) {
        return imp.getCalibration().pixelWidth;
    }

    public static double dy(ImagePlus imp) {
        return imp.getCalibration().pixelHeight;
    }

    /** Replaces extents and offsets, keeping units. */
    public static void setGeometry(ImagePlus imp, double xReal, double yReal, double xOffset, double yOffset) {
        Calibration cal = imp.getCalibration().copy();
        cal.pixelWidth = xReal / imp.getWidth();
        cal.pixelHeight = yReal / imp.getHeight();
        cal.xOrigin = -xOffset / cal.pixelWidth;
        cal.yOrigin = -yOffset / cal.pixelHeight;
        imp.setCalibration(cal);
    }

    // nearest pixel, clamped into the image
    public static int toColumn(ImagePlus imp, double localX) {
        return clamp((int) Math.round(localX / dx(imp)), imp.getWidth());
    }

    public static int toRow(ImagePlus imp, double localY) {
        return clamp((int) Math.round(localY / dy(imp)), imp.getHeight());
    }

    public static double toLocalX(ImagePlus imp, int column) {
        return column * dx(imp);
    }

    public static double toLocalY(ImagePlus imp, int row) {
        return row * dy(imp);
    }

    /** Whether the local point falls on a pixel of the image, without clamping. */
    public static boolean contains(ImagePlus imp, double localX, double localY) {
        double col = Math.rint(localX / dx(imp));
        double row = Math.rint(localY / dy(imp));
        return col >= 0 && col < imp.getWidth() && row >= 0 && row < imp.getHeight();
    }

    private static int clamp(int v, int size) {
        return Math.max(0, Math.min(size - 1, v));
    }
}
