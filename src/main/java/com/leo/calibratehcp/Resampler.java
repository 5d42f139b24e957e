package com.leo.calibratehcp;

import ij.ImagePlus;
import ij.process.ImageProcessor;

import java.util.Locale;

/**
 * Produces the calibrated copy of the source image: X resolution kept, Y resolution scaled by
 * {@code yScale / xScale}, real extents multiplied by the factors.
 */
public final class Resampler {

    public static final String OUTPUT_TITLE = "Calibrated";
    public static final String PROP_SOURCE_TITLE = "Source Title";
    public static final String PROP_X_SCALE = "X Scaling Factor";
    public static final String PROP_Y_SCALE = "Y Scaling Factor";

    // largest Java array
    static final long MAX_PIXELS = Integer.MAX_VALUE - 8;

    private Resampler() {
    }

    /** Target Y resolution; 0 when the factors cannot produce an image. */
    public static int targetHeight(int height, double xScale, double yScale) {
        if (!isUsable(xScale) || !isUsable(yScale)) return 0;
        double h = height * yScale / xScale;
        if (!Double.isFinite(h) || h >= Integer.MAX_VALUE) return 0;
        return (int) Math.round(h);
    }

    /** False when the factors give no image or one with more pixels than an array can hold. */
    public static boolean canApply(ImagePlus source, CalibrationResult result) {
        if (source == null || result == null) return false;
        int h = targetHeight(source.getHeight(), result.getXScale(), result.getYScale());
        return h > 0 && (long) source.getWidth() * h <= MAX_PIXELS;
    }

    public static ImagePlus apply(ImagePlus source, CalibrationResult result) {
        if (!canApply(source, result)) {
            throw new IllegalArgumentException("Cannot resample with " + result);
        }
        double xScale = result.getXScale();
        double yScale = result.getYScale();
        int newWidth = source.getWidth();
        int newHeight = targetHeight(source.getHeight(), xScale, yScale);

        ImageProcessor ip = source.getProcessor().duplicate();
        ip.resetRoi();
        ip.setInterpolationMethod(ImageProcessor.BILINEAR);
        ImageProcessor resized = ip.resize(newWidth, newHeight);

        double xOffset = FieldGeometry.xOffset(source);
        double yOffset = FieldGeometry.yOffset(source);
        double newXReal = FieldGeometry.xReal(source) * xScale;
        double newYReal = FieldGeometry.yReal(source) * yScale;

        ImagePlus out = new ImagePlus(OUTPUT_TITLE, resized);
        out.setCalibration(source.getCalibration());
        FieldGeometry.setGeometry(out, newXReal, newYReal, xOffset, yOffset);

        Object info = source.getProperty("Info");
        if (info instanceof String) out.setProperty("Info", info);
        out.setProp(PROP_SOURCE_TITLE, source.getTitle());
        out.setProp(PROP_X_SCALE, formatFactor(xScale));
        out.setProp(PROP_Y_SCALE, formatFactor(yScale));
        return out;
    }

    public static String formatFactor(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    private static boolean isUsable(double scale) {
        return Double.isFinite(scale) && scale > 0;
    }
}
