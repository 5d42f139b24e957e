package com.leo.calibratehcp;

import ij.ImagePlus;
import ij.measure.Calibration;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Builds the centered Fourier magnitude image the peaks are picked on.
 * <p>
 * The source plane is mean-subtracted and Hann-windowed, transformed, reduced to its modulus,
 * re-centered so that the zero frequency sits at {@code (W/2, H/2)}, given reciprocal units
 * with the center at (0, 0) and finally shifted so that its minimum is exactly 0.
 */
public final class SpectrumBuilder {

    private SpectrumBuilder() {
    }

    public static ImagePlus build(ImagePlus source) {
        if (source == null) throw new IllegalArgumentException("No source image");
        ImageProcessor ip = source.getProcessor().convertToFloatProcessor();
        int w = ip.getWidth();
        int h = ip.getHeight();
        float[] pixels = (float[]) ip.getPixels();

        double[] re = new double[w * h];
        double[] im = new double[w * h];
        double mean = 0;
        for (float v : pixels) mean += v;
        mean /= pixels.length;

        double[] wx = hann(w);
        double[] wy = hann(h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                re[i] = (pixels[i] - mean) * wx[x] * wy[y];
            }
        }

        Fourier.transform2D(re, im, w, h);

        double norm = 1.0 / Math.sqrt((double) w * h);
        float[] out = new float[w * h];
        int cx = w / 2;
        int cy = h / 2;
        for (int y = 0; y < h; y++) {
            int ty = (y + cy) % h;
            for (int x = 0; x < w; x++) {
                int tx = (x + cx) % w;
                int i = y * w + x;
                out[ty * w + tx] = (float) (Math.hypot(re[i], im[i]) * norm);
            }
        }

        float min = Float.POSITIVE_INFINITY;
        for (float v : out) if (v < min) min = v;
        for (int i = 0; i < out.length; i++) out[i] = out[i] - min;

        ImagePlus spectrum = new ImagePlus("FFT of " + source.getTitle(), new FloatProcessor(w, h, out));
        spectrum.setCalibration(reciprocalCalibration(source.getCalibration(), w, h));
        spectrum.getProcessor().resetMinAndMax();
        return spectrum;
    }

    static double[] hann(int n) {
        double[] win = new double[n];
        if (n == 1) {
            win[0] = 1.0;
            return win;
        }
        for (int i = 0; i < n; i++) {
            win[i] = 0.5 - 0.5 * Math.cos(2 * Math.PI * i / (n - 1));
        }
        return win;
    }

    // extents 1/dx, 1/dy; the geometric center (W/2.0, H/2.0) maps to (0, 0)
    private static Calibration reciprocalCalibration(Calibration src, int w, int h) {
        Calibration cal = new Calibration();
        double xReal = 1.0 / src.pixelWidth;
        double yReal = 1.0 / src.pixelHeight;
        cal.pixelWidth = xReal / w;
        cal.pixelHeight = yReal / h;
        cal.xOrigin = w / 2.0;
        cal.yOrigin = h / 2.0;
        cal.setXUnit(Units.reciprocal(src.getXUnit()));
        cal.setYUnit(Units.reciprocal(src.getYUnit()));
        cal.setValueUnit(src.getValueUnit());
        return cal;
    }
}
