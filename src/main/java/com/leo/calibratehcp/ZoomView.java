package com.leo.calibratehcp;

import ij.ImagePlus;
import ij.process.ImageProcessor;

/**
 * Display window onto the full spectrum. At factor 2 the central (odd-sized) half of the
 * spectrum is stretched back to full resolution; extents and offsets shrink by the factor
 * so real coordinates keep meaning the same physical frequency at every zoom.
 */
public final class ZoomView {

    private final ImagePlus spectrum;
    private ZoomMode mode;
    private ImagePlus display;

    public ZoomView(ImagePlus spectrum, ZoomMode mode) {
        this.spectrum = spectrum;
        this.mode = mode;
        this.display = buildDisplay(spectrum, mode);
    }

    public ZoomMode getMode() {
        return mode;
    }

    public ImagePlus getDisplay() {
        return display;
    }

    public ImagePlus getSpectrum() {
        return spectrum;
    }

    /**
     * Switches to {@code newMode}, rebuilding the display and carrying every live selection
     * point over: the point is placed at its refined peak's physical position in the new
     * frame, then re-snapped on the new display. {@code peaks[i]} holds the refined peak for
     * selection point i and is replaced by the re-snapped one. A peak that lies outside the
     * new display keeps its refined position.
     */
    public void setMode(ZoomMode newMode, PeakSelection selection, RefinedPeak[] peaks, int radius) {
        if (newMode == mode) return;
        mode = newMode;
        display = buildDisplay(spectrum, newMode);

        double scale = 1.0 / newMode.getFactor();
        double xOff = FieldGeometry.xOffset(spectrum) * scale;
        double yOff = FieldGeometry.yOffset(spectrum) * scale;
        for (int i = 0; i < selection.size(); i++) {
            if (peaks[i] == null) continue;
            selection.set(i, peaks[i].getX() - xOff, peaks[i].getY() - yOff);
        }
        resnap(selection, peaks, radius);
    }

    /**
     * Re-runs the peak search for every live point and writes the snapped local position back.
     * Refined points that fall outside the display keep their peak.
     */
    public void resnap(PeakSelection selection, RefinedPeak[] peaks, int radius) {
        double xOff = FieldGeometry.xOffset(display);
        double yOff = FieldGeometry.yOffset(display);
        for (int i = 0; i < selection.size(); i++) {
            double[] point = selection.get(i);
            if (peaks[i] != null && !FieldGeometry.contains(display, point[0], point[1])) continue;
            RefinedPeak p = PeakLocator.refine(display, selection, i, radius);
            peaks[i] = p;
            selection.set(i, p.getX() - xOff, p.getY() - yOff);
        }
    }

    static ImagePlus buildDisplay(ImagePlus spectrum, ZoomMode mode) {
        int factor = mode.getFactor();
        int w = spectrum.getWidth();
        int h = spectrum.getHeight();
        ImageProcessor ip = spectrum.getProcessor().duplicate();
        ImageProcessor out;
        if (factor == 1) {
            out = ip;
        } else {
            int subW = Math.min(w, (w / factor) | 1);
            int subH = Math.min(h, (h / factor) | 1);
            ip.setRoi((w - subW) / 2, (h - subH) / 2, subW, subH);
            ImageProcessor window = ip.crop();
            window.setInterpolationMethod(ImageProcessor.BILINEAR);
            out = window.resize(w, h);
        }
        ImagePlus disp = new ImagePlus(spectrum.getTitle(), out);
        disp.setCalibration(spectrum.getCalibration());
        FieldGeometry.setGeometry(disp,
                FieldGeometry.xReal(spectrum) / factor,
                FieldGeometry.yReal(spectrum) / factor,
                FieldGeometry.xOffset(spectrum) / factor,
                FieldGeometry.yOffset(spectrum) / factor);
        return disp;
    }
}
