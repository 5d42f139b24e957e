package com.leo.calibratehcp;

import ij.IJ;
import ij.ImagePlus;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * All working state of one calibration run, from the source image to the calibrated output.
 * <p>
 * Every user action arrives as one event method and recomputes only what it affects:
 * picks refine peaks (and solve once two are present), a zoom change rebuilds the display
 * and re-anchors the picks, a lattice change re-solves, a scale entry overrides factors.
 * Nothing is recomputed as a side effect of reading. A session is used from one thread.
 */
public final class CalibrationSession {

    public enum State { EMPTY, ONE_PEAK, TWO_PEAKS, MANUAL_OVERRIDE }

    static final String LOG_PREFIX = "[CalibrateHCP] ";

    private final ImagePlus original;
    private final SettingsStore store;
    private final CalibrationSettings settings;
    private final ZoomView zoomView;
    private final PeakSelection selection = new PeakSelection();
    private final RefinedPeak[] peaks = new RefinedPeak[PeakSelection.MAX_POINTS];
    private final double metersPerUnit;
    private final double spectrumMin;
    private final double spectrumMax;

    // solved (and possibly overridden) factors; only meaningful while the selection is full
    private CalibrationResult solved;
    private double manualX;
    private double manualY;
    private boolean closed;

    public CalibrationSession(ImagePlus original, SettingsStore store) {
        if (original == null) throw new IllegalArgumentException("No image");
        this.original = original;
        this.store = store;
        this.settings = store.load();

        ImagePlus spectrum = SpectrumBuilder.build(original);
        this.zoomView = new ZoomView(spectrum, ZoomMode.X1);
        ImageProcessor ip = spectrum.getProcessor();
        ip.resetMinAndMax();
        this.spectrumMin = ip.getMin();
        this.spectrumMax = ip.getMax();

        String unit = original.getCalibration().getXUnit();
        double m = Units.metersPerUnit(unit);
        if (Double.isNaN(m)) {
            IJ.log(LOG_PREFIX + "Unit '" + unit + "' is not a length; lattice constant is taken in image units.");
            m = 1.0;
        }
        this.metersPerUnit = m;
        IJ.log(LOG_PREFIX + "Spectrum of " + original.getTitle() + ": " + spectrum.getWidth() + "x" + spectrum.getHeight()
                + ", " + spectrum.getCalibration().getXUnit());
    }

    public State getState() {
        if (selection.isFull()) return State.TWO_PEAKS;
        if (manualX > 0 && manualY > 0) return State.MANUAL_OVERRIDE;
        return selection.isEmpty() ? State.EMPTY : State.ONE_PEAK;
    }

    /**
     * Factors that confirming would use: the solved ones with two peaks, the entered ones
     * in manual override, otherwise null.
     */
    public CalibrationResult getResult() {
        switch (getState()) {
            case TWO_PEAKS:
                return solved;
            case MANUAL_OVERRIDE:
                return CalibrationResult.manual(manualX, manualY);
            default:
                return null;
        }
    }

    // ---- events ----

    /** Adds a picked point and refines it; returns its index, or -1 when two are already picked. */
    public int addPeak(double localX, double localY) {
        int index = selection.add(localX, localY);
        if (index < 0) return -1;
        peaks[index] = PeakLocator.refine(getDisplay(), selection, index, settings.getRadius());
        IJ.log(LOG_PREFIX + "Peak " + (index + 1) + ": " + peaks[index]);
        if (selection.isFull()) solve();
        return index;
    }

    /** A picked point was dragged to a new place. */
    public void movePeak(int index, double localX, double localY) {
        selection.set(index, localX, localY);
        peaks[index] = PeakLocator.refine(getDisplay(), selection, index, settings.getRadius());
        if (selection.isFull()) solve();
    }

    public void removePeak(int index) {
        boolean wasFull = selection.isFull();
        selection.remove(index);
        for (int i = index; i < peaks.length - 1; i++) peaks[i] = peaks[i + 1];
        peaks[peaks.length - 1] = null;
        selectionShrunk(wasFull);
    }

    public void clearPeaks() {
        boolean wasFull = selection.isFull();
        selection.clear();
        Arrays.fill(peaks, null);
        selectionShrunk(wasFull);
    }

    public void setZoom(ZoomMode mode) {
        if (mode == zoomView.getMode()) return;
        zoomView.setMode(mode, selection, peaks, settings.getRadius());
        if (selection.isFull()) solve();
    }

    /** Returns false, leaving everything unchanged, for a non-positive constant. */
    public boolean setLatticeMeters(double meters) {
        if (!(meters > 0)) {
            IJ.log(LOG_PREFIX + "Ignoring lattice constant " + meters);
            return false;
        }
        settings.setLatticeMeters(meters);
        if (selection.isFull()) solve();
        return true;
    }

    /** Lattice constant given in the source image's length unit. */
    public boolean setLatticeInImageUnits(double value) {
        return setLatticeMeters(value * metersPerUnit);
    }

    /** Returns false for a negative radius; otherwise re-refines every picked point. */
    public boolean setRadius(int radius) {
        if (radius < 0) {
            IJ.log(LOG_PREFIX + "Ignoring search radius " + radius);
            return false;
        }
        if (radius == settings.getRadius()) return true;
        settings.setRadius(radius);
        zoomView.resnap(selection, peaks, radius);
        if (selection.isFull()) solve();
        return true;
    }

    /**
     * A typed X factor. With two peaks it replaces the solved value and keeps its warnings;
     * otherwise it is a manual override. Non-positive values are rejected.
     */
    public boolean enterXScale(double value) {
        if (!(value > 0) || Double.isInfinite(value)) return false;
        if (selection.isFull() && solved != null) {
            solved = solved.withXScale(value);
        } else {
            manualX = value;
        }
        return true;
    }

    public boolean enterYScale(double value) {
        if (!(value > 0) || Double.isInfinite(value)) return false;
        if (selection.isFull() && solved != null) {
            solved = solved.withYScale(value);
        } else {
            manualY = value;
        }
        return true;
    }

    /** Clamps into the spectrum's range and returns the stored value. */
    public double setLowerThreshold(double value) {
        double v = clampToSpectrum(value);
        settings.setLower(v);
        return v;
    }

    public double setUpperThreshold(double value) {
        double v = clampToSpectrum(value);
        settings.setUpper(v);
        return v;
    }

    public void setFullRange() {
        settings.setLower(spectrumMin);
        settings.setUpper(spectrumMax);
    }

    /**
     * Ends the session and returns the calibrated image, or empty when there is nothing
     * usable to apply.
     */
    public Optional<ImagePlus> confirm() {
        if (closed) return Optional.empty();
        CalibrationResult result = getResult();
        close();
        if (result == null) {
            IJ.log(LOG_PREFIX + "No peaks or scale factors given; nothing to do.");
            return Optional.empty();
        }
        if (!Resampler.canApply(original, result)) {
            IJ.log(LOG_PREFIX + "Scale factors " + result + " give no valid image size; nothing to do.");
            return Optional.empty();
        }
        ImagePlus out = Resampler.apply(original, result);
        IJ.log(LOG_PREFIX + "Calibrated " + original.getTitle() + " -> " + out.getWidth() + "x" + out.getHeight()
                + " (X " + Resampler.formatFactor(result.getXScale())
                + ", Y " + Resampler.formatFactor(result.getYScale()) + ")");
        return Optional.of(out);
    }

    public void cancel() {
        if (!closed) close();
    }

    // ---- derived views ----

    /** The display image clamped to the intensity range; an empty range shows everything. */
    public ImagePlus previewImage() {
        ImagePlus display = getDisplay();
        ImageProcessor fp = display.getProcessor().duplicate();
        float[] px = (float[]) fp.getPixels();
        double lo = Math.min(settings.getLower(), settings.getUpper());
        double hi = Math.max(settings.getLower(), settings.getUpper());
        if (lo < hi) {
            for (int i = 0; i < px.length; i++) {
                if (px[i] < lo) px[i] = (float) lo;
                else if (px[i] > hi) px[i] = (float) hi;
            }
        }
        ImagePlus preview = new ImagePlus(display.getTitle(), new FloatProcessor(fp.getWidth(), fp.getHeight(), px));
        preview.setCalibration(display.getCalibration());
        preview.getProcessor().resetMinAndMax();
        return preview;
    }

    public ImagePlus getOriginal() {
        return original;
    }

    public ImagePlus getSpectrum() {
        return zoomView.getSpectrum();
    }

    public ImagePlus getDisplay() {
        return zoomView.getDisplay();
    }

    public ZoomMode getZoom() {
        return zoomView.getMode();
    }

    public PeakSelection getSelection() {
        return selection;
    }

    /** Refined peak for selection point {@code index}, or null. */
    public RefinedPeak getPeak(int index) {
        return index >= 0 && index < selection.size() ? peaks[index] : null;
    }

    public CalibrationSettings getSettings() {
        return settings.copy();
    }

    public double getLatticeInImageUnits() {
        return settings.getLatticeMeters() / metersPerUnit;
    }

    public double getSpectrumMin() {
        return spectrumMin;
    }

    public double getSpectrumMax() {
        return spectrumMax;
    }

    public boolean isClosed() {
        return closed;
    }

    private void solve() {
        solved = ScaleSolver.solve(peaks[0], peaks[1], getLatticeInImageUnits());
        IJ.log(LOG_PREFIX + "Scale factors " + solved);
        if (solved.isWarning()) {
            IJ.log(LOG_PREFIX + String.format(Locale.ROOT, "Warning: degenerate peak pair (X %s, Y %s)",
                    solved.getXReasons(), solved.getYReasons()));
        }
    }

    // leaving the two-peak state drops solved and typed factors alike
    private void selectionShrunk(boolean wasFull) {
        if (!wasFull) return;
        solved = null;
        manualX = 0;
        manualY = 0;
    }

    private double clampToSpectrum(double v) {
        if (Double.isNaN(v)) return spectrumMin;
        return Math.max(spectrumMin, Math.min(spectrumMax, v));
    }

    private void close() {
        closed = true;
        store.save(settings);
    }
}
