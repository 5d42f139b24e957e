package com.leo.calibratehcp;

import com.leo.calibratehcp.CalibrationSession.State;
import ij.ImagePlus;
import ij.process.FloatProcessor;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationSessionTest {

    // 256 px over 6.4 nm: graphite's 0.246 nm ring sits near 30 bins from the center
    private static final int N = 256;
    private static final double FIELD_NM = 6.4;
    private static final double LATTICE_NM = 0.246;
    private static final double DF = 1.0 / FIELD_NM;

    private static ImagePlus noise(int size) {
        Random rnd = new Random(3);
        FloatProcessor fp = new FloatProcessor(size, size);
        for (int i = 0; i < size * size; i++) fp.setf(i, (float) rnd.nextGaussian());
        ImagePlus imp = new ImagePlus("noise", fp);
        imp.setCalibration(TestImages.calibration(0.1, 0.1, "nm"));
        return imp;
    }

    @Test
    void testHcpLattice_endToEnd() {
        ImagePlus source = TestImages.hcpPattern(N, FIELD_NM, LATTICE_NM);
        MapSettingsStore store = new MapSettingsStore();
        CalibrationSession session = new CalibrationSession(source, store);
        assertTrue(session.setLatticeMeters(LATTICE_NM * 1e-9));
        assertEquals(LATTICE_NM, session.getLatticeInImageUnits(), 1e-12);
        assertEquals(DF, FieldGeometry.dx(session.getDisplay()), 1e-12);

        // picks one pixel off the 0° and 60° peaks
        session.addPeak(157 * DF, 129 * DF);
        session.addPeak(144 * DF, 153 * DF);

        assertEquals(State.TWO_PEAKS, session.getState());
        assertEquals(158, session.getPeak(0).getColumn());
        assertEquals(128, session.getPeak(0).getRow());
        assertEquals(143, session.getPeak(1).getColumn());
        assertEquals(154, session.getPeak(1).getRow());
        assertEquals(30 * DF, session.getPeak(0).getX(), 1e-9);
        assertEquals(0.0, session.getPeak(0).getY(), 1e-9);

        CalibrationResult result = session.getResult();
        assertFalse(result.isWarning());
        assertEquals(1.0, result.getXScale(), 0.01);
        assertEquals(1.0, result.getYScale(), 0.01);

        Optional<ImagePlus> out = session.confirm();
        assertTrue(out.isPresent());
        ImagePlus calibrated = out.get();
        assertEquals(N, calibrated.getWidth());
        assertEquals(Resampler.targetHeight(N, result.getXScale(), result.getYScale()), calibrated.getHeight());
        assertEquals(FIELD_NM * result.getXScale(), FieldGeometry.xReal(calibrated), 1e-9);
        assertEquals(FIELD_NM * result.getYScale(), FieldGeometry.yReal(calibrated), 1e-9);
        assertTrue(session.isClosed());
        assertEquals(1, store.saves);
        assertEquals(LATTICE_NM * 1e-9, store.stored().getLatticeMeters(), 1e-21);
    }

    @Test
    void testHcpLattice_zoomKeepsResult() {
        CalibrationSession session = new CalibrationSession(TestImages.hcpPattern(N, FIELD_NM, LATTICE_NM),
                new MapSettingsStore());
        session.setLatticeMeters(LATTICE_NM * 1e-9);
        session.addPeak(158 * DF, 128 * DF);
        session.addPeak(143 * DF, 154 * DF);
        double x = session.getResult().getXScale();

        session.setZoom(ZoomMode.X2);
        assertEquals(ZoomMode.X2, session.getZoom());
        assertEquals(x, session.getResult().getXScale(), 0.05);

        session.setZoom(ZoomMode.X1);
        assertEquals(158, session.getPeak(0).getColumn());
        assertEquals(143, session.getPeak(1).getColumn());
        assertEquals(x, session.getResult().getXScale(), 1e-12);
    }

    @Test
    void testStateMachine() {
        CalibrationSession session = new CalibrationSession(noise(32), new MapSettingsStore());
        assertEquals(State.EMPTY, session.getState());
        assertNull(session.getResult());

        assertEquals(0, session.addPeak(0.4, 0.2));
        assertEquals(State.ONE_PEAK, session.getState());
        assertNull(session.getResult());

        assertEquals(1, session.addPeak(1.0, 2.0));
        assertEquals(State.TWO_PEAKS, session.getState());
        assertNotNull(session.getResult());
        assertEquals(-1, session.addPeak(2.0, 2.0));

        session.removePeak(0);
        assertEquals(State.ONE_PEAK, session.getState());
        assertNull(session.getResult());
        assertNull(session.getPeak(1));
        assertNotNull(session.getPeak(0));

        session.clearPeaks();
        assertEquals(State.EMPTY, session.getState());
    }

    @Test
    void testManualOverride_withoutPeaks() {
        ImagePlus source = noise(32);
        CalibrationSession session = new CalibrationSession(source, new MapSettingsStore());
        assertTrue(session.enterXScale(2.0));
        assertEquals(State.EMPTY, session.getState());
        assertTrue(session.enterYScale(1.0));
        assertEquals(State.MANUAL_OVERRIDE, session.getState());

        ImagePlus out = session.confirm().orElseThrow();
        assertEquals(32, out.getWidth());
        assertEquals(16, out.getHeight());
        assertEquals("2.00000", out.getProp(Resampler.PROP_X_SCALE));
    }

    @Test
    void testManualOverride_replacesSolvedValue() {
        CalibrationSession session = new CalibrationSession(noise(32), new MapSettingsStore());
        session.addPeak(0.4, 0.2);
        session.addPeak(1.0, 2.0);
        assertTrue(session.enterYScale(1.5));
        assertEquals(1.5, session.getResult().getYScale());
        assertEquals(State.TWO_PEAKS, session.getState());
    }

    @Test
    void testLeavingTwoPeaksDropsTypedScales() {
        CalibrationSession session = new CalibrationSession(noise(32), new MapSettingsStore());
        session.enterXScale(2.0);
        session.enterYScale(2.0);
        session.addPeak(0.4, 0.2);
        assertEquals(State.MANUAL_OVERRIDE, session.getState());
        session.addPeak(1.0, 2.0);
        session.removePeak(1);
        assertEquals(State.ONE_PEAK, session.getState());
        assertNull(session.getResult());
    }

    @Test
    void testManualOverride_oversizedOutputGivesNothing() {
        CalibrationSession session = new CalibrationSession(noise(32), new MapSettingsStore());
        assertTrue(session.enterXScale(1e-4));
        assertTrue(session.enterYScale(6000));
        assertEquals(State.MANUAL_OVERRIDE, session.getState());
        assertFalse(session.confirm().isPresent());
        assertTrue(session.isClosed());
    }

    @Test
    void testRejectsInvalidInput() {
        CalibrationSession session = new CalibrationSession(noise(32), new MapSettingsStore());
        assertFalse(session.enterXScale(0));
        assertFalse(session.enterYScale(-1));
        assertFalse(session.enterXScale(Double.POSITIVE_INFINITY));
        assertFalse(session.setLatticeMeters(0));
        assertFalse(session.setLatticeInImageUnits(-0.3));
        assertEquals(CalibrationSettings.DEFAULT_LATTICE_M, session.getSettings().getLatticeMeters());
        assertFalse(session.setRadius(-1));
        assertEquals(CalibrationSettings.DEFAULT_RADIUS_PX, session.getSettings().getRadius());
        assertTrue(session.setRadius(0));
        assertEquals(State.EMPTY, session.getState());
    }

    @Test
    void testDegeneratePicks_warnAndProduceNothing() {
        CalibrationSession session = new CalibrationSession(TestImages.hcpPattern(N, FIELD_NM, LATTICE_NM),
                new MapSettingsStore());
        session.setLatticeMeters(LATTICE_NM * 1e-9);
        session.addPeak(158 * DF, 128 * DF);
        session.addPeak(98 * DF, 128 * DF);

        CalibrationResult result = session.getResult();
        assertTrue(result.isXWarning());
        assertTrue(result.isYWarning());
        assertFalse(session.confirm().isPresent());
        assertTrue(session.isClosed());
    }

    @Test
    void testThresholds_clampedToSpectrum() {
        CalibrationSession session = new CalibrationSession(noise(32), new MapSettingsStore());
        assertEquals(0.0, session.getSpectrumMin());
        assertEquals(0.0, session.setLowerThreshold(-5));
        assertEquals(session.getSpectrumMax(), session.setUpperThreshold(1e9));
        assertEquals(0.0, session.setUpperThreshold(Double.NaN));

        double mid = session.getSpectrumMax() / 2;
        session.setLowerThreshold(0);
        session.setUpperThreshold(mid);
        float[] px = (float[]) session.previewImage().getProcessor().getPixels();
        for (float v : px) assertTrue(v <= mid + 1e-6);

        session.setFullRange();
        assertEquals(session.getSpectrumMax(), session.getSettings().getUpper());
    }

    @Test
    void testPreview_emptyRangeShowsEverything() {
        CalibrationSession session = new CalibrationSession(noise(32), new MapSettingsStore());
        assertArrayEquals((float[]) session.getDisplay().getProcessor().getPixels(),
                (float[]) session.previewImage().getProcessor().getPixels());
    }

    @Test
    void testCancel_savesSettingsOnce() {
        MapSettingsStore store = new MapSettingsStore();
        CalibrationSession session = new CalibrationSession(noise(32), store);
        session.setRadius(6);
        session.cancel();
        session.cancel();
        assertFalse(session.confirm().isPresent());
        assertEquals(1, store.saves);
        assertEquals(6, store.stored().getRadius());
    }

    @Test
    void testPixelUnits_latticeTakenAsIs() {
        FloatProcessor fp = new FloatProcessor(16, 16);
        CalibrationSession session = new CalibrationSession(new ImagePlus("px", fp), new MapSettingsStore());
        assertTrue(session.setLatticeInImageUnits(4.0));
        assertEquals(4.0, session.getLatticeInImageUnits());
        assertEquals("1/pixel", session.getSpectrum().getCalibration().getXUnit());
    }
}
