package com.leo.calibratehcp;

import ij.IJ;
import ij.ImagePlus;
import ij.WindowManager;
import ij.gui.DialogListener;
import ij.gui.GenericDialog;
import ij.gui.NonBlockingGenericDialog;
import ij.gui.PointRoi;
import ij.gui.Roi;
import ij.gui.RoiListener;
import ij.plugin.PlugIn;
import ij.process.FloatPolygon;

import java.awt.AWTEvent;
import java.awt.Button;
import java.awt.Color;
import java.awt.FlowLayout;
import java.awt.Label;
import java.awt.Panel;
import java.awt.TextField;
import java.awt.event.FocusAdapter;
import java.awt.event.FocusEvent;
import java.util.Locale;
import java.util.Optional;
import java.util.Vector;

public class CalibrateHCP_Plugin implements PlugIn, DialogListener, RoiListener {

    private static final String TITLE = "Calibrate HCP";
    private static final int MAX_RADIUS = 10;

    // numeric field order in the dialog
    private static final int FIELD_LOWER = 0;
    private static final int FIELD_UPPER = 1;
    private static final int FIELD_LATTICE = 3;

    private CalibrationSession session;
    private ImagePlus view;
    private boolean updatingRoi;
    private String shownX = "";
    private String shownY = "";
    private TextField lowerField, upperField, latticeField, xScaleField, yScaleField;
    private Label warningLabel;

    @Override
    public void run(String arg) {
        if ("settings".equalsIgnoreCase(arg)) {
            openSettingsDialog(new PrefsSettingsStore());
            return;
        }

        ImagePlus imp = WindowManager.getCurrentImage();
        if (imp == null) {
            IJ.noImage();
            return;
        }
        if (Units.looksLikePixel(imp.getCalibration().getXUnit())) {
            IJ.showMessage(TITLE,
                    "This image appears to be uncalibrated (unit = 'pixel').\n" +
                            "The lattice constant will be read in pixels.");
        }

        try {
            calibrate(imp);
        } catch (Exception e) {
            IJ.handleException(e);
        }
    }

    private void calibrate(ImagePlus imp) {
        IJ.showStatus("Computing FFT of " + imp.getTitle() + "...");
        session = new CalibrationSession(imp, new PrefsSettingsStore());
        view = session.previewImage();
        view.setTitle(WindowManager.makeUniqueName(session.getSpectrum().getTitle()));
        view.show();
        IJ.setTool("multipoint");
        session.getSelection().addListener(s -> mirrorSelection());
        Roi.addRoiListener(this);

        CalibrationSettings s = session.getSettings();
        String unit = imp.getCalibration().getXUnit();
        String zUnit = view.getCalibration().getValueUnit();

        NonBlockingGenericDialog gd = new NonBlockingGenericDialog(TITLE);
        gd.addMessage("FFT of data\nModulus, Hanning window, subtract mean");
        gd.addMessage("Select two peaks in the first hexagonal ring around center");
        gd.addChoice("Zoom:", ZoomMode.labels(), session.getZoom().getLabel());
        gd.addNumericField("Lower:", s.getLower(), 4, 10, zUnit);
        gd.addNumericField("Upper:", s.getUpper(), 4, 10, zUnit);
        gd.addSlider("Peak search radius (px):", 0, MAX_RADIUS, s.getRadius());
        gd.addNumericField("Lattice constant:", session.getLatticeInImageUnits(), 5, 10, unit);
        gd.addStringField("X scale:", "", 10);
        gd.addStringField("Y scale:", "", 10);
        gd.addPanel(buttonPanel());

        Vector<?> numeric = gd.getNumericFields();
        Vector<?> strings = gd.getStringFields();
        lowerField = (TextField) numeric.get(FIELD_LOWER);
        upperField = (TextField) numeric.get(FIELD_UPPER);
        latticeField = (TextField) numeric.get(FIELD_LATTICE);
        xScaleField = (TextField) strings.get(0);
        yScaleField = (TextField) strings.get(1);
        installRevertOnFocusLost();

        gd.addDialogListener(this);
        gd.showDialog();
        Roi.removeRoiListener(this);

        if (gd.wasCanceled()) {
            session.cancel();
            view.close();
            IJ.showStatus("");
            return;
        }
        Optional<ImagePlus> out = session.confirm();
        view.close();
        if (out.isPresent()) {
            ImagePlus result = out.get();
            result.setTitle(WindowManager.makeUniqueName(result.getTitle()));
            result.show();
        } else {
            IJ.showStatus(TITLE + ": no output");
        }
    }

    // buttons and the warning line, same row
    private Panel buttonPanel() {
        Panel panel = new Panel(new FlowLayout(FlowLayout.LEFT, 4, 0));
        Button fullRange = new Button("Set to Full Range");
        fullRange.addActionListener(e -> {
            session.setFullRange();
            CalibrationSettings s = session.getSettings();
            lowerField.setText(IJ.d2s(s.getLower(), 4));
            upperField.setText(IJ.d2s(s.getUpper(), 4));
            refreshView();
        });
        panel.add(fullRange);
        Button clear = new Button("Clear Points");
        clear.addActionListener(e -> {
            session.clearPeaks();
            refreshScaleFields();
        });
        panel.add(clear);
        warningLabel = new Label("", Label.LEFT);
        warningLabel.setForeground(Color.RED);
        warningLabel.setPreferredSize(new java.awt.Dimension(200, 20));
        panel.add(warningLabel);
        return panel;
    }

    @Override
    public boolean dialogItemChanged(GenericDialog gd, AWTEvent e) {
        if (session == null || session.isClosed()) return true;
        ZoomMode zoom = ZoomMode.values()[gd.getNextChoiceIndex()];
        double lower = gd.getNextNumber();
        double upper = gd.getNextNumber();
        double radius = gd.getNextNumber();
        double lattice = gd.getNextNumber();
        String xs = gd.getNextString().trim();
        String ys = gd.getNextString().trim();

        CalibrationSettings s = session.getSettings();
        boolean viewChanged = false;
        boolean scalesChanged = false;

        if (zoom != session.getZoom()) {
            session.setZoom(zoom);
            viewChanged = true;
            scalesChanged = true;
        }
        if (!Double.isNaN(lower) && lower != s.getLower()) {
            session.setLowerThreshold(lower);
            viewChanged = true;
        }
        if (!Double.isNaN(upper) && upper != s.getUpper()) {
            session.setUpperThreshold(upper);
            viewChanged = true;
        }
        if (!Double.isNaN(radius) && (int) radius != s.getRadius()) {
            scalesChanged |= session.setRadius((int) radius);
        }
        if (lattice > 0 && Math.abs(lattice - session.getLatticeInImageUnits()) > 1e-12 * lattice) {
            scalesChanged |= session.setLatticeInImageUnits(lattice);
        }
        if (!xs.equals(shownX)) {
            session.enterXScale(parseDoubleSafe(xs, 0));
            shownX = xs;
        }
        if (!ys.equals(shownY)) {
            session.enterYScale(parseDoubleSafe(ys, 0));
            shownY = ys;
        }

        if (viewChanged) refreshView();
        if (scalesChanged) refreshScaleFields();
        return true;
    }

    @Override
    public void roiModified(ImagePlus imp, int id) {
        if (imp != view || updatingRoi || session == null || session.isClosed()) return;
        Roi roi = imp.getRoi();
        PeakSelection sel = session.getSelection();
        if (id == RoiListener.DELETED || !(roi instanceof PointRoi)) {
            if (!sel.isEmpty()) {
                session.clearPeaks();
                refreshScaleFields();
            }
            return;
        }
        ImagePlus display = session.getDisplay();
        double dx = FieldGeometry.dx(display);
        double dy = FieldGeometry.dy(display);
        FloatPolygon poly = roi.getFloatPolygon();
        int n = Math.min(poly.npoints, PeakSelection.MAX_POINTS);
        if (n < sel.size()) session.clearPeaks();
        for (int i = 0; i < n; i++) {
            double x = Math.floor(poly.xpoints[i]) * dx;
            double y = Math.floor(poly.ypoints[i]) * dy;
            if (i < sel.size()) {
                double[] p = sel.get(i);
                if (FieldGeometry.toColumn(display, p[0]) != FieldGeometry.toColumn(display, x)
                        || FieldGeometry.toRow(display, p[1]) != FieldGeometry.toRow(display, y)) {
                    session.movePeak(i, x, y);
                }
            } else {
                session.addPeak(x, y);
            }
        }
        if (poly.npoints > PeakSelection.MAX_POINTS) mirrorSelection();
        refreshScaleFields();
    }

    // draws the (snapped) selection on the spectrum window
    private void mirrorSelection() {
        if (view == null) return;
        PeakSelection sel = session.getSelection();
        ImagePlus display = session.getDisplay();
        updatingRoi = true;
        try {
            if (sel.isEmpty()) {
                view.deleteRoi();
                return;
            }
            float[] xs = new float[sel.size()];
            float[] ys = new float[sel.size()];
            for (int i = 0; i < sel.size(); i++) {
                double[] p = sel.get(i);
                xs[i] = (float) (FieldGeometry.toColumn(display, p[0]) + 0.5);
                ys[i] = (float) (FieldGeometry.toRow(display, p[1]) + 0.5);
            }
            view.setRoi(new PointRoi(xs, ys, xs.length));
        } finally {
            updatingRoi = false;
        }
    }

    private void refreshView() {
        ImagePlus preview = session.previewImage();
        view.setProcessor(preview.getProcessor());
        view.setCalibration(preview.getCalibration());
        mirrorSelection();
        view.updateAndDraw();
    }

    private void refreshScaleFields() {
        CalibrationResult r = session.getResult();
        if (session.getState() == CalibrationSession.State.TWO_PEAKS && r != null) {
            shownX = String.format(Locale.ROOT, "%f", r.getXScale());
            shownY = String.format(Locale.ROOT, "%f", r.getYScale());
            xScaleField.setText(shownX);
            yScaleField.setText(shownY);
        }
        for (int i = 0; i < session.getSelection().size(); i++) {
            RefinedPeak p = session.getPeak(i);
            if (p != null) IJ.showStatus("Peak " + (i + 1) + ": " + p);
        }
        String warning = "";
        if (r != null && r.isWarning()) {
            warning = "Warning!" + (r.isXWarning() ? " X" : "") + (r.isYWarning() ? " Y" : "");
            IJ.showStatus(TITLE + ": " + warning);
        }
        warningLabel.setText(warning);
    }

    // unfocused fields show what the session actually holds
    private void installRevertOnFocusLost() {
        lowerField.addFocusListener(new FocusAdapter() {
            @Override
            public void focusLost(FocusEvent e) {
                lowerField.setText(IJ.d2s(session.getSettings().getLower(), 4));
            }
        });
        upperField.addFocusListener(new FocusAdapter() {
            @Override
            public void focusLost(FocusEvent e) {
                upperField.setText(IJ.d2s(session.getSettings().getUpper(), 4));
            }
        });
        latticeField.addFocusListener(new FocusAdapter() {
            @Override
            public void focusLost(FocusEvent e) {
                latticeField.setText(IJ.d2s(session.getLatticeInImageUnits(), 5));
            }
        });
    }

    private void openSettingsDialog(SettingsStore store) {
        CalibrationSettings s = store.load();
        GenericDialog gd = new GenericDialog(TITLE + " Settings");
        gd.addNumericField("Lattice constant:", s.getLatticeMeters() * 1e9, 5, 10, "nm");
        gd.addSlider("Peak search radius (px):", 0, MAX_RADIUS, s.getRadius());
        gd.addNumericField("Lower:", s.getLower(), 4);
        gd.addNumericField("Upper:", s.getUpper(), 4);
        gd.showDialog();
        if (gd.wasCanceled()) return;

        double latticeNm = gd.getNextNumber();
        int radius = (int) gd.getNextNumber();
        double lower = gd.getNextNumber();
        double upper = gd.getNextNumber();
        if (latticeNm > 0) s.setLatticeMeters(latticeNm * 1e-9);
        else IJ.log(CalibrationSession.LOG_PREFIX + "Ignoring lattice constant " + latticeNm + " nm");
        if (radius >= 0) s.setRadius(radius);
        if (!Double.isNaN(lower)) s.setLower(lower);
        if (!Double.isNaN(upper)) s.setUpper(upper);
        store.save(s);
        IJ.showStatus("[CalibrateHCP] Settings updated.");
    }

    private static double parseDoubleSafe(String s, double defVal) {
        try {
            return Double.parseDouble(s.trim());
        } catch (Exception e) {
            return defVal;
        }
    }
}
