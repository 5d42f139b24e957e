package com.leo.calibratehcp;

import java.util.EnumSet;

/**
 * Closed-form X/Y scale factors from two first-ring peaks of an HCP lattice.
 * <p>
 * An HCP lattice with nearest-neighbor spacing {@code a} has its first reciprocal ring at
 * {@code R = 2 / (sqrt(3) a)}. Requiring both corrected peaks {@code (x/sx, y/sy)} to lie on
 * that ring gives two equations in the two unknown corrections:
 * <pre>
 *   ycorr = R * sqrt((x1² - x2²) / (x1² y2² - x2² y1²))
 *   xcorr = sqrt((R² - ycorr² y1²) / x1²)
 * </pre>
 * The pixel-pitch factors are the reciprocals of the corrections.
 */
public final class ScaleSolver {

    private ScaleSolver() {
    }

    public static double ringRadius(double lattice) {
        return 2.0 / (Math.sqrt(3.0) * lattice);
    }

    /**
     * Peaks are used in selection order. With consistent data the solution does not depend on
     * that order: the Y equation is symmetric, and the X equation holds for either peak once
     * Y is fixed.
     */
    public static CalibrationResult solve(RefinedPeak first, RefinedPeak second, double lattice) {
        return solve(first.getX(), first.getY(), second.getX(), second.getY(), lattice);
    }

    public static CalibrationResult solve(double x1, double y1, double x2, double y2, double lattice) {
        if (!(lattice > 0)) throw new IllegalArgumentException("Lattice constant must be positive: " + lattice);
        double r = ringRadius(lattice);
        double x1s = x1 * x1;
        double y1s = y1 * y1;
        double x2s = x2 * x2;
        double y2s = y2 * y2;
        double denominator = x1s * y2s - x2s * y1s;

        double ycorr = r * Math.sqrt((x1s - x2s) / denominator);
        double xcorr = Math.sqrt((r * r - ycorr * ycorr * y1s) / x1s);
        double xScale = 1.0 / xcorr;
        double yScale = 1.0 / ycorr;

        EnumSet<Degeneracy> xReasons = EnumSet.noneOf(Degeneracy.class);
        EnumSet<Degeneracy> yReasons = EnumSet.noneOf(Degeneracy.class);
        if (x1s == x2s) xReasons.add(Degeneracy.EQUAL_X_MAGNITUDES);
        if (x1s == 0) xReasons.add(Degeneracy.ZERO_X);
        if (!Double.isFinite(xScale)) xReasons.add(Degeneracy.NON_FINITE);
        if (y1s == y2s) yReasons.add(Degeneracy.EQUAL_Y_MAGNITUDES);
        if (!Double.isFinite(yScale)) yReasons.add(Degeneracy.NON_FINITE);
        if (x1s * y2s == x2s * y1s) {
            xReasons.add(Degeneracy.COLLINEAR);
            yReasons.add(Degeneracy.COLLINEAR);
        }
        return new CalibrationResult(xScale, yScale, xReasons, yReasons);
    }
}
