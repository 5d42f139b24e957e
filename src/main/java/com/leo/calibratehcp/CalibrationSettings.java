package com.leo.calibratehcp;

/** The four values remembered between sessions. */
public final class CalibrationSettings {

    public static final double DEFAULT_LOWER = 0.0;
    public static final double DEFAULT_UPPER = 0.0;
    public static final double DEFAULT_LATTICE_M = 1e-9;
    public static final int DEFAULT_RADIUS_PX = 3;

    private double lower = DEFAULT_LOWER;
    private double upper = DEFAULT_UPPER;
    private double latticeMeters = DEFAULT_LATTICE_M;
    private int radius = DEFAULT_RADIUS_PX;

    public double getLower() {
        return lower;
    }

    public void setLower(double lower) {
        this.lower = lower;
    }

    public double getUpper() {
        return upper;
    }

    public void setUpper(double upper) {
        this.upper = upper;
    }

    /** Lattice constant in meters. */
    public double getLatticeMeters() {
        return latticeMeters;
    }

    public void setLatticeMeters(double latticeMeters) {
        this.latticeMeters = latticeMeters;
    }

    /** Peak search radius in pixels. */
    public int getRadius() {
        return radius;
    }

    public void setRadius(int radius) {
        this.radius = radius;
    }

    public CalibrationSettings copy() {
        CalibrationSettings c = new CalibrationSettings();
        c.lower = lower;
        c.upper = upper;
        c.latticeMeters = latticeMeters;
        c.radius = radius;
        return c;
    }
}
