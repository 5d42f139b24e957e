package com.leo.calibratehcp;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * X/Y pixel-pitch correction factors with the reasons, per axis, that make them suspect.
 * A factor may be any double, NaN included; whether it can be trusted is read only from
 * {@link #isXWarning()} and {@link #isYWarning()}.
 */
public final class CalibrationResult {

    private final double xScale;
    private final double yScale;
    private final Set<Degeneracy> xReasons;
    private final Set<Degeneracy> yReasons;

    public CalibrationResult(double xScale, double yScale, Set<Degeneracy> xReasons, Set<Degeneracy> yReasons) {
        this.xScale = xScale;
        this.yScale = yScale;
        this.xReasons = Collections.unmodifiableSet(copy(xReasons));
        this.yReasons = Collections.unmodifiableSet(copy(yReasons));
    }

    /** Directly entered factors; never carries a warning. */
    public static CalibrationResult manual(double xScale, double yScale) {
        return new CalibrationResult(xScale, yScale, EnumSet.noneOf(Degeneracy.class), EnumSet.noneOf(Degeneracy.class));
    }

    public double getXScale() {
        return xScale;
    }

    public double getYScale() {
        return yScale;
    }

    public Set<Degeneracy> getXReasons() {
        return xReasons;
    }

    public Set<Degeneracy> getYReasons() {
        return yReasons;
    }

    public boolean isXWarning() {
        return !xReasons.isEmpty();
    }

    public boolean isYWarning() {
        return !yReasons.isEmpty();
    }

    public boolean isWarning() {
        return isXWarning() || isYWarning();
    }

    public CalibrationResult withXScale(double value) {
        return new CalibrationResult(value, yScale, xReasons, yReasons);
    }

    public CalibrationResult withYScale(double value) {
        return new CalibrationResult(xScale, value, xReasons, yReasons);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "X %.5f %s, Y %.5f %s", xScale, xReasons, yScale, yReasons);
    }

    private static EnumSet<Degeneracy> copy(Set<Degeneracy> s) {
        return s.isEmpty() ? EnumSet.noneOf(Degeneracy.class) : EnumSet.copyOf(s);
    }
}
