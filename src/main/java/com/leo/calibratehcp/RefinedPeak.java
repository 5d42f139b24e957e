package com.leo.calibratehcp;

import java.util.Locale;

/** Locally maximal sample near a picked point, in offset-corrected real coordinates. */
public final class RefinedPeak {

    private final double x;
    private final double y;
    private final double value;
    private final int column;
    private final int row;

    public RefinedPeak(double x, double y, double value, int column, int row) {
        this.x = x;
        this.y = y;
        this.value = value;
        this.column = column;
        this.row = row;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getValue() {
        return value;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.6g, %.6g) = %.6g [px %d,%d]", x, y, value, column, row);
    }
}
