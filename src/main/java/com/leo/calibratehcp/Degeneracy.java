package com.leo.calibratehcp;

/** Reasons a peak pair does not give a well-defined scale factor on an axis. */
public enum Degeneracy {
    /** x1² == x2², the numerator of the Y equation vanishes. */
    EQUAL_X_MAGNITUDES,
    /** x1 == 0, the X equation divides by zero. */
    ZERO_X,
    /** y1² == y2². */
    EQUAL_Y_MAGNITUDES,
    /** x1²·y2² == x2²·y1²: both peaks lie on one line through the origin, up to axis signs. */
    COLLINEAR,
    /** The computed factor is NaN or infinite. */
    NON_FINITE
}
