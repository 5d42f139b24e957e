package com.leo.calibratehcp;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Length unit names: reciprocals for spectra and conversion to meters. */
public final class Units {

    private static final String RECIPROCAL_PREFIX = "1/";

    private static final Map<String, Double> METERS_PER_UNIT;
    static {
        Map<String, Double> m = new HashMap<>();
        m.put("m", 1.0);
        m.put("cm", 1e-2);
        m.put("mm", 1e-3);
        m.put("µm", 1e-6);
        m.put("μm", 1e-6);
        m.put("um", 1e-6);
        m.put("micron", 1e-6);
        m.put("microns", 1e-6);
        m.put("nm", 1e-9);
        m.put("Å", 1e-10);
        m.put("A", 1e-10);
        m.put("angstrom", 1e-10);
        m.put("pm", 1e-12);
        METERS_PER_UNIT = m;
    }

    private Units() {
    }

    /** "nm" becomes "1/nm" and back; pixel-like units become "1/pixel". */
    public static String reciprocal(String unit) {
        if (looksLikePixel(unit)) return RECIPROCAL_PREFIX + "pixel";
        String u = unit.trim();
        if (u.startsWith(RECIPROCAL_PREFIX) && u.length() > RECIPROCAL_PREFIX.length()) {
            return u.substring(RECIPROCAL_PREFIX.length());
        }
        return RECIPROCAL_PREFIX + u;
    }

    /** Length of one {@code unit} in meters, or NaN when the unit is not a known length. */
    public static double metersPerUnit(String unit) {
        if (unit == null) return Double.NaN;
        String u = unit.trim();
        Double v = METERS_PER_UNIT.get(u);
        if (v == null) v = METERS_PER_UNIT.get(u.toLowerCase(Locale.ROOT));
        return v == null ? Double.NaN : v;
    }

    public static boolean looksLikePixel(String unit) {
        if (unit == null) return true;
        String u = unit.trim().toLowerCase(Locale.ROOT);
        return u.isEmpty() || "pixel".equals(u) || "pixels".equals(u) || "px".equals(u);
    }
}
