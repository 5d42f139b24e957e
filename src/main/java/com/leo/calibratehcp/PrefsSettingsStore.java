package com.leo.calibratehcp;

import ij.Prefs;

/** Keeps the settings in IJ_Prefs.txt; ImageJ writes the file when it quits. */
public class PrefsSettingsStore implements SettingsStore {

    static final String PREFS_KEY_PREFIX = "calibrate_hcp.";
    static final String PREFS_KEY_LOWER = "lower";
    static final String PREFS_KEY_UPPER = "upper";
    static final String PREFS_KEY_LATTICE = "lattice";
    static final String PREFS_KEY_RADIUS = "radius";

    @Override
    public CalibrationSettings load() {
        CalibrationSettings s = new CalibrationSettings();
        s.setLower(Prefs.get(PREFS_KEY_PREFIX + PREFS_KEY_LOWER, CalibrationSettings.DEFAULT_LOWER));
        s.setUpper(Prefs.get(PREFS_KEY_PREFIX + PREFS_KEY_UPPER, CalibrationSettings.DEFAULT_UPPER));
        double lattice = Prefs.get(PREFS_KEY_PREFIX + PREFS_KEY_LATTICE, CalibrationSettings.DEFAULT_LATTICE_M);
        if (lattice > 0) s.setLatticeMeters(lattice);
        int radius = (int) Prefs.get(PREFS_KEY_PREFIX + PREFS_KEY_RADIUS, CalibrationSettings.DEFAULT_RADIUS_PX);
        if (radius >= 0) s.setRadius(radius);
        return s;
    }

    @Override
    public void save(CalibrationSettings settings) {
        Prefs.set(PREFS_KEY_PREFIX + PREFS_KEY_LOWER, settings.getLower());
        Prefs.set(PREFS_KEY_PREFIX + PREFS_KEY_UPPER, settings.getUpper());
        Prefs.set(PREFS_KEY_PREFIX + PREFS_KEY_LATTICE, settings.getLatticeMeters());
        Prefs.set(PREFS_KEY_PREFIX + PREFS_KEY_RADIUS, settings.getRadius());
    }
}
