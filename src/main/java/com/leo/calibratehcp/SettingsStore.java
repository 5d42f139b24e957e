package com.leo.calibratehcp;

/** Where {@link CalibrationSettings} live between sessions. */
public interface SettingsStore {

    /** Stored values, with defaults for anything missing or invalid. */
    CalibrationSettings load();

    void save(CalibrationSettings settings);
}
