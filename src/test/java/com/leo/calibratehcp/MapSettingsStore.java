package com.leo.calibratehcp;

/** Keeps settings in memory and counts saves. */
class MapSettingsStore implements SettingsStore {

    private CalibrationSettings stored;
    int saves;

    MapSettingsStore() {
        this(new CalibrationSettings());
    }

    MapSettingsStore(CalibrationSettings initial) {
        this.stored = initial.copy();
    }

    @Override
    public CalibrationSettings load() {
        return stored.copy();
    }

    @Override
    public void save(CalibrationSettings settings) {
        stored = settings.copy();
        saves++;
    }

    CalibrationSettings stored() {
        return stored.copy();
    }
}
