package com.leo.calibratehcp;

public enum ZoomMode {
    X1(1, "×1"),
    X2(2, "×2");

    private final int factor;
    private final String label;

    ZoomMode(int factor, String label) {
        this.factor = factor;
        this.label = label;
    }

    public int getFactor() {
        return factor;
    }

    public String getLabel() {
        return label;
    }

    public static String[] labels() {
        ZoomMode[] modes = values();
        String[] out = new String[modes.length];
        for (int i = 0; i < modes.length; i++) out[i] = modes[i].label;
        return out;
    }
}
