package com.leo.calibratehcp;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered store of at most two picked points, in local (pre-offset) real coordinates of the
 * display image.
 */
public final class PeakSelection {

    public static final int MAX_POINTS = 2;

    public interface Listener {
        void selectionChanged(PeakSelection selection);
    }

    private final List<double[]> points = new ArrayList<>();
    private final List<Listener> listeners = new ArrayList<>();

    public void addListener(Listener l) {
        listeners.add(l);
    }

    public void removeListener(Listener l) {
        listeners.remove(l);
    }

    public int size() {
        return points.size();
    }

    public boolean isFull() {
        return points.size() == MAX_POINTS;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /** Returns a copy of point {@code index} as {x, y}. */
    public double[] get(int index) {
        checkIndex(index);
        return points.get(index).clone();
    }

    /** Appends a point; returns its index, or -1 when the selection is already full. */
    public int add(double x, double y) {
        if (isFull()) return -1;
        points.add(new double[]{x, y});
        fireChanged();
        return points.size() - 1;
    }

    public void set(int index, double x, double y) {
        checkIndex(index);
        double[] p = points.get(index);
        if (p[0] == x && p[1] == y) return;
        p[0] = x;
        p[1] = y;
        fireChanged();
    }

    public void remove(int index) {
        checkIndex(index);
        points.remove(index);
        fireChanged();
    }

    public void clear() {
        if (points.isEmpty()) return;
        points.clear();
        fireChanged();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= points.size()) {
            throw new IllegalArgumentException("No selection point " + index + " (size " + points.size() + ")");
        }
    }

    private void fireChanged() {
        for (Listener l : new ArrayList<>(listeners)) l.selectionChanged(this);
    }
}
