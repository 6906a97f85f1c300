/*
 * Copyright (c) 2025 Waffle2e Computer Project
 *
 * Permission is hereby granted, free of charge, to any person obtaining
 * a copy of this software and associated documentation files (the
 * "Software"), to deal in the Software without restriction, including
 * without limitation the rights to use, copy, modify, merge, publish,
 * distribute, sublicense, and/or sell copies of the Software, and to
 * permit persons to whom the Software is furnished to do so, subject to
 * the following conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 */

package com.loomcom.logsim.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of monitored levels, one row per completed cycle.
 *
 * Rows are indexed from 0 and columns follow the monitor declaration order.
 * Only whole rows are ever appended, so another thread may read completed
 * cycles while a run is in progress.
 */
public class MonitorTrace {

    private static final char HIGH = '-';
    private static final char LOW = '_';

    private final List<String> labels;
    private final List<boolean[]> rows = new ArrayList<>();

    public MonitorTrace(List<String> labels) {
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    synchronized void append(boolean[] row) {
        if (row.length != labels.size()) {
            throw new IllegalArgumentException("Expected " + labels.size() + " samples, got " + row.length);
        }
        rows.add(row.clone());
    }

    synchronized void clear() {
        rows.clear();
    }

    public synchronized int getCycleCount() {
        return rows.size();
    }

    /**
     * Monitor labels, {@code DEV} or {@code DEV.PIN}, in declaration order.
     */
    public List<String> getMonitorLabels() {
        return labels;
    }

    public synchronized boolean getValue(String label, int cycle) {
        return row(cycle)[column(label)];
    }

    /**
     * Every sample of one monitor, oldest first.
     */
    public synchronized boolean[] getSamples(String label) {
        int column = column(label);
        boolean[] samples = new boolean[rows.size()];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = rows.get(i)[column];
        }
        return samples;
    }

    public synchronized boolean[] getRow(int cycle) {
        return row(cycle).clone();
    }

    /**
     * One line per monitor, {@code -} for a high sample and {@code _} for a
     * low one, with labels padded to a common width.
     */
    public synchronized String formatWaveforms() {
        int width = 0;
        for (String label : labels) {
            width = Math.max(width, label.length());
        }
        StringBuilder sb = new StringBuilder();
        for (int column = 0; column < labels.size(); column++) {
            String label = labels.get(column);
            sb.append(label);
            for (int i = label.length(); i <= width; i++) {
                sb.append(' ');
            }
            for (boolean[] row : rows) {
                sb.append(row[column] ? HIGH : LOW);
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    private boolean[] row(int cycle) {
        if (cycle < 0 || cycle >= rows.size()) {
            throw new IndexOutOfBoundsException("Cycle " + cycle + " not recorded; " + rows.size() + " cycle(s) completed");
        }
        return rows.get(cycle);
    }

    private int column(String label) {
        int column = labels.indexOf(label);
        if (column < 0) {
            throw new IllegalArgumentException("No monitor named " + label);
        }
        return column;
    }

    @Override
    public synchronized String toString() {
        return "MonitorTrace[" + labels + ", " + rows.size() + " cycle(s)]";
    }
}
