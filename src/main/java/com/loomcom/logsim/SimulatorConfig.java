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

package com.loomcom.logsim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Options for loading and simulating circuits.
 *
 * {@link #load()} reads {@code /logsim.properties} from the classpath; JVM
 * system properties with the same keys take precedence.
 */
public final class SimulatorConfig {

    private final static Logger logger = LoggerFactory.getLogger(SimulatorConfig.class.getName());

    public static final String PROPERTIES_FILE = "/logsim.properties";

    public static final String MAX_GATE_INPUTS = "logsim.gate.maxInputs";
    public static final String SETTLE_PASSES_PER_DEVICE = "logsim.settle.passesPerDevice";
    public static final String CLOCK_INITIAL_LEVEL = "logsim.clock.initialLevel";

    private static final int DEFAULT_MAX_GATE_INPUTS = 16;
    private static final int DEFAULT_SETTLE_PASSES_PER_DEVICE = 2;

    private final int maxGateInputs;
    private final int settlePassesPerDevice;
    private final boolean clockInitialLevel;

    private SimulatorConfig(int maxGateInputs, int settlePassesPerDevice, boolean clockInitialLevel) {
        if (maxGateInputs < 1) {
            throw new IllegalArgumentException(MAX_GATE_INPUTS + " must be at least 1, got " + maxGateInputs);
        }
        if (settlePassesPerDevice < 1) {
            throw new IllegalArgumentException(SETTLE_PASSES_PER_DEVICE + " must be at least 1, got "
                                               + settlePassesPerDevice);
        }
        this.maxGateInputs = maxGateInputs;
        this.settlePassesPerDevice = settlePassesPerDevice;
        this.clockInitialLevel = clockInitialLevel;
    }

    /**
     * Built-in values, ignoring any properties file.
     */
    public static SimulatorConfig defaults() {
        return new SimulatorConfig(DEFAULT_MAX_GATE_INPUTS, DEFAULT_SETTLE_PASSES_PER_DEVICE, false);
    }

    public static SimulatorConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SimulatorConfig.class.getResourceAsStream(PROPERTIES_FILE)) {
            if (in != null) {
                properties.load(in);
                logger.debug("Loaded {}", PROPERTIES_FILE);
            } else {
                logger.debug("No {} on the classpath, using defaults", PROPERTIES_FILE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + PROPERTIES_FILE, e);
        }
        for (String key : new String[]{MAX_GATE_INPUTS, SETTLE_PASSES_PER_DEVICE, CLOCK_INITIAL_LEVEL}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    public static SimulatorConfig fromProperties(Properties properties) {
        return new SimulatorConfig(
                intProperty(properties, MAX_GATE_INPUTS, DEFAULT_MAX_GATE_INPUTS),
                intProperty(properties, SETTLE_PASSES_PER_DEVICE, DEFAULT_SETTLE_PASSES_PER_DEVICE),
                levelProperty(properties, CLOCK_INITIAL_LEVEL));
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean levelProperty(Properties properties, String key) {
        String value = properties.getProperty(key, "0").trim();
        switch (value) {
            case "0":
                return false;
            case "1":
                return true;
            default:
                throw new IllegalArgumentException("Property " + key + " must be 0 or 1, got '" + value + "'");
        }
    }

    public SimulatorConfig withMaxGateInputs(int maxGateInputs) {
        return new SimulatorConfig(maxGateInputs, settlePassesPerDevice, clockInitialLevel);
    }

    public SimulatorConfig withSettlePassesPerDevice(int settlePassesPerDevice) {
        return new SimulatorConfig(maxGateInputs, settlePassesPerDevice, clockInitialLevel);
    }

    public SimulatorConfig withClockInitialLevel(boolean clockInitialLevel) {
        return new SimulatorConfig(maxGateInputs, settlePassesPerDevice, clockInitialLevel);
    }

    /**
     * Largest input count accepted for AND, OR, NAND and NOR gates.
     */
    public int getMaxGateInputs() {
        return maxGateInputs;
    }

    public int getSettlePassesPerDevice() {
        return settlePassesPerDevice;
    }

    /**
     * Maximum number of relaxation passes allowed for one settle of a
     * circuit with {@code deviceCount} devices.
     */
    public int settleBound(int deviceCount) {
        return settlePassesPerDevice * Math.max(deviceCount, 1) + 1;
    }

    public boolean getClockInitialLevel() {
        return clockInitialLevel;
    }

    @Override
    public String toString() {
        return "SimulatorConfig[maxGateInputs=" + maxGateInputs + ", settlePassesPerDevice=" + settlePassesPerDevice
               + ", clockInitialLevel=" + (clockInitialLevel ? 1 : 0) + "]";
    }
}
