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

package com.loomcom.logsim.devices;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AND, OR, NAND or NOR gate with a configurable number of inputs named
 * {@code I1..In}.
 */
public class Gate extends CombinationalDevice {

    public static final String INPUT_PREFIX = "I";

    private final int arity;
    private final List<String> inputPins;

    public Gate(String name, DeviceKind kind, int arity) {
        super(name, kind);
        if (!kind.hasVariableArity()) {
            throw new IllegalArgumentException(kind + " is not a variable-arity gate");
        }
        if (arity < 1) {
            throw new IllegalArgumentException("Gate needs at least one input, got " + arity);
        }
        this.arity = arity;
        this.inputPins = Collections.unmodifiableList(inputNames(arity));
    }

    static List<String> inputNames(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            names.add(INPUT_PREFIX + i);
        }
        return names;
    }

    /**
     * Number encoded in a gate input pin name.
     *
     * @return n for {@code In} with n &gt;= 1, otherwise -1
     */
    public static int inputNumber(String pin) {
        if (pin == null || pin.length() < 2 || !pin.startsWith(INPUT_PREFIX)) {
            return -1;
        }
        String digits = pin.substring(INPUT_PREFIX.length());
        if (digits.charAt(0) == '0') {
            return -1;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // more digits than any arity could need
            return Integer.MAX_VALUE;
        }
    }

    public int getArity() {
        return arity;
    }

    @Override
    public Integer getQualifier() {
        return arity;
    }

    @Override
    public List<String> getInputPins() {
        return inputPins;
    }

    @Override
    public boolean evaluate(boolean[] inputs) {
        boolean result;
        switch (getKind()) {
            case AND:
            case NAND:
                result = true;
                for (boolean in : inputs) {
                    result &= in;
                }
                return getKind() == DeviceKind.AND ? result : !result;
            case OR:
            case NOR:
                result = false;
                for (boolean in : inputs) {
                    result |= in;
                }
                return getKind() == DeviceKind.OR ? result : !result;
            default:
                throw new IllegalStateException("Unexpected gate kind " + getKind());
        }
    }
}
