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

/**
 * The device kinds understood by the definition language, with the rule
 * each applies to its qualifier.
 */
public enum DeviceKind {
    SWITCH(QualifierRule.REQUIRED),   // qual = initial level, 0 or 1
    CLOCK(QualifierRule.REQUIRED),    // qual = half period in cycles
    AND(QualifierRule.REQUIRED),      // qual = number of inputs
    OR(QualifierRule.REQUIRED),
    NAND(QualifierRule.REQUIRED),
    NOR(QualifierRule.REQUIRED),
    XOR(QualifierRule.FORBIDDEN),     // always two inputs
    DTYPE(QualifierRule.FORBIDDEN);

    public enum QualifierRule { REQUIRED, FORBIDDEN }

    public enum QualifierProblem {
        NONE,
        MISSING,
        OUT_OF_RANGE,
        NOT_ALLOWED
    }

    private final QualifierRule qualifierRule;

    DeviceKind(QualifierRule qualifierRule) {
        this.qualifierRule = qualifierRule;
    }

    public QualifierRule getQualifierRule() {
        return qualifierRule;
    }

    /**
     * True for AND, OR, NAND and NOR, whose qualifier is an input count.
     */
    public boolean hasVariableArity() {
        return this == AND || this == OR || this == NAND || this == NOR;
    }

    /**
     * Check a qualifier against this kind's rule.
     *
     * @param qualifier the declared qualifier, or null if absent
     * @param maxInputs largest input count accepted for variable-arity gates
     */
    public QualifierProblem checkQualifier(Integer qualifier, int maxInputs) {
        if (qualifierRule == QualifierRule.FORBIDDEN) {
            return qualifier == null ? QualifierProblem.NONE : QualifierProblem.NOT_ALLOWED;
        }
        if (qualifier == null) {
            return QualifierProblem.MISSING;
        }
        int q = qualifier;
        boolean inRange;
        switch (this) {
            case SWITCH:
                inRange = q == 0 || q == 1;
                break;
            case CLOCK:
                inRange = q > 0;
                break;
            default:
                inRange = q >= 1 && q <= maxInputs;
                break;
        }
        return inRange ? QualifierProblem.NONE : QualifierProblem.OUT_OF_RANGE;
    }

    /**
     * Human readable description of the accepted qualifier values.
     */
    public String describeQualifier(int maxInputs) {
        switch (this) {
            case SWITCH:
                return "0 or 1";
            case CLOCK:
                return "a half period of at least 1 cycle";
            case XOR:
            case DTYPE:
                return "no qualifier";
            default:
                return "an input count from 1 to " + maxInputs;
        }
    }

    /**
     * Exact, case-sensitive lookup.
     *
     * @return the kind, or null if {@code name} is not a device kind
     */
    public static DeviceKind fromName(String name) {
        for (DeviceKind kind : values()) {
            if (kind.name().equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
