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

package com.loomcom.logsim.definition;

import com.loomcom.logsim.diagnostics.SourcePosition;

/**
 * One device entry as written, before any semantic checks.
 * Name and kind are null when the entry omitted them.
 */
public final class DeviceDeclaration {

    private final SourcePosition position;
    private final String name;
    private final SourcePosition namePosition;
    private final String kind;
    private final SourcePosition kindPosition;
    private final Integer qualifier;
    private final SourcePosition qualifierPosition;

    public DeviceDeclaration(SourcePosition position,
                             String name, SourcePosition namePosition,
                             String kind, SourcePosition kindPosition,
                             Integer qualifier, SourcePosition qualifierPosition) {
        this.position = position;
        this.name = name;
        this.namePosition = namePosition;
        this.kind = kind;
        this.kindPosition = kindPosition;
        this.qualifier = qualifier;
        this.qualifierPosition = qualifierPosition;
    }

    /** Position of the opening brace. */
    public SourcePosition getPosition() {
        return position;
    }

    public String getName() {
        return name;
    }

    public SourcePosition getNamePosition() {
        return namePosition != null ? namePosition : position;
    }

    public String getKind() {
        return kind;
    }

    public SourcePosition getKindPosition() {
        return kindPosition != null ? kindPosition : position;
    }

    public Integer getQualifier() {
        return qualifier;
    }

    public boolean hasQualifier() {
        return qualifier != null;
    }

    public SourcePosition getQualifierPosition() {
        return qualifierPosition != null ? qualifierPosition : getKindPosition();
    }

    @Override
    public String toString() {
        return "{id: " + name + "; kind: " + kind + (qualifier != null ? "; qual: " + qualifier : "") + "}";
    }
}
