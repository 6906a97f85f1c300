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

package com.loomcom.logsim.network;

import com.loomcom.logsim.SimulatorConfig;
import com.loomcom.logsim.definition.ParseResult;
import com.loomcom.logsim.definition.Parser;
import com.loomcom.logsim.diagnostics.Diagnostic;
import com.loomcom.logsim.exceptions.CircuitDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a definition, parses it and builds the circuit in one step.
 */
public class CircuitLoader {

    private final static Logger logger = LoggerFactory.getLogger(CircuitLoader.class.getName());

    private final SimulatorConfig config;

    public CircuitLoader() {
        this(SimulatorConfig.load());
    }

    public CircuitLoader(SimulatorConfig config) {
        this.config = config;
    }

    public LoadResult load(String definition) {
        ParseResult parsed = new Parser(definition).parse();
        LoadResult result = new NetworkBuilder(config).build(parsed, definition);
        if (result.isSuccess()) {
            logger.info("Loaded {}", result.getCircuit());
            for (Diagnostic warning : result.getWarnings()) {
                logger.warn("{}", warning);
            }
        } else {
            logger.info("Definition rejected: {} error(s), {} warning(s)",
                        result.getErrors().size(), result.getWarnings().size());
        }
        return result;
    }

    public LoadResult loadFile(Path file) throws IOException {
        logger.info("Reading circuit definition {}", file);
        return load(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    /**
     * Load a definition and return its circuit.
     *
     * @throws CircuitDefinitionException carrying every diagnostic if any of them is an error
     */
    public Circuit loadOrThrow(String definition) throws CircuitDefinitionException {
        LoadResult result = load(definition);
        if (!result.isSuccess()) {
            throw new CircuitDefinitionException(result.formatDiagnostics(), result.getDiagnostics());
        }
        return result.getCircuit();
    }
}
