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

/**
 * Receives a notification after every completed simulation cycle.
 *
 * Listeners are called synchronously on the thread running the simulation,
 * after the cycle's row has been appended to the trace.
 */
public interface CycleListener {

    /**
     * @param cycle number of cycles completed so far, starting at 1
     * @param trace the trace, already holding this cycle's row
     */
    void cycleCompleted(int cycle, MonitorTrace trace);
}
