package com.scipatom.atomizer.output;

import java.nio.file.Path;

/**
 * Writes the run summary JSON next to (or apart from) the atoms file.
 */
public class RunSummaryWriter {

    public void write(RunSummary summary, Path output) {
        AtomSerializer.writeJson(summary, output);
        System.err.println("[atomizer] summary written: " + output);
    }
}
