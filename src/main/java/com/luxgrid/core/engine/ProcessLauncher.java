package com.luxgrid.core.engine;

import java.io.IOException;
import java.util.function.DoubleConsumer;

/**
 * Runs one {@link Invocation} to completion on the calling thread.
 */
public interface ProcessLauncher {

    /**
     * @param progress receives completion percentages parsed from the process's stderr
     * @return the process exit code
     * @throws IOException if the process cannot be started or its streams fail
     */
    int launch(Invocation invocation, DoubleConsumer progress) throws IOException, InterruptedException;
}
