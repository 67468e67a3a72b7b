package com.luxgrid.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A single planned external-tool invocation with a declared output artifact.
 * <p>
 * Each phase has its own record type carrying typed fields; the command line
 * is only built at the execution boundary by
 * {@link com.luxgrid.core.engine.InvocationBuilder}.
 */
public interface Job {

    Phase phase();

    /** Artifacts this job reads. */
    List<Path> inputs();

    /** The artifact whose existence marks this job as done. */
    Path output();

    default String id() {
        return phase().label() + ":" + output().getFileName();
    }
}
