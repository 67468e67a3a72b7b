package com.luxgrid.core.raster;

import com.luxgrid.core.LuxgridException;

import java.nio.file.Path;

/**
 * Thrown when a raster header, raster body or region file is malformed.
 * Callers skip the offending artifact with a warning.
 */
public class ArtifactParseException extends LuxgridException {

    private final Path artifact;

    public ArtifactParseException(Path artifact, String message) {
        super(artifact.getFileName() + ": " + message);
        this.artifact = artifact;
    }

    public ArtifactParseException(Path artifact, String message, Throwable cause) {
        super(artifact.getFileName() + ": " + message, cause);
        this.artifact = artifact;
    }

    public Path getArtifact() {
        return artifact;
    }
}
