package com.luxgrid.core.raster;

import java.nio.file.Path;

/**
 * Decodes a rendered picture into per-pixel brightness. Implementations are
 * stateless and safe to share between worker threads.
 */
public interface RasterDecoder {

    /**
     * @throws ArtifactParseException if the artifact is unreadable or malformed
     */
    Raster decode(Path artifact);
}
