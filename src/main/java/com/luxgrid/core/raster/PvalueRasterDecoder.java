package com.luxgrid.core.raster;

import com.luxgrid.core.engine.ToolResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.List;

/**
 * Decodes pictures by running {@code pvalue -h -H -b -df}, which writes one
 * native-order float32 brightness value per pixel with no header. Dimensions
 * come from the picture's own header.
 */
public class PvalueRasterDecoder implements RasterDecoder {

    private static final Logger log = LoggerFactory.getLogger(PvalueRasterDecoder.class);

    private final ToolResolver tools;
    private final long maxPixels;

    public PvalueRasterDecoder(ToolResolver tools) {
        this(tools, RasterHeaderReader.DEFAULT_MAX_PIXELS);
    }

    public PvalueRasterDecoder(ToolResolver tools, long maxPixels) {
        this.tools = tools;
        this.maxPixels = maxPixels;
    }

    @Override
    public Raster decode(Path artifact) {
        RasterHeader header = RasterHeaderReader.read(artifact);
        RasterHeaderReader.requireWithin(header, maxPixels);
        int count = header.width() * header.height();
        var command = List.of(tools.executable("pvalue"), "-h", "-H", "-b", "-df", artifact.toString());
        log.debug("Running: {}", String.join(" ", command));

        Process process = null;
        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            float[] samples;
            try (InputStream in = new BufferedInputStream(process.getInputStream(), 1 << 16)) {
                samples = readFloats(in, count);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new ArtifactParseException(artifact, "pvalue exited with code " + exitCode);
            }
            return new Raster(Raster.idOf(artifact), artifact, header.width(), header.height(), samples);
        } catch (EOFException e) {
            throw new ArtifactParseException(artifact, "pvalue returned fewer than " + count + " samples", e);
        } catch (IOException e) {
            throw new ArtifactParseException(artifact, "pvalue failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArtifactParseException(artifact, "interrupted while decoding", e);
        } finally {
            if (process != null && process.isAlive()) {
                log.debug("Stopping pvalue for {}", artifact.getFileName());
                process.destroyForcibly();
            }
        }
    }

    private static float[] readFloats(InputStream in, int count) throws IOException {
        var data = new DataInputStream(in);
        var bytes = new byte[4 * 4096];
        var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.nativeOrder());
        float[] samples = new float[count];
        int read = 0;
        while (read < count) {
            int batch = Math.min(4096, count - read);
            data.readFully(bytes, 0, batch * 4);
            buffer.clear();
            for (int i = 0; i < batch; i++) {
                samples[read++] = buffer.getFloat();
            }
        }
        return samples;
    }
}
