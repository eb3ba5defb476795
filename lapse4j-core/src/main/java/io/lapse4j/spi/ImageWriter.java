package io.lapse4j.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes, optionally resizes, and re-encodes images.
 */
public interface ImageWriter {

    /**
     * Encoding options.
     * <ul>
     *   <li>resize: scale to width x height before encoding</li>
     *   <li>quality: encoder quality 1-100; null means the writer's default</li>
     *   <li>timestampFormat: when set, the capture time is drawn on the frame with this pattern</li>
     * </ul>
     */
    record WriteOptions(boolean resize, int width, int height, Integer quality, boolean optimize, String timestampFormat) {
        public static WriteOptions defaults() {
            return new WriteOptions(false, 1920, 1080, null, false, null);
        }
    }

    void write(byte[] image, Path target, WriteOptions options) throws IOException;

    void write(Path source, Path target, WriteOptions options) throws IOException;

    /**
     * Create {@code directory} if needed and remove earlier frames with extension {@code ext}.
     */
    void prepareDirectory(Path directory, String ext) throws IOException;
}
