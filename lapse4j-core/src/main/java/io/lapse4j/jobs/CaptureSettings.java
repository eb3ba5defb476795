package io.lapse4j.jobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.lapse4j.spi.ImageWriter;

import java.time.format.DateTimeFormatter;

/**
 * Settings of a camera subject.
 *
 * filenameFormat : {@link DateTimeFormatter} pattern of the capture time in the file name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaptureSettings(
        String source,
        String outputDir,
        String prefix,
        String ext,
        String filenameFormat,
        Integer quality,
        boolean resize,
        Integer resizeWidth,
        Integer resizeHeight
) {

    public static final String DEFAULT_FILENAME_FORMAT = "yyyy-MM-dd_HH-mm-ss";

    public CaptureSettings {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be empty");
        }
        if (outputDir == null || outputDir.isBlank()) {
            throw new IllegalArgumentException("outputDir must not be empty");
        }
        if (quality != null && (quality < 1 || quality > 100)) {
            throw new IllegalArgumentException("quality must be within 1-100");
        }
        prefix = prefix == null ? "" : prefix;
        ext = (ext == null || ext.isBlank()) ? "jpg" : ext;
        filenameFormat = (filenameFormat == null || filenameFormat.isBlank()) ? DEFAULT_FILENAME_FORMAT : filenameFormat;
        resizeWidth = resizeWidth == null ? 1920 : resizeWidth;
        resizeHeight = resizeHeight == null ? 1080 : resizeHeight;
        DateTimeFormatter.ofPattern(filenameFormat);
    }

    public static CaptureSettings of(String source, String outputDir) {
        return new CaptureSettings(source, outputDir, null, null, null, null, false, null, null);
    }

    public ImageWriter.WriteOptions writeOptions() {
        return new ImageWriter.WriteOptions(resize, resizeWidth, resizeHeight, quality, false, null);
    }
}
