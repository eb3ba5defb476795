package io.lapse4j.spi;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Append-only record of what jobs produced. Each method returns the id of the stored record.
 */
public interface HistoryStore {

    record CaptureRecord(String subjectId, Instant time, boolean success, Path file, String error) {
    }

    record ExportRecord(String name, String collection, Path outputDir, String hour, String minute, int imageCount) {
    }

    record VideoRecord(String name, Path inputDir, Path outputPath, int fps, String codec, long fileSize) {
    }

    String recordCapture(CaptureRecord record);

    String recordExport(ExportRecord record);

    String recordVideo(VideoRecord record);
}
