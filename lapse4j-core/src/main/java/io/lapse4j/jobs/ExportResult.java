package io.lapse4j.jobs;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.file.Path;

/**
 * Outcome of an export. The video fields are only set when a render was requested; a failed render
 * leaves {@code videoCreated} false and its message in {@code videoError}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportResult(
        int imageCount,
        Path outputDir,
        String exportId,
        Boolean videoCreated,
        Path videoPath,
        String videoId,
        Long videoSize,
        String videoError
) {

    static ExportResult withoutVideo(int imageCount, Path outputDir, String exportId) {
        return new ExportResult(imageCount, outputDir, exportId, null, null, null, null, null);
    }

    ExportResult withVideo(RenderJob.RenderResult render) {
        return new ExportResult(imageCount, outputDir, exportId, true, render.videoPath(), render.videoId(),
                render.fileSize(), null);
    }

    ExportResult withVideoError(String error) {
        return new ExportResult(imageCount, outputDir, exportId, false, null, null, null, error);
    }
}
