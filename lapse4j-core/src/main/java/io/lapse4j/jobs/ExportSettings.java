package io.lapse4j.jobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.lapse4j.filter.DateSpan;
import io.lapse4j.filter.FilterMode;
import io.lapse4j.filter.TimeFilterSpec;
import io.lapse4j.spi.ImageWriter;
import io.lapse4j.spi.VideoEncoder;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Settings of an export subject: which frames of a collection to keep, how to write them and whether
 * to render a video afterwards.
 *
 * <p>{@code mode} is "nearest" (default, within {@code searchWindowMinutes}) or "exact".
 * {@code dateFrom}/{@code dateTo} are ISO dates; either may be omitted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportSettings(
        String name,
        String collection,
        String outputDir,
        String dateFrom,
        String dateTo,
        String hour,
        String minute,
        String mode,
        Integer searchWindowMinutes,
        String prefix,
        Integer zeroPadding,
        String ext,
        boolean resize,
        Integer resolutionWidth,
        Integer resolutionHeight,
        Integer quality,
        boolean optimize,
        boolean drawTimestamp,
        String timestampFormat,
        boolean createVideo,
        Integer videoFps,
        String videoCodec,
        String videoOutput
) {

    public ExportSettings {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be empty");
        }
        if (outputDir == null || outputDir.isBlank()) {
            throw new IllegalArgumentException("outputDir must not be empty");
        }
        hour = (hour == null || hour.isBlank()) ? "*" : hour;
        minute = (minute == null || minute.isBlank()) ? "*" : minute;
        mode = (mode == null || mode.isBlank()) ? "nearest" : mode.trim().toLowerCase(Locale.ROOT);
        searchWindowMinutes = searchWindowMinutes == null ? 5 : searchWindowMinutes;
        prefix = prefix == null ? "" : prefix;
        zeroPadding = zeroPadding == null ? 5 : zeroPadding;
        ext = (ext == null || ext.isBlank()) ? "jpg" : ext;
        resolutionWidth = resolutionWidth == null ? 1920 : resolutionWidth;
        resolutionHeight = resolutionHeight == null ? 1080 : resolutionHeight;
        quality = quality == null ? 50 : quality;
        timestampFormat = (timestampFormat == null || timestampFormat.isBlank()) ? "yyyy-MM-dd hh:mm:ss a" : timestampFormat;
        videoFps = videoFps == null ? 24 : videoFps;
        videoCodec = (videoCodec == null || videoCodec.isBlank()) ? "libx264" : videoCodec;

        if (zeroPadding < 0) {
            throw new IllegalArgumentException("zeroPadding must not be negative");
        }
        if (videoFps < 1) {
            throw new IllegalArgumentException("videoFps must be at least 1");
        }
        // fail on load, not on the first run
        filterSpec(dateFrom, dateTo, hour, minute, mode, searchWindowMinutes);
    }

    public static ExportSettings of(String collection, String outputDir) {
        return new ExportSettings(null, collection, outputDir, null, null, null, null, null, null, null, null, null,
                false, null, null, null, false, false, null, false, null, null, null);
    }

    public TimeFilterSpec filterSpec() {
        return filterSpec(dateFrom, dateTo, hour, minute, mode, searchWindowMinutes);
    }

    public ImageWriter.WriteOptions writeOptions() {
        return new ImageWriter.WriteOptions(resize, resolutionWidth, resolutionHeight, quality, optimize,
                drawTimestamp ? timestampFormat : null);
    }

    public VideoEncoder.VideoOptions videoOptions() {
        Path output = (videoOutput == null || videoOutput.isBlank())
                ? Path.of(stripTrailingSeparator(outputDir) + ".mp4")
                : Path.of(videoOutput);
        return new VideoEncoder.VideoOptions(output, videoFps, "*." + ext, videoCodec);
    }

    public String displayName(String subjectId) {
        return (name == null || name.isBlank()) ? subjectId : name;
    }

    private static TimeFilterSpec filterSpec(String dateFrom, String dateTo, String hour, String minute,
                                             String mode, int searchWindowMinutes) {
        TimeFilterSpec.Builder builder = TimeFilterSpec.builder()
                .span(span(dateFrom, dateTo))
                .hours(hour)
                .minutes(minute);
        switch (mode) {
            case "exact" -> builder.mode(FilterMode.EXACT);
            case "nearest" -> builder.nearest(Duration.ofMinutes(searchWindowMinutes));
            default -> throw new IllegalArgumentException("mode must be exact or nearest: " + mode);
        }
        return builder.build();
    }

    private static DateSpan span(String dateFrom, String dateTo) {
        LocalDate from = date(dateFrom, "dateFrom");
        LocalDate to = date(dateTo, "dateTo");
        if (from == null && to == null) {
            return DateSpan.all();
        }
        return DateSpan.between(from, to);
    }

    private static LocalDate date(String text, String name) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be an ISO date (yyyy-MM-dd): " + text, e);
        }
    }

    private static String stripTrailingSeparator(String dir) {
        String s = dir;
        while (s.length() > 1 && (s.endsWith("/") || s.endsWith("\\"))) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
