package io.lapse4j.jobs;

import io.lapse4j.JobBody;
import io.lapse4j.TaskContext;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.ImageFetcher;
import io.lapse4j.spi.ImageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Fetches one image from a camera and stores it under a timestamped name. Every attempt, successful
 * or not, is recorded in the history.
 */
public class CaptureJob implements JobBody {
    private static final Logger log = LoggerFactory.getLogger(CaptureJob.class);

    private final String subjectId;
    private final CaptureSettings settings;
    private final ImageFetcher fetcher;
    private final ImageWriter writer;
    private final HistoryStore history;
    private final Clock clock;

    public CaptureJob(String subjectId, CaptureSettings settings, ImageFetcher fetcher, ImageWriter writer,
                      HistoryStore history, Clock clock) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Path run(TaskContext context) throws Exception {
        Instant at = Instant.now(clock);
        try {
            context.message("Fetching image...");
            byte[] image = fetcher.fetch(settings.source());

            Path target = target(LocalDateTime.ofInstant(at, clock.getZone()));
            writer.write(image, target, settings.writeOptions());

            context.report(1, 1, "Saved " + target);
            history.recordCapture(new HistoryStore.CaptureRecord(subjectId, at, true, target, null));
            log.info("lapse capture saved subject={} file={}", subjectId, target);
            return target;
        } catch (Exception e) {
            history.recordCapture(new HistoryStore.CaptureRecord(subjectId, at, false, null, e.toString()));
            throw e;
        }
    }

    Path target(LocalDateTime capturedAt) {
        String stamp = DateTimeFormatter.ofPattern(settings.filenameFormat()).format(capturedAt);
        return Path.of(settings.outputDir()).resolve(settings.prefix() + stamp + "." + settings.ext());
    }
}
