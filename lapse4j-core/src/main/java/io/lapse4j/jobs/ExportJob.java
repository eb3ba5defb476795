package io.lapse4j.jobs;

import io.lapse4j.JobBody;
import io.lapse4j.TaskContext;
import io.lapse4j.core.TaskCancelledException;
import io.lapse4j.filter.TimeFilter;
import io.lapse4j.filter.TimeFilterSpec;
import io.lapse4j.filter.TimedItem;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.ImageCatalog;
import io.lapse4j.spi.ImageWriter;
import io.lapse4j.spi.VideoEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Copies the frames of a collection selected by a time filter into a numbered sequence, optionally
 * followed by a video render.
 *
 * <p>Cancellation is checked before every frame; frames already written stay in place.
 */
public class ExportJob implements JobBody {
    private static final Logger log = LoggerFactory.getLogger(ExportJob.class);

    private final String subjectId;
    private final ExportSettings settings;
    private final ImageCatalog catalog;
    private final ImageWriter writer;
    private final VideoEncoder encoder;
    private final HistoryStore history;

    public ExportJob(String subjectId, ExportSettings settings, ImageCatalog catalog, ImageWriter writer,
                     VideoEncoder encoder, HistoryStore history) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.encoder = encoder;
        this.history = Objects.requireNonNull(history, "history must not be null");
        if (settings.createVideo() && encoder == null) {
            throw new IllegalArgumentException("createVideo requires a VideoEncoder");
        }
    }

    @Override
    public ExportResult run(TaskContext context) throws Exception {
        String name = settings.displayName(subjectId);
        Path outputDir = Path.of(settings.outputDir());
        TimeFilterSpec spec = settings.filterSpec();

        context.report(0, 0, "Loading image set...");
        List<TimedItem<Path>> images = catalog.list(settings.collection());
        context.throwIfCancelled();

        if (settings.dateFrom() != null || settings.dateTo() != null) {
            long inRange = images.stream()
                    .filter(i -> spec.span().contains(i.timestamp().toLocalDate()))
                    .count();
            context.message("Date range " + label(settings.dateFrom(), "start") + " to "
                    + label(settings.dateTo(), "end") + ": " + inRange + " images");
        }

        context.message("Filtering images by schedule...");
        List<Path> selected = TimeFilter.select(images, spec);
        int count = selected.size();

        if (count > 0) {
            context.report(0, count, "Writing " + count + " images...");
            writer.prepareDirectory(outputDir, settings.ext());
            ImageWriter.WriteOptions options = settings.writeOptions();
            for (int i = 0; i < count; i++) {
                context.throwIfCancelled();
                writer.write(selected.get(i), outputDir.resolve(frameName(i)), options);
                context.report(i + 1, count, "Writing image " + (i + 1) + " of " + count);
            }
        } else {
            context.message("No images matched the time filter.");
        }

        String exportId = history.recordExport(new HistoryStore.ExportRecord(
                name, settings.collection(), outputDir, settings.hour(), settings.minute(), count));
        log.info("lapse export finished subject={} images={} outputDir={}", subjectId, count, outputDir);

        ExportResult result = ExportResult.withoutVideo(count, outputDir, exportId);
        if (settings.createVideo() && count > 0) {
            context.message("Starting video render...");
            RenderJob render = new RenderJob(name, outputDir, settings.videoOptions(), encoder, history);
            try {
                result = result.withVideo(render.run(context));
            } catch (TaskCancelledException e) {
                throw e;
            } catch (Exception e) {
                log.warn("lapse export video failed subject={} msg={}", subjectId, e.getMessage(), e);
                result = result.withVideoError(e.toString());
            }
        }
        return result;
    }

    String frameName(int index) {
        String number = settings.zeroPadding() > 0
                ? String.format("%0" + settings.zeroPadding() + "d", index)
                : Integer.toString(index);
        return settings.prefix() + number + "." + settings.ext();
    }

    private static String label(String date, String fallback) {
        return (date == null || date.isBlank()) ? fallback : date;
    }
}
