package io.lapse4j.jobs;

import io.lapse4j.JobBody;
import io.lapse4j.TaskContext;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.VideoEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Encodes a directory of frames into a video and records it in the history.
 */
public class RenderJob implements JobBody {
    private static final Logger log = LoggerFactory.getLogger(RenderJob.class);

    public record RenderResult(Path videoPath, long fileSize, String videoId) {
    }

    private final String name;
    private final Path framesDir;
    private final VideoEncoder.VideoOptions options;
    private final VideoEncoder encoder;
    private final HistoryStore history;

    public RenderJob(String name, Path framesDir, VideoEncoder.VideoOptions options, VideoEncoder encoder,
                     HistoryStore history) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.framesDir = Objects.requireNonNull(framesDir, "framesDir must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    @Override
    public RenderResult run(TaskContext context) throws IOException {
        context.message("Rendering video...");
        Path video = encoder.encode(framesDir, options, context);
        context.throwIfCancelled();

        long size = fileSize(video);
        String videoId = history.recordVideo(new HistoryStore.VideoRecord(
                name, framesDir, video, options.fps(), options.codec(), size));
        context.message("Video saved " + video);
        log.info("lapse render finished name={} video={} size={}", name, video, size);
        return new RenderResult(video, size, videoId);
    }

    private static long fileSize(Path video) {
        try {
            return Files.size(video);
        } catch (IOException e) {
            log.warn("lapse render could not read video size video={} msg={}", video, e.getMessage());
            return 0;
        }
    }
}
