package io.lapse4j.spi;

import io.lapse4j.TaskContext;

import java.io.IOException;
import java.nio.file.Path;

public interface VideoEncoder {

    /**
     * pattern : glob of the frames to encode, e.g. "*.jpg"
     */
    record VideoOptions(Path output, int fps, String pattern, String codec) {
    }

    /**
     * Encode the frames in {@code framesDir} into a video. Implementations should report progress
     * through {@code context} and stop when it is cancelled.
     *
     * @return path of the written video
     */
    Path encode(Path framesDir, VideoOptions options, TaskContext context) throws IOException;
}
