package io.lapse4j.jobs;

import io.lapse4j.JobBody;
import io.lapse4j.JobFactory;
import io.lapse4j.core.JobKind;
import io.lapse4j.core.SubjectKind;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.ImageFetcher;
import io.lapse4j.spi.ImageWriter;

import java.time.Clock;
import java.util.Objects;

public class CaptureJobFactory implements JobFactory<CaptureSettings> {

    private final ImageFetcher fetcher;
    private final ImageWriter writer;
    private final HistoryStore history;
    private final Clock clock;

    public CaptureJobFactory(ImageFetcher fetcher, ImageWriter writer, HistoryStore history, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public SubjectKind subjectKind() {
        return SubjectKind.CAMERA;
    }

    @Override
    public JobKind jobKind() {
        return JobKind.CAPTURE;
    }

    @Override
    public Class<CaptureSettings> settingsClass() {
        return CaptureSettings.class;
    }

    @Override
    public JobBody create(String subjectId, CaptureSettings settings) {
        return new CaptureJob(subjectId, settings, fetcher, writer, history, clock);
    }
}
