package io.lapse4j.jobs;

import io.lapse4j.JobBody;
import io.lapse4j.JobFactory;
import io.lapse4j.core.JobKind;
import io.lapse4j.core.SubjectKind;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.ImageCatalog;
import io.lapse4j.spi.ImageWriter;
import io.lapse4j.spi.VideoEncoder;

import java.util.Objects;

public class ExportJobFactory implements JobFactory<ExportSettings> {

    private final ImageCatalog catalog;
    private final ImageWriter writer;
    private final VideoEncoder encoder;
    private final HistoryStore history;

    /**
     * @param encoder may be null when no export renders a video
     */
    public ExportJobFactory(ImageCatalog catalog, ImageWriter writer, VideoEncoder encoder, HistoryStore history) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.encoder = encoder;
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    @Override
    public SubjectKind subjectKind() {
        return SubjectKind.EXPORT;
    }

    @Override
    public JobKind jobKind() {
        return JobKind.EXPORT;
    }

    @Override
    public Class<ExportSettings> settingsClass() {
        return ExportSettings.class;
    }

    @Override
    public JobBody create(String subjectId, ExportSettings settings) {
        return new ExportJob(subjectId, settings, catalog, writer, encoder, history);
    }
}
