package io.lapse4j.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lapse4j.TaskContext;
import io.lapse4j.core.TaskCancelledException;
import io.lapse4j.filter.TimedItem;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.ImageCatalog;
import io.lapse4j.spi.ImageWriter;
import io.lapse4j.spi.VideoEncoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExportJobTest {

    private static final Path OUT = Path.of("/exports/night");

    @Mock
    private ImageCatalog catalog;
    @Mock
    private ImageWriter writer;
    @Mock
    private VideoEncoder encoder;
    @Mock
    private HistoryStore history;

    private static TimedItem<Path> image(String name, String at) {
        return TimedItem.of(LocalDateTime.parse(at), Path.of("/images/front", name));
    }

    private static Map<String, Object> settings(Object... extra) {
        Map<String, Object> map = new HashMap<>();
        map.put("name", "Night");
        map.put("collection", "front");
        map.put("outputDir", OUT.toString());
        map.put("hour", "8-9");
        map.put("minute", "0");
        for (int i = 0; i < extra.length; i += 2) {
            map.put((String) extra[i], extra[i + 1]);
        }
        return map;
    }

    private ExportJob job(Map<String, Object> settings) {
        ExportSettings parsed = new ObjectMapper().convertValue(settings, ExportSettings.class);
        return new ExportJob("night", parsed, catalog, writer, encoder, history);
    }

    private void givenImages() throws IOException {
        when(catalog.list("front")).thenReturn(List.of(
                image("c.jpg", "2026-01-01T09:02:00"),
                image("a.jpg", "2026-01-01T07:58:00"),
                image("b.jpg", "2026-01-01T08:31:00")
        ));
    }

    @Test
    void exportShouldWriteNearestFramesInOrder() throws Exception {
        givenImages();
        when(history.recordExport(any())).thenReturn("exp-1");
        RecordingContext ctx = new RecordingContext();

        ExportResult result = job(settings()).run(ctx);

        verify(writer).prepareDirectory(OUT, "jpg");
        verify(writer).write(eq(Path.of("/images/front/a.jpg")), eq(OUT.resolve("00000.jpg")), any());
        verify(writer).write(eq(Path.of("/images/front/c.jpg")), eq(OUT.resolve("00001.jpg")), any());
        verify(history).recordExport(new HistoryStore.ExportRecord("Night", "front", OUT, "8-9", "0", 2));

        assertThat(result.imageCount()).isEqualTo(2);
        assertThat(result.exportId()).isEqualTo("exp-1");
        assertThat(result.videoCreated()).isNull();
        assertThat(ctx.current).isEqualTo(2);
        assertThat(ctx.total).isEqualTo(2);
        assertThat(ctx.messages).containsSubsequence(
                "Loading image set...",
                "Filtering images by schedule...",
                "Writing 2 images...",
                "Writing image 2 of 2");
    }

    @Test
    void exactModeShouldSkipFramesOffTheMinute() throws Exception {
        givenImages();

        ExportResult result = job(settings("mode", "exact")).run(new RecordingContext());

        assertThat(result.imageCount()).isZero();
        verify(writer, never()).prepareDirectory(any(), any());
        verify(history).recordExport(new HistoryStore.ExportRecord("Night", "front", OUT, "8-9", "0", 0));
    }

    @Test
    void cancellationShouldStopBetweenFramesAndKeepWrittenOnes() throws Exception {
        givenImages();
        RecordingContext ctx = new RecordingContext(1);

        ExportJob export = job(settings());

        assertThatThrownBy(() -> export.run(ctx)).isInstanceOf(TaskCancelledException.class);
        verify(writer, times(1)).write(any(Path.class), any(), any());
        verify(history, never()).recordExport(any());
    }

    @Test
    void dateRangeShouldLimitFrames() throws Exception {
        when(catalog.list("front")).thenReturn(List.of(
                image("d1.jpg", "2026-01-01T08:00:00"),
                image("d2.jpg", "2026-01-02T08:00:00"),
                image("d3.jpg", "2026-01-03T08:00:00")
        ));
        RecordingContext ctx = new RecordingContext();

        ExportResult result = job(settings("dateFrom", "2026-01-02")).run(ctx);

        assertThat(result.imageCount()).isEqualTo(2);
        assertThat(ctx.messages).contains("Date range 2026-01-02 to end: 2 images");
    }

    @Test
    void videoShouldBeRenderedAfterExport() throws Exception {
        givenImages();
        Path video = Path.of("/exports/night.mp4");
        when(encoder.encode(eq(OUT), any(), any(TaskContext.class))).thenReturn(video);
        when(history.recordVideo(any())).thenReturn("vid-1");

        ExportResult result = job(settings("createVideo", true, "videoFps", 30)).run(new RecordingContext());

        ArgumentCaptor<VideoEncoder.VideoOptions> options = ArgumentCaptor.forClass(VideoEncoder.VideoOptions.class);
        verify(encoder).encode(eq(OUT), options.capture(), any(TaskContext.class));
        assertThat(options.getValue().output()).isEqualTo(video);
        assertThat(options.getValue().fps()).isEqualTo(30);
        assertThat(options.getValue().pattern()).isEqualTo("*.jpg");

        assertThat(result.videoCreated()).isTrue();
        assertThat(result.videoPath()).isEqualTo(video);
        assertThat(result.videoId()).isEqualTo("vid-1");
        assertThat(result.videoSize()).isZero();
    }

    @Test
    void videoFailureShouldNotFailExport() throws Exception {
        givenImages();
        when(history.recordExport(any())).thenReturn("exp-1");
        when(encoder.encode(any(), any(), any(TaskContext.class))).thenThrow(new IOException("ffmpeg not found"));

        ExportResult result = job(settings("createVideo", true)).run(new RecordingContext());

        assertThat(result.imageCount()).isEqualTo(2);
        assertThat(result.exportId()).isEqualTo("exp-1");
        assertThat(result.videoCreated()).isFalse();
        assertThat(result.videoError()).contains("ffmpeg not found");
        verify(history, never()).recordVideo(any());
    }

    @Test
    void frameNamesShouldUsePrefixAndPadding() {
        ExportJob export = job(settings("prefix", "night_", "zeroPadding", 3, "ext", "png"));

        assertThat(export.frameName(7)).isEqualTo("night_007.png");
        assertThat(job(settings("zeroPadding", 0)).frameName(12)).isEqualTo("12.jpg");
    }

    @Test
    void invalidSettingsShouldBeRejectedOnConversion() {
        ObjectMapper om = new ObjectMapper();

        assertThatThrownBy(() -> om.convertValue(settings("mode", "closest"), ExportSettings.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> om.convertValue(settings("dateFrom", "2026-02-01", "dateTo", "2026-01-01"), ExportSettings.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> om.convertValue(settings("hour", "8-30"), ExportSettings.class))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
