package io.lapse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lapse4j.JobFactory;
import io.lapse4j.Scheduler;
import io.lapse4j.TaskManager;
import io.lapse4j.core.JobFactoryRegistry;
import io.lapse4j.internal.InMemoryTaskManager;
import io.lapse4j.internal.TickingScheduler;
import io.lapse4j.jobs.CaptureJobFactory;
import io.lapse4j.jobs.ExportJobFactory;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.ImageCatalog;
import io.lapse4j.spi.ImageFetcher;
import io.lapse4j.spi.ImageWriter;
import io.lapse4j.spi.VideoEncoder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler components.
 *
 * <p>Capture and export factories are registered when the application provides their collaborators;
 * any other {@link JobFactory} bean is picked up as well.
 */
@AutoConfiguration
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties(LapseProperties.class)
@ConditionalOnProperty(prefix = "lapse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LapseAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock lapseClock(LapseProperties props) {
        return Clock.system(props.resolveZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper lapseObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ImageFetcher.class, ImageWriter.class, HistoryStore.class})
    public CaptureJobFactory captureJobFactory(ImageFetcher fetcher, ImageWriter writer, HistoryStore history, Clock clock) {
        return new CaptureJobFactory(fetcher, writer, history, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ImageCatalog.class, ImageWriter.class, HistoryStore.class})
    public ExportJobFactory exportJobFactory(ImageCatalog catalog, ImageWriter writer,
                                             ObjectProvider<VideoEncoder> encoder, HistoryStore history) {
        return new ExportJobFactory(catalog, writer, encoder.getIfAvailable(), history);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobFactoryRegistry jobFactoryRegistry(ObjectProvider<List<JobFactory<?>>> factoriesProvider, ObjectMapper om) {
        List<JobFactory<?>> factories = factoriesProvider.getIfAvailable(List::of);
        return new JobFactoryRegistry(factories, om);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskManager taskManager(LapseProperties props, Clock clock) {
        return new InMemoryTaskManager(props.toTaskManagerSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(LapseProperties props, TaskManager taskManager, JobFactoryRegistry registry, Clock clock) {
        return new TickingScheduler(props.toSchedulerSettings(), taskManager, registry, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerConfigReader schedulerConfigReader(LapseProperties props, ObjectMapper om, Clock clock) {
        return new SchedulerConfigReader(om, props.resolveZone(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(TaskManager taskManager, Scheduler scheduler) {
        return new SchedulerLifecycle(taskManager, scheduler);
    }
}
