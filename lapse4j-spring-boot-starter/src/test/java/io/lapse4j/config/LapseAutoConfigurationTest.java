package io.lapse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lapse4j.Scheduler;
import io.lapse4j.TaskManager;
import io.lapse4j.core.JobFactoryRegistry;
import io.lapse4j.core.SchedulerConfig;
import io.lapse4j.core.SubjectKind;
import io.lapse4j.internal.InMemoryTaskManager;
import io.lapse4j.internal.TickingScheduler;
import io.lapse4j.jobs.CaptureJobFactory;
import io.lapse4j.jobs.ExportJobFactory;
import io.lapse4j.spi.HistoryStore;
import io.lapse4j.spi.ImageCatalog;
import io.lapse4j.spi.ImageFetcher;
import io.lapse4j.spi.ImageWriter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class LapseAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LapseAutoConfiguration.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "lapse.enabled=true",
                    "lapse.tick-interval=500ms",
                    "lapse.worker-threads=2",
                    "lapse.zone=Asia/Taipei"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TaskManager.class);
            assertThat(context).hasSingleBean(Scheduler.class);
            assertThat(context).hasSingleBean(JobFactoryRegistry.class);
            assertThat(context).hasSingleBean(SchedulerConfigReader.class);
            assertThat(context).hasSingleBean(SchedulerLifecycle.class);
            assertThat(context).hasSingleBean(LapseProperties.class);
            assertThat(context.getBean(TaskManager.class)).isInstanceOf(InMemoryTaskManager.class);
            assertThat(context.getBean(Scheduler.class)).isInstanceOf(TickingScheduler.class);
            assertThat(context).doesNotHaveBean(CaptureJobFactory.class);
        });
    }

    @Test
    void propertiesShouldBindToSettings() {
        contextRunner.run(context -> {
            LapseProperties props = context.getBean(LapseProperties.class);
            assertThat(props.toSchedulerSettings().tickInterval()).isEqualTo(Duration.ofMillis(500));
            assertThat(props.toSchedulerSettings().zone()).isEqualTo(ZoneId.of("Asia/Taipei"));
            assertThat(props.toTaskManagerSettings().workerThreads()).isEqualTo(2);
            assertThat(props.toTaskManagerSettings().retention()).isEqualTo(Duration.ofMinutes(5));
        });
    }

    @Test
    void lifecycleShouldStartTaskManagerAndScheduler() {
        contextRunner.run(context -> {
            assertThat(context.getBean(SchedulerLifecycle.class).isRunning()).isTrue();

            Scheduler scheduler = context.getBean(Scheduler.class);
            scheduler.reload(SchedulerConfig.empty());
            assertThat(scheduler.config().subjects()).isEmpty();
            assertThat(context.getBean(TaskManager.class).listAll()).isEmpty();
        });
    }

    @Test
    void jobFactoriesShouldBeRegisteredWhenCollaboratorsExist() {
        contextRunner
                .withBean(ImageFetcher.class, () -> mock(ImageFetcher.class))
                .withBean(ImageWriter.class, () -> mock(ImageWriter.class))
                .withBean(ImageCatalog.class, () -> mock(ImageCatalog.class))
                .withBean(HistoryStore.class, () -> mock(HistoryStore.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(CaptureJobFactory.class);
                    assertThat(context).hasSingleBean(ExportJobFactory.class);
                    JobFactoryRegistry registry = context.getBean(JobFactoryRegistry.class);
                    assertThat(registry.supports(SubjectKind.CAMERA)).isTrue();
                    assertThat(registry.supports(SubjectKind.EXPORT)).isTrue();
                });
    }

    @Test
    void disabledPropertyShouldSkipAutoConfiguration() {
        contextRunner
                .withPropertyValues("lapse.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Scheduler.class);
                    assertThat(context).doesNotHaveBean(TaskManager.class);
                });
    }
}
