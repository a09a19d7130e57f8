package io.recur4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobHandler;
import io.recur4j.JobService;
import io.recur4j.core.JobHandlerRegistry;
import io.recur4j.core.JobType;
import io.recur4j.engine.SchedulerEngine;
import io.recur4j.internal.mongo.MongoJobRepository;
import io.recur4j.store.InMemoryJobRepository;
import io.recur4j.store.JobRepository;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class Recur4jAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(Recur4jAutoConfiguration.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "recur4j.worker-id=test-worker",
                    "recur4j.shutdown-timeout=1s"
            );

    @Test
    void shouldAutoConfigureSchedulerBeansOnMongo() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(JobService.class);
                    assertThat(context).hasSingleBean(SchedulerEngine.class);
                    assertThat(context).hasSingleBean(SchedulerLifecycle.class);
                    assertThat(context).hasSingleBean(Recur4jProperties.class);
                    assertThat(context).hasSingleBean(Recur4jMongoIndexConfig.class);
                    assertThat(context.getBean(JobRepository.class)).isInstanceOf(MongoJobRepository.class);
                    assertThat(context.getBean(SchedulerEngine.class).isStarted()).isTrue();
                });
    }

    @Test
    void shouldFallBackToInMemoryRepositoryWithoutMongo() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(JobService.class);
            assertThat(context).doesNotHaveBean(Recur4jMongoIndexConfig.class);
            assertThat(context.getBean(JobRepository.class)).isInstanceOf(InMemoryJobRepository.class);
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "recur4j.max-concurrency=4",
                        "recur4j.timezone=Asia/Taipei",
                        "recur4j.max-page-size=50",
                        "recur4j.restore-on-startup=false"
                )
                .run(context -> {
                    Recur4jProperties props = context.getBean(Recur4jProperties.class);
                    assertThat(props.getMaxConcurrency()).isEqualTo(4);
                    assertThat(props.getTimezone()).isEqualTo("Asia/Taipei");
                    assertThat(props.getMaxPageSize()).isEqualTo(50);
                    assertThat(props.isRestoreOnStartup()).isFalse();
                    assertThat(props.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(1));
                    assertThat(props.getWorkerId()).isEqualTo("test-worker");
                });
    }

    @Test
    void applicationHandlerShouldReplaceBuiltInOfSameType() {
        contextRunner
                .withBean(JobHandler.class, DemoBackupHandler::new)
                .run(context -> {
                    JobHandlerRegistry registry = context.getBean(JobHandlerRegistry.class);
                    assertThat(registry.resolve(JobType.BACKUP_TASK)).isInstanceOf(DemoBackupHandler.class);
                    assertThat(registry.resolve(JobType.REPORT_GENERATION).type()).isEqualTo(JobType.REPORT_GENERATION);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("recur4j.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JobService.class);
                    assertThat(context).doesNotHaveBean(SchedulerEngine.class);
                });
    }

    @Test
    void shouldNotReplaceUserRepository() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withBean(JobRepository.class, InMemoryJobRepository::new)
                .run(context -> assertThat(context.getBean(JobRepository.class)).isInstanceOf(InMemoryJobRepository.class));
    }

    static class DemoBackupHandler implements JobHandler<Map<String, Object>> {
        @Override
        public JobType type() {
            return JobType.BACKUP_TASK;
        }

        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> payloadClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public String execute(Map<String, Object> payload) {
            return "demo backup";
        }
    }
}
