package io.autopilot4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.autopilot4j.ActionExecutor;
import io.autopilot4j.Autopilot;
import io.autopilot4j.core.ActionExecutorRegistry;
import io.autopilot4j.core.ActionResult;
import io.autopilot4j.core.JobKind;
import io.autopilot4j.internal.mongo.JobDocument;
import io.autopilot4j.internal.mongo.MongoAutopilot;
import io.autopilot4j.session.AutomationSession;
import io.autopilot4j.session.SessionManager;
import io.autopilot4j.spi.JobStore;
import io.autopilot4j.spi.ScheduleStore;
import io.autopilot4j.spi.SettingsStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutopilotAutoConfigurationTest {

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private final IndexOperations indexOps = mock(IndexOperations.class);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AutopilotConfig.class))
            .withBean(MongoTemplate.class, () -> mongoTemplate)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(DemoPostExecutor.class, DemoPostExecutor::new)
            .withPropertyValues(
                    "autopilot.enabled=true",
                    "autopilot.auto-startup=false",
                    "autopilot.worker-id=test-worker",
                    "autopilot.poll-every=500ms",
                    "autopilot.timezone=Europe/Berlin",
                    "autopilot.profiles-dir=target/test-profiles"
            );

    @Test
    void shouldAutoConfigureAutopilotBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Autopilot.class);
            assertThat(context).hasSingleBean(AutopilotLifecycle.class);
            assertThat(context).hasSingleBean(AutopilotProperties.class);
            assertThat(context).hasSingleBean(JobStore.class);
            assertThat(context).hasSingleBean(ScheduleStore.class);
            assertThat(context).hasSingleBean(SettingsStore.class);
            assertThat(context).hasSingleBean(SessionManager.class);
            assertThat(context).doesNotHaveBean("autopilotIndexesInitializer");

            assertThat(context.getBean(Autopilot.class)).isInstanceOf(MongoAutopilot.class);
            assertThat(((MongoAutopilot) context.getBean(Autopilot.class)).zone()).isEqualTo(ZoneId.of("Europe/Berlin"));
            assertThat(context.getBean(AutopilotLifecycle.class).isAutoStartup()).isFalse();
            assertThat(context.getBean(AutopilotLifecycle.class).isRunning()).isFalse();
        });
    }

    @Test
    void shouldRegisterExecutorBeans() {
        contextRunner.run(context -> {
            ActionExecutorRegistry registry = context.getBean(ActionExecutorRegistry.class);
            assertThat(registry.find(JobKind.TWITTER_POST.type())).isPresent();
            assertThat(registry.find(JobKind.LINKEDIN_POST.type())).isEmpty();
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("autopilot.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(Autopilot.class));
    }

    @Test
    void shouldKeepUserProvidedAutopilot() {
        Autopilot custom = mock(Autopilot.class);
        contextRunner.withBean(Autopilot.class, () -> custom)
                .run(context -> assertThat(context.getBean(Autopilot.class)).isSameAs(custom));
    }

    @Test
    void shouldCreateIndexesOnRequest() {
        when(mongoTemplate.indexOps(JobDocument.class)).thenReturn(indexOps);

        contextRunner.withPropertyValues("autopilot.ensure-indexes-on-startup=true")
                .run(context -> {
                    assertThat(context).hasBean("autopilotIndexesInitializer");
                    verify(indexOps, times(3)).ensureIndex(any(IndexDefinition.class));
                });
    }

    static class DemoPostExecutor implements ActionExecutor<DemoPost> {
        @Override
        public String jobType() {
            return JobKind.TWITTER_POST.type();
        }

        @Override
        public Class<DemoPost> payloadClass() {
            return DemoPost.class;
        }

        @Override
        public ActionResult execute(AutomationSession session, DemoPost payload) {
            return ActionResult.of("posted " + payload.variant());
        }
    }

    record DemoPost(String account, String variant) {
    }
}
