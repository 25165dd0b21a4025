package io.autopilot4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.autopilot4j.ActionExecutor;
import io.autopilot4j.Autopilot;
import io.autopilot4j.core.ActionExecutorRegistry;
import io.autopilot4j.internal.mongo.MongoAutopilot;
import io.autopilot4j.internal.mongo.MongoJobStore;
import io.autopilot4j.internal.mongo.MongoScheduleStore;
import io.autopilot4j.internal.mongo.MongoSettingsStore;
import io.autopilot4j.session.ProfileMarkerSessionDriver;
import io.autopilot4j.session.SessionManager;
import io.autopilot4j.spi.JobStore;
import io.autopilot4j.spi.ScheduleStore;
import io.autopilot4j.spi.SessionDriver;
import io.autopilot4j.spi.SettingsStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for Autopilot components.
 */
@AutoConfiguration
@ConditionalOnClass({Autopilot.class, MongoTemplate.class})
@EnableConfigurationProperties(AutopilotProperties.class)
@ConditionalOnProperty(prefix = "autopilot", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AutopilotConfig {

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleStore.class)
    protected MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate, AutopilotProperties props) {
        return new MongoScheduleStore(mongoTemplate, props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean(SettingsStore.class)
    protected MongoSettingsStore mongoSettingsStore(MongoTemplate mongoTemplate) {
        return new MongoSettingsStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected AutopilotMongoIndexConfig autopilotMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new AutopilotMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionExecutorRegistry actionExecutorRegistry(ObjectProvider<List<ActionExecutor<?>>> executorsProvider) {
        List<ActionExecutor<?>> executors = executorsProvider.getIfAvailable(List::of);
        return new ActionExecutorRegistry(executors);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionDriver sessionDriver() {
        return new ProfileMarkerSessionDriver();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionManager sessionManager(SessionDriver driver, AutopilotProperties props) {
        return new SessionManager(driver, Path.of(props.getProfilesDir()));
    }

    @Bean
    @ConditionalOnMissingBean
    public Autopilot autopilot(AutopilotProperties props,
                               JobStore jobStore,
                               ScheduleStore scheduleStore,
                               SettingsStore settingsStore,
                               SessionManager sessionManager,
                               ActionExecutorRegistry registry,
                               ObjectMapper om) {
        return new MongoAutopilot(props, jobStore, scheduleStore, settingsStore, sessionManager, registry, om);
    }

    @Bean
    @ConditionalOnMissingBean
    public AutopilotLifecycle autopilotLifecycle(Autopilot autopilot, AutopilotProperties props) {
        return new AutopilotLifecycle(autopilot, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "autopilot", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton autopilotIndexesInitializer(AutopilotMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
