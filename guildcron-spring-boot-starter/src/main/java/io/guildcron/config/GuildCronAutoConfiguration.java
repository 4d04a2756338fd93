package io.guildcron.config;

import io.guildcron.EventDiscovery;
import io.guildcron.GuildScheduler;
import io.guildcron.JobTimer;
import io.guildcron.Notifier;
import io.guildcron.SchedulerStore;
import io.guildcron.core.SchedulerSettings;
import io.guildcron.events.CachingEventDiscovery;
import io.guildcron.internal.DefaultGuildScheduler;
import io.guildcron.internal.ScheduledExecutorJobTimer;
import io.guildcron.internal.mongo.MongoSchedulerStore;
import io.guildcron.utils.CronExpressionBuilder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for guildcron components.
 *
 * <p>The scheduler itself is only created when the application supplies a {@link Notifier}; an
 * {@link EventDiscovery} bean is optional and wrapped with a result cache.
 */
@AutoConfiguration
@ConditionalOnClass({GuildScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(GuildCronProperties.class)
@ConditionalOnProperty(prefix = "guildcron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GuildCronAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings guildCronSchedulerSettings(GuildCronProperties props) {
        return new SchedulerSettings(
                CronExpressionBuilder.requireZone(props.getDefaultTimezone()),
                props.getMisfireGrace()
        );
    }

    @Bean
    @ConditionalOnMissingBean(SchedulerStore.class)
    public MongoSchedulerStore mongoSchedulerStore(MongoTemplate mongoTemplate, SchedulerSettings settings) {
        return new MongoSchedulerStore(mongoTemplate, settings.defaultTimezone());
    }

    @Bean
    @ConditionalOnMissingBean
    protected SchedulerMongoIndexConfig schedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new SchedulerMongoIndexConfig(mongoTemplate);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(JobTimer.class)
    public ScheduledExecutorJobTimer guildCronJobTimer(GuildCronProperties props) {
        return new ScheduledExecutorJobTimer(props.getTimerPoolSize(), props.getTimerShutdownTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(Notifier.class)
    public GuildScheduler guildScheduler(GuildCronProperties props,
                                         SchedulerSettings settings,
                                         SchedulerStore store,
                                         Notifier notifier,
                                         ObjectProvider<EventDiscovery> discoveryProvider,
                                         JobTimer timer) {
        EventDiscovery discovery = new CachingEventDiscovery(
                discoveryProvider.getIfAvailable(EventDiscovery::none),
                props.getEventCacheTtl(),
                props.getEventMaxResults()
        );
        return new DefaultGuildScheduler(store, notifier, discovery, timer, settings, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(GuildScheduler.class)
    public GuildCronLifecycle guildCronLifecycle(GuildScheduler scheduler) {
        return new GuildCronLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "guildcron", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton guildCronIndexesInitializer(SchedulerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
