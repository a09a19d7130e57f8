package io.recur4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobHandler;
import io.recur4j.JobService;
import io.recur4j.core.JobHandlerRegistry;
import io.recur4j.engine.JobExecutor;
import io.recur4j.engine.JobLocks;
import io.recur4j.engine.SchedulerEngine;
import io.recur4j.handlers.BuiltInHandlers;
import io.recur4j.internal.DefaultJobService;
import io.recur4j.internal.mongo.MongoJobRepository;
import io.recur4j.store.InMemoryJobRepository;
import io.recur4j.store.JobRepository;
import io.recur4j.utils.WorkerIds;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for recur4j components.
 *
 * <p>Jobs are stored in MongoDB when a {@link MongoTemplate} bean exists, otherwise in memory.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(JobService.class)
@EnableConfigurationProperties(Recur4jProperties.class)
@ConditionalOnProperty(prefix = "recur4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Recur4jAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnBean(MongoTemplate.class)
    static class MongoStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobRepository.class)
        JobRepository mongoJobRepository(MongoTemplate mongoTemplate, Recur4jProperties props) {
            TransactionOperations transactions = props.isMongoTransactions()
                    ? new TransactionTemplate(new MongoTransactionManager(mongoTemplate.getMongoDatabaseFactory()))
                    : TransactionOperations.withoutTransaction();
            return new MongoJobRepository(mongoTemplate, transactions);
        }

        @Bean
        @ConditionalOnMissingBean
        Recur4jMongoIndexConfig recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new Recur4jMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "recur4j", name = "ensure-indexes-on-startup", havingValue = "true")
        SmartInitializingSingleton recur4jIndexesInitializer(Recur4jMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Bean
    @ConditionalOnMissingBean(JobRepository.class)
    public JobRepository inMemoryJobRepository() {
        return new InMemoryJobRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return JobHandlerRegistry.withOverrides(BuiltInHandlers.all(), handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobLocks jobLocks() {
        return new JobLocks();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(Recur4jProperties props,
                                   JobRepository repository,
                                   JobHandlerRegistry registry,
                                   JobLocks locks,
                                   ObjectProvider<ObjectMapper> objectMapper) {
        return new JobExecutor(repository, registry, locks, objectMapper.getIfAvailable(ObjectMapper::new),
                Clock.systemUTC(), props.zoneId(), WorkerIds.resolve(props.getWorkerId()));
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerEngine schedulerEngine(Recur4jProperties props, JobRepository repository, JobExecutor executor, JobLocks locks) {
        return new SchedulerEngine(props, repository, executor, locks, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobService jobService(Recur4jProperties props,
                                 JobRepository repository,
                                 SchedulerEngine engine,
                                 JobLocks locks,
                                 ObjectProvider<ObjectMapper> objectMapper) {
        return new DefaultJobService(props, repository, engine, locks, objectMapper.getIfAvailable(ObjectMapper::new),
                Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(SchedulerEngine engine) {
        return new SchedulerLifecycle(engine);
    }
}
