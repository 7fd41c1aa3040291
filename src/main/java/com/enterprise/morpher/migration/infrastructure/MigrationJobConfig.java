package com.enterprise.morpher.migration.infrastructure;

import com.enterprise.morpher.config.MorpherProperties;
import com.enterprise.morpher.migration.application.MigrationOrchestrator;
import com.enterprise.morpher.migration.domain.RowTransform;
import com.enterprise.morpher.migration.domain.TransformRegistry;
import com.enterprise.morpher.shared.querybridge.port.DatabaseConnection;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * {@code migrationJob}: one tasklet step running the configured migrations.
 *
 * <p>Every {@link RowTransform} bean is registered under its bean name:
 * <pre>{@code
 * @Bean
 * RowTransform normalizeUser() {
 *     return (source, projected) -> Map.of("username",
 *         projected.valueOf("username").toString().toLowerCase());
 * }
 * }</pre>
 */
@Configuration
public class MigrationJobConfig {

    @Bean
    public TransformRegistry transformRegistry(ListableBeanFactory beanFactory) {
        return TransformRegistry.of(beanFactory.getBeansOfType(RowTransform.class));
    }

    @Bean
    public MigrationOrchestrator migrationOrchestrator(MorpherProperties properties) {
        return new MigrationOrchestrator(properties.engine().toSettings());
    }

    @Bean
    public MigrationTasklet migrationTasklet(MigrationOrchestrator orchestrator,
            @Qualifier("sourceConnection") DatabaseConnection source,
            @Qualifier("targetConnection") DatabaseConnection target,
            MorpherProperties properties,
            TransformRegistry transformRegistry) {
        return new MigrationTasklet(orchestrator, source, target,
            properties.migrationSpecs(), transformRegistry);
    }

    @Bean
    public Step migrationStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            MigrationTasklet migrationTasklet) {
        return new StepBuilder("migrationStep", jobRepository)
            .tasklet(migrationTasklet, transactionManager)
            .build();
    }

    @Bean
    public Job migrationJob(JobRepository jobRepository, Step migrationStep) {
        return new JobBuilder("migrationJob", jobRepository)
            .incrementer(new RunIdIncrementer())
            .start(migrationStep)
            .build();
    }
}
