package com.enterprise.morpher.config;

import com.enterprise.morpher.config.MorpherProperties.DatabaseProperties;
import com.enterprise.morpher.shared.querybridge.adapter.JdbcDatabaseConnection;
import com.enterprise.morpher.shared.querybridge.adapter.JdbcUrlFactory;
import com.enterprise.morpher.shared.querybridge.port.DatabaseConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.batch.BatchDataSource;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import javax.sql.DataSource;

/**
 * DataSources of a migration run.
 *
 * <p>The Spring Batch job repository gets its own embedded H2 database, so job
 * metadata never lands in the source or target. Source and target DataSources are
 * built from {@code morpher.source} / {@code morpher.target}; passwords are read
 * from the environment variable named by {@code password-env}.
 */
@Configuration
public class MorpherDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(MorpherDataSourceConfig.class);

    @Bean
    @Primary
    @BatchDataSource
    public DataSource batchDataSource() {
        return new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
    }

    @Bean
    public DataSource sourceDataSource(MorpherProperties properties, Environment environment) {
        return build("source", properties.source(), environment);
    }

    @Bean
    public DataSource targetDataSource(MorpherProperties properties, Environment environment) {
        return build("target", properties.target(), environment);
    }

    @Bean
    public DatabaseConnection sourceConnection(@Qualifier("sourceDataSource") DataSource dataSource) {
        return new JdbcDatabaseConnection("source", dataSource);
    }

    @Bean
    public DatabaseConnection targetConnection(@Qualifier("targetDataSource") DataSource dataSource) {
        return new JdbcDatabaseConnection("target", dataSource);
    }

    private static DataSource build(String name, DatabaseProperties db, Environment environment) {
        String url = JdbcUrlFactory.create(db.toDescriptor());
        log.info("Connection '{}': {}", name, url);
        DataSourceBuilder<?> builder = DataSourceBuilder.create().url(url);
        if (db.user() != null) {
            builder.username(db.user());
        }
        if (db.passwordEnv() != null && !db.passwordEnv().isBlank()) {
            builder.password(environment.getProperty(db.passwordEnv(), ""));
        }
        return builder.build();
    }
}
