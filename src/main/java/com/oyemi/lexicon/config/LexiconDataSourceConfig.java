package com.oyemi.lexicon.config;

import com.oyemi.lexicon.service.ArtifactLocation;
import com.oyemi.lexicon.service.ArtifactLocator;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import jakarta.persistence.EntityManagerFactory;
import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Points JPA at the lexicon artifact chosen for this run.
 * In build mode the location is prepared (old artifact removed or output redirected) before H2 opens it.
 */
@Configuration
public class LexiconDataSourceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ArtifactLocator artifactLocator(Clock clock) {
        return new ArtifactLocator(clock);
    }

    @Bean
    public ArtifactLocation artifactLocation(LexiconProperties properties, ArtifactLocator artifactLocator) {
        Path configured = Path.of(properties.getOutputPath());
        if (!properties.isEnabled()) {
            return new ArtifactLocation(configured.toAbsolutePath().normalize(), false);
        }
        return properties.getMode() == LexiconProperties.RunMode.VALIDATE
                ? artifactLocator.locateForValidation(configured)
                : artifactLocator.prepareForBuild(configured);
    }

    @Primary
    @Bean
    public DataSource dataSource(ArtifactLocation artifactLocation) {
        return DataSourceBuilder.create()
                .driverClassName("org.h2.Driver")
                .url(artifactLocation.jdbcUrl())
                .username("sa")
                .password("")
                .build();
    }

    @Primary
    @Bean(name = "transactionManager")
    public PlatformTransactionManager transactionManager(EntityManagerFactory entityManagerFactory) {
        return new JpaTransactionManager(entityManagerFactory);
    }
}
