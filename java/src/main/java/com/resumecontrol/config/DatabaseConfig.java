package com.resumecontrol.config;

import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC PostgreSQL connection.
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    @Value("${resumecontrol.database.initialize-schema:false}")
    private boolean initializeSchema;

    /**
     * Initialize database schema on startup.
     * Executes schema.sql when {@code resumecontrol.database.initialize-schema} is true.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        if (initializeSchema) {
            log.info("Applying schema.sql");
            populator.addScript(new ClassPathResource("schema.sql"));
        }
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(initializeSchema);

        return initializer;
    }
}
