package com.poc.chmigrator.config;

import com.poc.chmigrator.engine.EngineSettings;
import com.poc.chmigrator.engine.MigrationEventListener;
import com.poc.chmigrator.engine.SchemaSynchronizer;
import com.poc.chmigrator.engine.TableMigrator;
import com.poc.chmigrator.engine.TaskRunner;
import com.poc.chmigrator.engine.TypeMapper;
import com.poc.chmigrator.engine.Verifier;
import com.poc.chmigrator.engine.port.DatabaseSessionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the migration engine. Engine classes are plain Java; everything they need
 * arrives through these constructors.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public EngineSettings engineSettings(MigrationProperties properties) {
        return properties.toEngineSettings();
    }

    @Bean
    public TypeMapper typeMapper(EngineSettings settings) {
        return new TypeMapper(settings.getSourceCharset());
    }

    @Bean
    public SchemaSynchronizer schemaSynchronizer(TypeMapper typeMapper, EngineSettings settings) {
        return new SchemaSynchronizer(typeMapper, settings);
    }

    @Bean
    public Verifier verifier() {
        return new Verifier();
    }

    @Bean
    public TableMigrator tableMigrator(DatabaseSessionFactory sessions, SchemaSynchronizer synchronizer,
                                       Verifier verifier, TypeMapper typeMapper, EngineSettings settings) {
        return new TableMigrator(sessions, synchronizer, verifier, typeMapper, settings);
    }

    @Bean
    public TaskRunner taskRunner(TableMigrator tableMigrator, DatabaseSessionFactory sessions,
                                 List<MigrationEventListener> listeners, EngineSettings settings) {
        return new TaskRunner(tableMigrator, sessions, listeners, settings);
    }
}
