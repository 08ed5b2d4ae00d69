package com.kbhealth.backend.source;

import com.kbhealth.backend.config.SourceDefinition;
import com.kbhealth.backend.model.entity.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Registers the sources declared in {@code data-sources.yml} at startup.
 * <p>
 * Sources already known to the store keep their status, counters and enabled flag; only
 * their configuration is refreshed from the declaration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataSourceInitializer implements CommandLineRunner {

    private final SourceDefinitionService definitionService;
    private final SourceRegistry sourceRegistry;

    @Override
    public void run(String... args) {
        log.info("Initializing declared data sources...");

        int initialized = 0;
        for (SourceDefinition definition : definitionService.getAllDefinitions()) {
            boolean known = sourceRegistry.exists(definition.getId());
            DataSource registered = sourceRegistry.register(definition.toDataSource());
            if (!known) {
                initialized++;
                log.info("Initialized data source: {} (enabled={})", registered.getId(), registered.isEnabled());
            } else {
                log.debug("Data source already exists: {}", registered.getId());
            }
        }

        if (initialized > 0) {
            log.info("Initialized {} new data sources", initialized);
        } else {
            log.info("All declared data sources already exist");
        }
        log.info("Total enabled data sources: {}", sourceRegistry.listEnabled().size());
    }
}
