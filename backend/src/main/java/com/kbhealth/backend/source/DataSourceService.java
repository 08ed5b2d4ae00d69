package com.kbhealth.backend.source;

import com.kbhealth.backend.config.SourceDefinition;
import com.kbhealth.backend.model.dto.SourceOverviewDTO;
import com.kbhealth.backend.model.dto.SourceStatusDTO;
import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.SyncStatus;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Source status and management operations offered to the presentation layer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataSourceService {

    private final SourceRegistry sourceRegistry;
    private final SourceDefinitionService definitionService;

    public List<SourceStatusDTO> listStatuses() {
        return sourceRegistry.list().stream().map(SourceStatusDTO::from).toList();
    }

    public SourceStatusDTO getStatus(String sourceId) {
        return SourceStatusDTO.from(sourceRegistry.get(sourceId));
    }

    public SourceOverviewDTO getOverview() {
        List<DataSource> sources = sourceRegistry.list();
        return SourceOverviewDTO.builder()
                .totalSources(sources.size())
                .enabledSources((int) sources.stream().filter(DataSource::isEnabled).count())
                .syncingSources((int) sources.stream().filter(s -> s.getStatus() == SyncStatus.SYNCING).count())
                .failingSources((int) sources.stream().filter(s -> s.getStatus() == SyncStatus.ERROR).count())
                .totalArticles(sources.stream().mapToLong(DataSource::getArticlesCount).sum())
                .sources(sources.stream().map(SourceStatusDTO::from).toList())
                .build();
    }

    public SourceStatusDTO setEnabled(String sourceId, boolean enabled) {
        return SourceStatusDTO.from(sourceRegistry.setEnabled(sourceId, enabled));
    }

    /**
     * Adds a source at runtime. Its selectors are used by later sync runs.
     */
    public SourceStatusDTO registerSource(SourceDefinition definition) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new IllegalArgumentException("Data source id is required");
        }
        if (definition.getBaseUrl() == null || !definition.getBaseUrl().matches("https?://.+")) {
            throw new IllegalArgumentException("Data source " + definition.getId() + " needs an http(s) base URL");
        }
        definitionService.register(definition);
        DataSource registered = sourceRegistry.register(definition.toDataSource());
        log.info("Registered data source {} at runtime", registered.getId());
        return SourceStatusDTO.from(registered);
    }
}
