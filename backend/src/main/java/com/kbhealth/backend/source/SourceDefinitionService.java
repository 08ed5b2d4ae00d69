package com.kbhealth.backend.source;

import com.kbhealth.backend.config.SourceDefinition;
import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.Platform;
import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

/**
 * Service to load and manage data source definitions from YAML
 */
@Service
@Slf4j
public class SourceDefinitionService {

    private final Map<String, SourceDefinition> definitions = new LinkedHashMap<>();
    private final Resource configResource;

    public SourceDefinitionService(@Value("${sources.config-location:classpath:data-sources.yml}") Resource configResource) {
        this.configResource = configResource;
    }

    @PostConstruct
    public void loadDefinitions() {
        if (!configResource.exists()) {
            log.warn("No data source definitions found at {}", configResource.getDescription());
            return;
        }

        try (InputStream inputStream = configResource.getInputStream()) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(inputStream);
            if (data == null || data.get("sources") == null) {
                log.warn("Data source file {} declares no sources", configResource.getDescription());
                return;
            }

            @SuppressWarnings("unchecked")
            Map<String, Object> sources = (Map<String, Object>) data.get("sources");

            synchronized (definitions) {
                for (Map.Entry<String, Object> entry : sources.entrySet()) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> sourceData = (Map<String, Object>) entry.getValue();
                    SourceDefinition definition = createDefinitionFromMap(entry.getKey(), sourceData);
                    definitions.put(definition.getId(), definition);
                    log.info("Loaded definition for data source: {} ({})", definition.getId(), definition.getPlatform());
                }
            }

            log.info("Successfully loaded {} data source definitions", definitions.size());

        } catch (Exception e) {
            log.error("Error loading data source definitions", e);
            throw new IllegalStateException("Failed to load data source definitions", e);
        }
    }

    public Optional<SourceDefinition> getDefinition(String sourceId) {
        synchronized (definitions) {
            return Optional.ofNullable(definitions.get(sourceId));
        }
    }

    /**
     * Definition to crawl the given source with, falling back to its platform defaults.
     */
    public SourceDefinition resolve(DataSource source) {
        return getDefinition(source.getId()).orElseGet(() -> SourceDefinition.fromDataSource(source));
    }

    public List<SourceDefinition> getAllDefinitions() {
        synchronized (definitions) {
            return new ArrayList<>(definitions.values());
        }
    }

    public void register(SourceDefinition definition) {
        synchronized (definitions) {
            definitions.put(definition.getId(), definition);
        }
    }

    /**
     * Create SourceDefinition from YAML map data
     */
    @SuppressWarnings("unchecked")
    private SourceDefinition createDefinitionFromMap(String key, Map<String, Object> sourceData) {
        SourceDefinition definition = new SourceDefinition();

        definition.setId(sourceData.get("id") != null ? (String) sourceData.get("id") : key);
        definition.setName((String) sourceData.get("name"));
        definition.setPlatform(Platform.fromCode((String) sourceData.get("platform")));
        definition.setBaseUrl((String) sourceData.get("baseUrl"));
        if (sourceData.get("enabled") != null) {
            definition.setEnabled((Boolean) sourceData.get("enabled"));
        }
        if (definition.getBaseUrl() == null) {
            throw new IllegalArgumentException("Data source " + key + " has no baseUrl");
        }

        definition.setCategoryLinkSelector((String) sourceData.get("categoryLinkSelector"));
        definition.setArticleLinkSelector((String) sourceData.get("articleLinkSelector"));
        definition.setCategories((List<String>) sourceData.get("categories"));
        definition.setCategoriesToIgnore((List<String>) sourceData.get("categoriesToIgnore"));

        definition.setTitleSelectors((List<String>) sourceData.get("titleSelectors"));
        definition.setContentSelectors((List<String>) sourceData.get("contentSelectors"));
        definition.setContentIgnoreSelectors((List<String>) sourceData.get("contentIgnoreSelectors"));
        definition.setSummarySelectors((List<String>) sourceData.get("summarySelectors"));
        definition.setAuthorSelectors((List<String>) sourceData.get("authorSelectors"));
        definition.setModifiedTimeSelectors((List<String>) sourceData.get("modifiedTimeSelectors"));
        definition.setCategorySelectors((List<String>) sourceData.get("categorySelectors"));
        definition.setKeywordSelectors((List<String>) sourceData.get("keywordSelectors"));

        definition.setMaxArticlesPerCategory((Integer) sourceData.get("maxArticlesPerCategory"));
        definition.setSyncTimeoutSeconds((Integer) sourceData.get("syncTimeoutSeconds"));

        return definition;
    }
}
