package com.kbhealth.backend.source;

import com.kbhealth.backend.model.entity.DataSource;
import java.util.List;
import java.util.Optional;

/**
 * Durable backing of the source registry, so configuration and counters survive restarts.
 */
public interface SourceConfigurationStore {

    List<DataSource> findAll();

    Optional<DataSource> findById(String sourceId);

    void save(DataSource source);
}
