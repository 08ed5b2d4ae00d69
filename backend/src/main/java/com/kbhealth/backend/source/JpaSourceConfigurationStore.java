package com.kbhealth.backend.source;

import com.kbhealth.backend.model.entity.DataSource;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Transactional
public class JpaSourceConfigurationStore implements SourceConfigurationStore {

    private final DataSourceRepository dataSourceRepository;

    @Override
    @Transactional(readOnly = true)
    public List<DataSource> findAll() {
        return dataSourceRepository.findAllByOrderByIdAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DataSource> findById(String sourceId) {
        return dataSourceRepository.findById(sourceId);
    }

    @Override
    public void save(DataSource source) {
        dataSourceRepository.save(source);
    }
}
