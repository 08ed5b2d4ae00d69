package com.kbhealth.backend.source;

import com.kbhealth.backend.model.entity.DataSource;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DataSourceRepository extends JpaRepository<DataSource, String> {

    List<DataSource> findAllByOrderByIdAsc();
}
