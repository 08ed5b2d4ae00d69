package com.kbhealth.backend.model.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceOverviewDTO {
    private int totalSources;
    private int enabledSources;
    private int syncingSources;
    private int failingSources;
    private long totalArticles;
    private List<SourceStatusDTO> sources;
}
