package com.kbhealth.backend.model.dto;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields extracted from one article page, before it is bound to a source.
 */
@Data
@NoArgsConstructor
public class ArticleDTO {
    private String url;
    private String title;
    private String content;
    private String summary;
    private String author;
    private String category;
    private Set<String> tags = new LinkedHashSet<>();
    private LocalDateTime lastModifiedAt;
}
