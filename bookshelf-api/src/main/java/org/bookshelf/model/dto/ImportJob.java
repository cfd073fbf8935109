package org.bookshelf.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bookshelf.model.enums.ImportSource;
import org.bookshelf.model.enums.PrivacyLevel;

import java.time.Instant;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportJob {
    private Long id;
    private Long userId;
    private ImportSource source;
    private boolean includeReviews;
    private PrivacyLevel privacy;
    private String taskId;
    private boolean retry;
    private Long originalJobId;
    private Instant createdAt;
}
