package org.bookshelf.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobProgress {
    private Long jobId;
    private long total;
    private long pending;
    private long resolved;
    private long failed;
    private boolean complete;
}
