package org.bookshelf.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bookshelf.model.enums.ImportItemStatus;

import java.util.Map;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportItem {
    private Long id;
    private Long jobId;
    private int index;
    private Map<String, String> data;
    private Long bookId;
    private String failReason;
    private ImportItemStatus status;
}
