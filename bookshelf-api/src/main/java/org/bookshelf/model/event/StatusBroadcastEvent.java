package org.bookshelf.model.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.bookshelf.model.entity.BookStatusEntity;

import java.util.Map;

@Getter
@AllArgsConstructor
@ToString
public class StatusBroadcastEvent {
    private final BookStatusEntity status;
    private final Map<String, String> metadata;
}
