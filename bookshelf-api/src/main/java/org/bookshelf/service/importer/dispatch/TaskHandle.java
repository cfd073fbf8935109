package org.bookshelf.service.importer.dispatch;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class TaskHandle {
    private final String id;
}
