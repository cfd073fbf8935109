package org.bookshelf.service.importer.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.LongConsumer;

@Slf4j
@Component
public class ExecutorImportTaskDispatcher implements ImportTaskDispatcher {

    private final AsyncTaskExecutor executor;

    public ExecutorImportTaskDispatcher(@Qualifier("importTaskExecutor") AsyncTaskExecutor executor) {
        this.executor = executor;
    }

    @Override
    public TaskHandle dispatch(LongConsumer handler, long id) {
        String taskId = UUID.randomUUID().toString();
        executor.execute(() -> {
            try {
                handler.accept(id);
            } catch (RuntimeException e) {
                log.error("Import task {} for id {} failed", taskId, id, e);
            }
        });
        return new TaskHandle(taskId);
    }
}
