package org.bookshelf.service.importer.dispatch;

import java.util.function.LongConsumer;

/**
 * Fire-and-forget execution of import work. The returned handle identifies the submission; callers never
 * wait on it.
 */
public interface ImportTaskDispatcher {

    TaskHandle dispatch(LongConsumer handler, long id);
}
