package org.bookshelf.service.importer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.bookshelf.model.entity.BookEntity;
import org.bookshelf.model.entity.ImportItemEntity;
import org.bookshelf.model.entity.ImportJobEntity;
import org.bookshelf.repository.ImportItemRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * One unit of import work: resolve the item's book, then apply its library side effects. Failures end up in
 * the item's fail reason and never propagate to the caller.
 */
@Slf4j
@Service
public class ImportItemProcessor {

    private static final int FAIL_REASON_MAX_LENGTH = 1024;

    private final ImportItemRepository importItemRepository;
    private final BookResolver bookResolver;
    private final ImportedBookHandler importedBookHandler;
    private final TransactionTemplate transactionTemplate;

    public ImportItemProcessor(ImportItemRepository importItemRepository,
                               BookResolver bookResolver,
                               ImportedBookHandler importedBookHandler,
                               PlatformTransactionManager transactionManager) {
        this.importItemRepository = importItemRepository;
        this.bookResolver = bookResolver;
        this.importedBookHandler = importedBookHandler;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void processJob(long jobId) {
        List<Long> itemIds = importItemRepository.findIdsByJobId(jobId);
        log.info("Processing {} items of import job {}", itemIds.size(), jobId);
        itemIds.forEach(this::processItem);
    }

    public void processItem(long itemId) {
        Boolean resolved;
        try {
            resolved = transactionTemplate.execute(status -> resolveBook(itemId));
        } catch (RuntimeException e) {
            log.warn("Import item {} could not be resolved: {}", itemId, e.getMessage());
            recordFailure(itemId, e);
            return;
        }
        if (!Boolean.TRUE.equals(resolved)) {
            return;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> applySideEffects(itemId));
        } catch (RuntimeException e) {
            log.error("Failed to apply import item {} to the library", itemId, e);
            recordFailure(itemId, e);
        }
    }

    /**
     * @return whether the item has a book and should go on to the side effect step
     */
    private boolean resolveBook(long itemId) {
        ImportItemEntity item = importItemRepository.findById(itemId).orElse(null);
        if (item == null) {
            log.warn("Import item {} no longer exists, skipping", itemId);
            return false;
        }
        if (item.getBook() != null) {
            // Replayed dispatch: resolution is done, only the idempotent side effects run again
            return true;
        }
        if (item.getFailReason() != null) {
            log.debug("Import item {} already failed: {}", itemId, item.getFailReason());
            return false;
        }
        BookEntity book = bookResolver.resolve(item);
        item.setBook(book);
        importItemRepository.save(item);
        log.debug("Import item {} (row {}) resolved to bookId={}", itemId, item.getIndex(), book.getId());
        return true;
    }

    private void applySideEffects(long itemId) {
        ImportItemEntity item = importItemRepository.findById(itemId)
                .orElseThrow(() -> new IllegalStateException("Import item " + itemId + " disappeared during processing"));
        ImportJobEntity job = item.getJob();
        importedBookHandler.handle(job.getUser(), item, job.isIncludeReviews(), job.getPrivacy());
    }

    /**
     * Stores the failure on the item in its own transaction. Also used for items whose dispatch was refused.
     */
    public void recordFailure(long itemId, RuntimeException failure) {
        String reason = StringUtils.abbreviate(StringUtils.defaultIfBlank(failure.getMessage(), failure.getClass().getSimpleName()), FAIL_REASON_MAX_LENGTH);
        try {
            transactionTemplate.executeWithoutResult(status -> importItemRepository.findById(itemId).ifPresent(item -> {
                item.setFailReason(reason);
                importItemRepository.save(item);
            }));
        } catch (RuntimeException e) {
            log.error("Could not record failure '{}' on import item {}", reason, itemId, e);
        }
    }
}
