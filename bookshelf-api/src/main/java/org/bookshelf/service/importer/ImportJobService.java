package org.bookshelf.service.importer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bookshelf.exception.ApiError;
import org.bookshelf.mapper.ImportJobMapper;
import org.bookshelf.model.dto.ImportItem;
import org.bookshelf.model.dto.ImportJob;
import org.bookshelf.model.dto.ImportJobProgress;
import org.bookshelf.model.entity.BookshelfUserEntity;
import org.bookshelf.model.entity.ImportItemEntity;
import org.bookshelf.model.entity.ImportJobEntity;
import org.bookshelf.model.enums.ImportField;
import org.bookshelf.model.enums.ImportSource;
import org.bookshelf.model.enums.PrivacyLevel;
import org.bookshelf.repository.ImportItemRepository;
import org.bookshelf.repository.ImportJobRepository;
import org.bookshelf.service.importer.dispatch.ImportTaskDispatcher;
import org.bookshelf.service.importer.dispatch.TaskHandle;
import org.bookshelf.service.importer.normalizer.ImportNormalizer;
import org.bookshelf.service.importer.normalizer.ImportNormalizerRegistry;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImportJobService {

    private final ImportJobRepository importJobRepository;
    private final ImportItemRepository importItemRepository;
    private final ImportNormalizerRegistry normalizerRegistry;
    private final ImportFileReader importFileReader;
    private final ImportItemProcessor importItemProcessor;
    private final ImportTaskDispatcher importTaskDispatcher;
    private final ImportJobMapper importJobMapper;

    @Transactional
    public ImportJobEntity createJob(BookshelfUserEntity user, ImportSource source, InputStream file,
                                     boolean includeReviews, PrivacyLevel privacy) {
        ImportNormalizer normalizer = normalizerRegistry.getNormalizer(source);
        return createJob(user, normalizer, importFileReader.readRows(file, normalizer), includeReviews, privacy);
    }

    @Transactional
    public ImportJobEntity createJob(BookshelfUserEntity user, ImportSource source, List<Map<String, String>> rawRows,
                                     boolean includeReviews, PrivacyLevel privacy) {
        return createJob(user, normalizerRegistry.getNormalizer(source), rawRows, includeReviews, privacy);
    }

    /**
     * Normalizes every row up front; a single row lacking a mandatory field rejects the whole file before
     * anything is persisted.
     */
    private ImportJobEntity createJob(BookshelfUserEntity user, ImportNormalizer normalizer, List<Map<String, String>> rawRows,
                                      boolean includeReviews, PrivacyLevel privacy) {
        if (rawRows == null || rawRows.isEmpty()) {
            throw ApiError.EMPTY_IMPORT_FILE.createException();
        }
        List<Map<String, String>> normalizedRows = new ArrayList<>(rawRows.size());
        for (int index = 0; index < rawRows.size(); index++) {
            Map<String, String> normalized = normalizer.normalize(rawRows.get(index));
            List<ImportField> missing = normalizer.findMissingMandatoryFields(normalized);
            if (!missing.isEmpty()) {
                throw ApiError.INVALID_IMPORT_ROW.createException(index, missing.stream()
                        .map(ImportField::getKey)
                        .collect(Collectors.joining(", ")));
            }
            normalizedRows.add(normalized);
        }

        ImportJobEntity job = importJobRepository.save(ImportJobEntity.builder()
                .user(user)
                .source(normalizer.getSource())
                .includeReviews(includeReviews)
                .privacy(Objects.requireNonNullElse(privacy, PrivacyLevel.PUBLIC))
                .build());
        saveItems(job, normalizedRows);
        log.info("Created {} import job {} with {} items for userId={}", normalizer.getSource(), job.getId(), normalizedRows.size(), user.getId());
        return job;
    }

    /**
     * Copies the given items into a new job, numbered from zero in the order given. The original job and its
     * items are left as they are.
     */
    @Transactional
    public ImportJobEntity createRetryJob(BookshelfUserEntity user, ImportJobEntity originalJob, List<ImportItemEntity> failedItems) {
        if (failedItems == null || failedItems.isEmpty()) {
            throw ApiError.NO_FAILED_IMPORT_ITEMS.createException(originalJob.getId());
        }
        for (ImportItemEntity item : failedItems) {
            if (item.getJob() == null || !Objects.equals(item.getJob().getId(), originalJob.getId())) {
                throw ApiError.IMPORT_ITEM_NOT_IN_JOB.createException(item.getId(), originalJob.getId());
            }
        }

        ImportJobEntity retryJob = importJobRepository.save(ImportJobEntity.builder()
                .user(user)
                .source(originalJob.getSource())
                .includeReviews(originalJob.isIncludeReviews())
                .privacy(originalJob.getPrivacy())
                .retry(true)
                .originalJob(originalJob)
                .build());
        saveItems(retryJob, failedItems.stream().map(ImportItemEntity::getData).toList());
        log.info("Created retry job {} from import job {} with {} items", retryJob.getId(), originalJob.getId(), failedItems.size());
        return retryJob;
    }

    @Transactional
    public ImportJobEntity createRetryJobForFailures(BookshelfUserEntity user, long jobId) {
        ImportJobEntity originalJob = findJobOrThrow(jobId);
        List<ImportItemEntity> failedItems = importItemRepository.findByJobIdAndFailReasonIsNotNullOrderByIndexAsc(jobId);
        return createRetryJob(user, originalJob, failedItems);
    }

    /**
     * Dispatches one unit of work per item and returns without waiting. The job keeps the handle of the last
     * accepted dispatch. An item the dispatcher refuses is marked failed so it can go into a retry job.
     */
    public void startImport(ImportJobEntity job) {
        List<Long> itemIds = importItemRepository.findIdsByJobId(job.getId());
        TaskHandle lastHandle = null;
        int rejected = 0;
        for (Long itemId : itemIds) {
            try {
                lastHandle = importTaskDispatcher.dispatch(importItemProcessor::processItem, itemId);
            } catch (TaskRejectedException e) {
                rejected++;
                log.warn("Dispatch of import item {} from job {} was rejected: {}", itemId, job.getId(), e.getMessage());
                importItemProcessor.recordFailure(itemId, e);
            }
        }
        if (lastHandle != null) {
            job.setTaskId(lastHandle.getId());
            importJobRepository.save(job);
        }
        log.info("Dispatched {} of {} items of import job {}, last task {}", itemIds.size() - rejected, itemIds.size(),
                job.getId(), lastHandle != null ? lastHandle.getId() : "none");
    }

    @Transactional(readOnly = true)
    public ImportJob getJob(long jobId) {
        return importJobMapper.toImportJob(findJobOrThrow(jobId));
    }

    @Transactional(readOnly = true)
    public List<ImportItem> getItems(long jobId) {
        findJobOrThrow(jobId);
        return importItemRepository.findByJobIdOrderByIndexAsc(jobId).stream()
                .map(importJobMapper::toImportItem)
                .toList();
    }

    @Transactional(readOnly = true)
    public ImportJobProgress getJobProgress(long jobId) {
        findJobOrThrow(jobId);
        long total = importItemRepository.countByJobId(jobId);
        long failed = importItemRepository.countByJobIdAndFailReasonIsNotNull(jobId);
        long resolved = importItemRepository.countByJobIdAndBookIsNotNullAndFailReasonIsNull(jobId);
        long pending = total - failed - resolved;
        return ImportJobProgress.builder()
                .jobId(jobId)
                .total(total)
                .pending(pending)
                .resolved(resolved)
                .failed(failed)
                .complete(pending == 0)
                .build();
    }

    private void saveItems(ImportJobEntity job, List<Map<String, String>> rows) {
        List<ImportItemEntity> items = new ArrayList<>(rows.size());
        for (int index = 0; index < rows.size(); index++) {
            items.add(ImportItemEntity.builder()
                    .job(job)
                    .index(index)
                    .data(new LinkedHashMap<>(rows.get(index)))
                    .build());
        }
        importItemRepository.saveAll(items);
    }

    private ImportJobEntity findJobOrThrow(long jobId) {
        return importJobRepository.findById(jobId)
                .orElseThrow(() -> ApiError.IMPORT_JOB_NOT_FOUND.createException(jobId));
    }
}
