package org.bookshelf.service.importer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bookshelf.exception.ApiError;
import org.bookshelf.model.entity.*;
import org.bookshelf.model.enums.PrivacyLevel;
import org.bookshelf.repository.ReviewRatingRepository;
import org.bookshelf.repository.ReviewRepository;
import org.bookshelf.repository.ShelfBookRepository;
import org.bookshelf.repository.UserRepository;
import org.bookshelf.service.ShelfService;
import org.bookshelf.service.event.StatusBroadcaster;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Applies the library side of an import row once its book is known: shelving, then optionally a review or
 * rating. Running it again for the same user and book changes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportedBookHandler {

    private final UserRepository userRepository;
    private final ShelfService shelfService;
    private final ShelfBookRepository shelfBookRepository;
    private final ReviewRepository reviewRepository;
    private final ReviewRatingRepository reviewRatingRepository;
    private final StatusBroadcaster statusBroadcaster;

    @Transactional
    public void handle(BookshelfUserEntity user, ImportItemEntity item, boolean includeReviews, PrivacyLevel privacy) {
        BookEntity book = item.getBook();
        if (book == null) {
            throw new IllegalStateException("Import item " + item.getId() + " has no resolved book");
        }
        // Every concurrent import for this user queues here, so the existence checks below cannot race
        BookshelfUserEntity lockedUser = userRepository.findByIdForUpdate(user.getId())
                .orElseThrow(() -> ApiError.USER_NOT_FOUND.createException(user.getId()));

        shelveBook(lockedUser, item, book);

        if (includeReviews) {
            createReviewOrRating(lockedUser, item, book, privacy);
        }
    }

    private void shelveBook(BookshelfUserEntity user, ImportItemEntity item, BookEntity book) {
        if (shelfBookRepository.existsByUserIdAndBookId(user.getId(), book.getId())) {
            log.debug("Book {} already shelved for userId={}, leaving shelving unchanged", book.getId(), user.getId());
            return;
        }
        ShelfEntity shelf = shelfService.resolveImportShelf(user, item.getShelf(), item.getDateRead() != null);
        LocalDate shelvedOn = item.getDateRead() != null ? item.getDateRead() : item.getDateAdded();

        shelfBookRepository.save(ShelfBookEntity.builder()
                .shelf(shelf)
                .book(book)
                .user(user)
                .shelvedDate(shelvedOn != null ? startOfDay(shelvedOn) : Instant.now())
                .build());
        log.info("Shelved bookId={} on '{}' for userId={}", book.getId(), shelf.getIdentifier(), user.getId());
    }

    private void createReviewOrRating(BookshelfUserEntity user, ImportItemEntity item, BookEntity book, PrivacyLevel privacy) {
        Double rating = item.getRating();
        String content = item.getReview();
        Instant publishedDate = publishedDate(item);

        if (content != null) {
            if (reviewRepository.existsByUserIdAndBookIdAndPublishedDate(user.getId(), book.getId(), publishedDate)) {
                log.debug("Review of bookId={} by userId={} already imported", book.getId(), user.getId());
                return;
            }
            ReviewEntity review = reviewRepository.save(ReviewEntity.builder()
                    .user(user)
                    .book(book)
                    .name("Review of \"" + book.getTitle() + "\"")
                    .content(content)
                    .rating(rating)
                    .privacy(privacy)
                    .publishedDate(publishedDate)
                    .build());
            statusBroadcaster.broadcast(review);
            log.info("Imported review id={} of bookId={} for userId={}", review.getId(), book.getId(), user.getId());
        } else if (rating != null) {
            if (reviewRatingRepository.existsByUserIdAndBookIdAndRatingAndPublishedDate(user.getId(), book.getId(), rating, publishedDate)) {
                log.debug("Rating of bookId={} by userId={} already imported", book.getId(), user.getId());
                return;
            }
            ReviewRatingEntity reviewRating = reviewRatingRepository.save(ReviewRatingEntity.builder()
                    .user(user)
                    .book(book)
                    .rating(rating)
                    .privacy(privacy)
                    .publishedDate(publishedDate)
                    .build());
            statusBroadcaster.broadcast(reviewRating);
            log.info("Imported rating id={} of bookId={} for userId={}", reviewRating.getId(), book.getId(), user.getId());
        }
    }

    /**
     * When the row has no dates, the job's creation time keeps the published date stable across replays.
     */
    private Instant publishedDate(ImportItemEntity item) {
        LocalDate date = item.getDateRead() != null ? item.getDateRead() : item.getDateAdded();
        if (date != null) {
            return startOfDay(date);
        }
        ImportJobEntity job = item.getJob();
        if (job != null && job.getCreatedAt() != null) {
            return job.getCreatedAt();
        }
        return Instant.now();
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
