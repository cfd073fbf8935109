package org.bookshelf.service.importer;

import org.bookshelf.model.entity.*;
import org.bookshelf.model.enums.ImportSource;
import org.bookshelf.model.enums.PrivacyLevel;
import org.bookshelf.repository.ReviewRatingRepository;
import org.bookshelf.repository.ReviewRepository;
import org.bookshelf.repository.ShelfBookRepository;
import org.bookshelf.repository.UserRepository;
import org.bookshelf.service.ShelfService;
import org.bookshelf.service.event.StatusBroadcaster;
import org.bookshelf.service.importer.normalizer.GoodreadsNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportedBookHandlerTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private ShelfService shelfService;
    @Mock
    private ShelfBookRepository shelfBookRepository;
    @Mock
    private ReviewRepository reviewRepository;
    @Mock
    private ReviewRatingRepository reviewRatingRepository;
    @Mock
    private StatusBroadcaster statusBroadcaster;

    @InjectMocks
    private ImportedBookHandler handler;

    private BookshelfUserEntity user;
    private BookEntity book;
    private ImportJobEntity job;
    private List<Map<String, String>> rows;

    @BeforeEach
    void setUp() throws Exception {
        user = BookshelfUserEntity.builder().id(1L).username("mouse").build();
        book = BookEntity.builder().id(11L).title("Example Edition").build();
        job = ImportJobEntity.builder().id(5L).user(user).source(ImportSource.GOODREADS)
                .createdAt(Instant.parse("2024-03-01T10:15:30Z")).build();

        GoodreadsNormalizer normalizer = new GoodreadsNormalizer();
        try (InputStream in = getClass().getResourceAsStream("/imports/goodreads.csv")) {
            rows = new ImportFileReader().readRows(in, normalizer).stream().map(normalizer::normalize).toList();
        }
        lenient().when(userRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(user));
    }

    @Test
    void handle_shelvesUnshelvedBookWithDateRead() {
        ShelfEntity read = ShelfEntity.builder().id(3L).identifier("read").user(user).build();
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(false);
        when(shelfService.resolveImportShelf(user, "read", true)).thenReturn(read);

        handler.handle(user, item(0), false, PrivacyLevel.PUBLIC);

        ArgumentCaptor<ShelfBookEntity> captor = ArgumentCaptor.forClass(ShelfBookEntity.class);
        verify(shelfBookRepository).save(captor.capture());
        ShelfBookEntity shelfBook = captor.getValue();
        assertSame(read, shelfBook.getShelf());
        assertSame(book, shelfBook.getBook());
        assertSame(user, shelfBook.getUser());
        assertEquals(Instant.parse("2020-10-21T00:00:00Z"), shelfBook.getShelvedDate());
    }

    @Test
    void handle_usesDateAddedWhenBookWasNotFinished() {
        ShelfEntity toRead = ShelfEntity.builder().id(4L).identifier("to-read").user(user).build();
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(false);
        when(shelfService.resolveImportShelf(user, "to-read", false)).thenReturn(toRead);

        handler.handle(user, item(2), false, PrivacyLevel.PUBLIC);

        ArgumentCaptor<ShelfBookEntity> captor = ArgumentCaptor.forClass(ShelfBookEntity.class);
        verify(shelfBookRepository).save(captor.capture());
        assertSame(toRead, captor.getValue().getShelf());
        assertEquals(Instant.parse("2021-01-05T00:00:00Z"), captor.getValue().getShelvedDate());
    }

    @Test
    void handle_leavesExistingShelvingUntouched() {
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);

        handler.handle(user, item(0), false, PrivacyLevel.PUBLIC);

        verify(shelfBookRepository, never()).save(any());
        verifyNoInteractions(shelfService);
    }

    @Test
    void handle_takesUserLockBeforeCheckingShelves() {
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);

        handler.handle(user, item(0), false, PrivacyLevel.PUBLIC);

        var inOrder = inOrder(userRepository, shelfBookRepository);
        inOrder.verify(userRepository).findByIdForUpdate(1L);
        inOrder.verify(shelfBookRepository).existsByUserIdAndBookId(1L, 11L);
    }

    @Test
    void handle_createsReviewWithContentRatingAndPrivacy() {
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);
        when(reviewRepository.existsByUserIdAndBookIdAndPublishedDate(eq(1L), eq(11L), any())).thenReturn(false);
        when(reviewRepository.save(any(ReviewEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        handler.handle(user, item(3), true, PrivacyLevel.UNLISTED);

        ArgumentCaptor<ReviewEntity> captor = ArgumentCaptor.forClass(ReviewEntity.class);
        verify(reviewRepository).save(captor.capture());
        ReviewEntity review = captor.getValue();
        assertEquals("mixed feelings", review.getContent());
        assertEquals(2.0, review.getRating());
        assertEquals(PrivacyLevel.UNLISTED, review.getPrivacy());
        assertSame(user, review.getUser());
        assertSame(book, review.getBook());
        assertEquals(Instant.parse("2019-07-08T00:00:00Z"), review.getPublishedDate());
        verify(statusBroadcaster, times(1)).broadcast(review);
        verify(reviewRatingRepository, never()).save(any());
    }

    @Test
    void handle_createsRatingOnlyWhenThereIsNoReviewText() {
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);
        when(reviewRatingRepository.existsByUserIdAndBookIdAndRatingAndPublishedDate(eq(1L), eq(11L), eq(3.0), any())).thenReturn(false);
        when(reviewRatingRepository.save(any(ReviewRatingEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        handler.handle(user, item(1), true, PrivacyLevel.UNLISTED);

        ArgumentCaptor<ReviewRatingEntity> captor = ArgumentCaptor.forClass(ReviewRatingEntity.class);
        verify(reviewRatingRepository).save(captor.capture());
        assertEquals(3.0, captor.getValue().getRating());
        assertEquals(PrivacyLevel.UNLISTED, captor.getValue().getPrivacy());
        verify(statusBroadcaster).broadcast(captor.getValue());
        verify(reviewRepository, never()).save(any());
    }

    @Test
    void handle_createsNothingWithoutRatingOrReview() {
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);

        handler.handle(user, item(0), true, PrivacyLevel.PUBLIC);

        verify(reviewRepository, never()).save(any());
        verify(reviewRatingRepository, never()).save(any());
        verifyNoInteractions(statusBroadcaster);
    }

    @Test
    void handle_neverCreatesStatusesWhenReviewsExcluded() {
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);

        handler.handle(user, item(3), false, PrivacyLevel.UNLISTED);
        handler.handle(user, item(1), false, PrivacyLevel.UNLISTED);

        verifyNoInteractions(reviewRepository, reviewRatingRepository, statusBroadcaster);
    }

    @Test
    void handle_doesNotDuplicateAnAlreadyImportedReview() {
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);
        when(reviewRepository.existsByUserIdAndBookIdAndPublishedDate(1L, 11L, Instant.parse("2019-07-08T00:00:00Z"))).thenReturn(true);

        handler.handle(user, item(3), true, PrivacyLevel.UNLISTED);

        verify(reviewRepository, never()).save(any());
        verifyNoInteractions(statusBroadcaster);
    }

    @Test
    void handle_usesJobCreationTimeAsPublishedDateForUndatedRows() {
        ImportItemEntity undated = ImportItemEntity.builder().id(99L).job(job).index(0).book(book)
                .data(Map.of("Title", "Undated", "Author", "Someone", "My Rating", "4.0"))
                .build();
        when(shelfBookRepository.existsByUserIdAndBookId(1L, 11L)).thenReturn(true);
        when(reviewRatingRepository.save(any(ReviewRatingEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        handler.handle(user, undated, true, PrivacyLevel.PRIVATE);

        ArgumentCaptor<ReviewRatingEntity> captor = ArgumentCaptor.forClass(ReviewRatingEntity.class);
        verify(reviewRatingRepository).save(captor.capture());
        assertEquals(job.getCreatedAt(), captor.getValue().getPublishedDate());
    }

    @Test
    void handle_rejectsUnresolvedItem() {
        ImportItemEntity unresolved = ImportItemEntity.builder().id(100L).job(job).index(0).data(rows.get(0)).build();

        assertThrows(IllegalStateException.class, () -> handler.handle(user, unresolved, true, PrivacyLevel.PUBLIC));
        verifyNoInteractions(shelfBookRepository, reviewRepository, reviewRatingRepository);
    }

    private ImportItemEntity item(int row) {
        return ImportItemEntity.builder()
                .id((long) row + 1)
                .job(job)
                .index(row)
                .data(rows.get(row))
                .book(book)
                .build();
    }
}
