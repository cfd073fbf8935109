package org.bookshelf.service.importer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bookshelf.exception.APIException;
import org.bookshelf.exception.ApiError;
import org.bookshelf.model.entity.BookEntity;
import org.bookshelf.model.entity.ImportItemEntity;
import org.bookshelf.service.catalog.BookCatalog;
import org.bookshelf.util.IsbnUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Finds the catalog book an import row refers to: exact ISBN-13 first, then title and author.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookResolver {

    private final BookCatalog bookCatalog;

    /**
     * @throws APIException with {@link ApiError#IMPORT_BOOK_NOT_FOUND} when nothing matches, or
     *                      {@link ApiError#IMPORT_BOOK_LOOKUP_FAILED} when the catalog itself fails
     */
    public BookEntity resolve(ImportItemEntity item) {
        String description = describe(item);
        try {
            Optional<BookEntity> book = findByIsbn(item);
            if (book.isEmpty()) {
                book = bookCatalog.searchOrCreate(item.getTitle(), item.getAuthor());
            }
            return book.orElseThrow(() -> ApiError.IMPORT_BOOK_NOT_FOUND.createException(description));
        } catch (APIException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Catalog lookup failed for {}: {}", description, e.getMessage());
            throw ApiError.IMPORT_BOOK_LOOKUP_FAILED.createException(e, description, e.getMessage());
        }
    }

    private Optional<BookEntity> findByIsbn(ImportItemEntity item) {
        String isbn = IsbnUtils.toIsbn13(item.getIsbn13());
        if (isbn == null) {
            return Optional.empty();
        }
        Optional<BookEntity> book = bookCatalog.findByIsbn(isbn);
        if (book.isPresent()) {
            log.debug("Resolved ISBN {} to bookId={}", isbn, book.get().getId());
        }
        return book;
    }

    private String describe(ImportItemEntity item) {
        String isbn = item.getIsbn13();
        return "'" + item.getTitle() + "' by " + item.getAuthor() + (isbn != null ? " (ISBN " + isbn + ")" : "");
    }
}
