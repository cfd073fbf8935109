package org.bookshelf.service.catalog;

import org.bookshelf.model.entity.BookEntity;

import java.util.Optional;

/**
 * Lookup side of the book catalog. Implementations may call remote services and may throw on failure.
 */
public interface BookCatalog {

    Optional<BookEntity> findByIsbn(String isbn13);

    /**
     * Finds the best match for a title and author, creating a catalog entry when the catalog allows it.
     */
    Optional<BookEntity> searchOrCreate(String title, String author);
}
