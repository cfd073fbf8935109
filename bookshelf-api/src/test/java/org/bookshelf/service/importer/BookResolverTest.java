package org.bookshelf.service.importer;

import org.bookshelf.exception.APIException;
import org.bookshelf.exception.ApiError;
import org.bookshelf.model.entity.BookEntity;
import org.bookshelf.model.entity.ImportItemEntity;
import org.bookshelf.service.catalog.BookCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookResolverTest {

    @Mock
    private BookCatalog bookCatalog;

    @InjectMocks
    private BookResolver bookResolver;

    @Test
    void resolve_prefersIsbnMatch() {
        BookEntity book = BookEntity.builder().id(7L).title("Gideon the Ninth").build();
        when(bookCatalog.findByIsbn("9781250313195")).thenReturn(Optional.of(book));

        assertSame(book, bookResolver.resolve(item("Gideon the Ninth", "Tamsyn Muir", "9781250313195")));
        verify(bookCatalog, never()).searchOrCreate(anyString(), anyString());
    }

    @Test
    void resolve_fallsBackToTitleAndAuthorWhenIsbnUnknown() {
        BookEntity book = BookEntity.builder().id(8L).title("Harrow the Ninth").build();
        when(bookCatalog.findByIsbn("9781250313225")).thenReturn(Optional.empty());
        when(bookCatalog.searchOrCreate("Harrow the Ninth", "Tamsyn Muir")).thenReturn(Optional.of(book));

        assertSame(book, bookResolver.resolve(item("Harrow the Ninth", "Tamsyn Muir", "9781250313225")));
    }

    @Test
    void resolve_skipsIsbnLookupWithoutUsableIsbn() {
        BookEntity book = BookEntity.builder().id(9L).title("Subcutanean").build();
        when(bookCatalog.searchOrCreate("Subcutanean", "Aaron A. Reed")).thenReturn(Optional.of(book));

        assertSame(book, bookResolver.resolve(item("Subcutanean", "Aaron A. Reed", "12345")));
        verify(bookCatalog, never()).findByIsbn(anyString());
    }

    @Test
    void resolve_throwsNotFoundWhenNothingMatches() {
        when(bookCatalog.searchOrCreate("Subcutanean", "Aaron A. Reed")).thenReturn(Optional.empty());

        APIException e = assertThrows(APIException.class, () -> bookResolver.resolve(item("Subcutanean", "Aaron A. Reed", null)));
        assertEquals(ApiError.IMPORT_BOOK_NOT_FOUND, e.getError());
        assertTrue(e.getMessage().contains("Subcutanean"));
    }

    @Test
    void resolve_wrapsCatalogFailures() {
        when(bookCatalog.findByIsbn("9781250313195")).thenThrow(new IllegalStateException("catalog offline"));

        APIException e = assertThrows(APIException.class,
                () -> bookResolver.resolve(item("Gideon the Ninth", "Tamsyn Muir", "9781250313195")));
        assertEquals(ApiError.IMPORT_BOOK_LOOKUP_FAILED, e.getError());
        assertTrue(e.getMessage().contains("catalog offline"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    private ImportItemEntity item(String title, String author, String isbn) {
        Map<String, String> data = new HashMap<>();
        data.put("Title", title);
        data.put("Author", author);
        data.put("ISBN13", isbn);
        return ImportItemEntity.builder().id(1L).index(0).data(data).build();
    }
}
