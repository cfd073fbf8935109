package org.bookshelf.service.catalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.bookshelf.model.entity.BookEntity;
import org.bookshelf.repository.BookRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class LocalBookCatalog implements BookCatalog {

    private final BookRepository bookRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<BookEntity> findByIsbn(String isbn13) {
        if (StringUtils.isBlank(isbn13)) {
            return Optional.empty();
        }
        return bookRepository.findFirstByIsbn13OrderByIdAsc(isbn13);
    }

    @Override
    @Transactional
    public Optional<BookEntity> searchOrCreate(String title, String author) {
        if (StringUtils.isAnyBlank(title, author)) {
            return Optional.empty();
        }
        List<BookEntity> matches = bookRepository.findByTitleAndAuthorIgnoreCase(title.trim(), author.trim());
        if (!matches.isEmpty()) {
            return Optional.of(matches.get(0));
        }
        BookEntity created = bookRepository.save(BookEntity.builder()
                .title(title.trim())
                .author(author.trim())
                .build());
        log.info("Created catalog entry: bookId={}, title='{}', author='{}'", created.getId(), created.getTitle(), created.getAuthor());
        return Optional.of(created);
    }
}
