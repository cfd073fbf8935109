package org.bookshelf.repository;

import org.bookshelf.model.entity.BookEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BookRepository extends JpaRepository<BookEntity, Long> {

    Optional<BookEntity> findFirstByIsbn13OrderByIdAsc(String isbn13);

    @Query("""
            SELECT b FROM BookEntity b
            WHERE LOWER(b.title) = LOWER(:title)
            AND LOWER(b.author) = LOWER(:author)
            ORDER BY b.id
            """)
    List<BookEntity> findByTitleAndAuthorIgnoreCase(@Param("title") String title, @Param("author") String author);
}
