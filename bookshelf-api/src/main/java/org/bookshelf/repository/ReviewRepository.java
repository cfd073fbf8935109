package org.bookshelf.repository;

import org.bookshelf.model.entity.ReviewEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ReviewRepository extends JpaRepository<ReviewEntity, Long> {

    List<ReviewEntity> findByUserIdAndBookId(Long userId, Long bookId);

    boolean existsByUserIdAndBookIdAndPublishedDate(Long userId, Long bookId, Instant publishedDate);
}
