package org.bookshelf.repository;

import org.bookshelf.model.entity.ReviewRatingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ReviewRatingRepository extends JpaRepository<ReviewRatingEntity, Long> {

    List<ReviewRatingEntity> findByUserIdAndBookId(Long userId, Long bookId);

    boolean existsByUserIdAndBookIdAndRatingAndPublishedDate(Long userId, Long bookId, Double rating, Instant publishedDate);
}
