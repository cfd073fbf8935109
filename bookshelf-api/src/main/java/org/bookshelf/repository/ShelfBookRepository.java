package org.bookshelf.repository;

import org.bookshelf.model.entity.ShelfBookEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShelfBookRepository extends JpaRepository<ShelfBookEntity, Long> {

    boolean existsByUserIdAndBookId(Long userId, Long bookId);

    List<ShelfBookEntity> findByUserIdAndBookId(Long userId, Long bookId);
}
