package org.bookshelf.repository;

import org.bookshelf.model.entity.ImportJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ImportJobRepository extends JpaRepository<ImportJobEntity, Long> {

    List<ImportJobEntity> findByUserIdOrderByCreatedAtDesc(Long userId);

    List<ImportJobEntity> findByOriginalJobId(Long originalJobId);
}
