package org.bookshelf.repository;

import org.bookshelf.model.entity.ImportItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ImportItemRepository extends JpaRepository<ImportItemEntity, Long> {

    List<ImportItemEntity> findByJobIdOrderByIndexAsc(Long jobId);

    List<ImportItemEntity> findByJobIdAndFailReasonIsNotNullOrderByIndexAsc(Long jobId);

    long countByJobId(Long jobId);

    long countByJobIdAndFailReasonIsNotNull(Long jobId);

    long countByJobIdAndBookIsNotNullAndFailReasonIsNull(Long jobId);

    @Query("SELECT i.id FROM ImportItemEntity i WHERE i.job.id = :jobId ORDER BY i.index")
    List<Long> findIdsByJobId(@Param("jobId") Long jobId);
}
