package org.bookshelf.repository;

import jakarta.persistence.LockModeType;
import org.bookshelf.model.entity.BookshelfUserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<BookshelfUserEntity, Long> {

    /**
     * Row lock that serializes every library mutation made on behalf of one user.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM BookshelfUserEntity u WHERE u.id = :id")
    Optional<BookshelfUserEntity> findByIdForUpdate(@Param("id") Long id);
}
