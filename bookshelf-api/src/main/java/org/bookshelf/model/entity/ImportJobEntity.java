package org.bookshelf.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.bookshelf.model.enums.ImportSource;
import org.bookshelf.model.enums.PrivacyLevel;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "import_job")
public class ImportJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private BookshelfUserEntity user;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 50)
    private ImportSource source;

    @Column(name = "include_reviews", nullable = false)
    private boolean includeReviews;

    @Enumerated(EnumType.STRING)
    @Column(name = "privacy", nullable = false, length = 20)
    @Builder.Default
    private PrivacyLevel privacy = PrivacyLevel.PUBLIC;

    /**
     * Handle of the most recent dispatch for this job. Informational only; nothing waits on it.
     */
    @Column(name = "task_id", length = 100)
    private String taskId;

    @Column(name = "retry", nullable = false)
    private boolean retry;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "original_job_id")
    private ImportJobEntity originalJob;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        }
    }
}
