package org.bookshelf.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "book")
public class BookEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "author")
    private String author;

    @Column(name = "isbn13", length = 13)
    private String isbn13;

    @Column(name = "added_on", nullable = false, updatable = false)
    private Instant addedOn;

    @PrePersist
    protected void onCreate() {
        if (addedOn == null) {
            addedOn = Instant.now();
        }
    }
}
