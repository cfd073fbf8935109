package org.bookshelf.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "shelf", uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "identifier"}))
public class ShelfEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private BookshelfUserEntity user;

    @Column(name = "identifier", nullable = false, length = 100)
    private String identifier;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * False for the built-in reading-status shelves, which users cannot rename or delete.
     */
    @Column(name = "editable", nullable = false)
    @Builder.Default
    private boolean editable = true;
}
