package org.bookshelf.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@Entity
@DiscriminatorValue("REVIEW")
public class ReviewEntity extends BookStatusEntity {

    @Column(name = "name")
    private String name;

    @Column(name = "content", length = 10_000)
    private String content;
}
