package org.bookshelf.model.entity;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * A star rating posted without any review text.
 */
@SuperBuilder
@NoArgsConstructor
@Entity
@DiscriminatorValue("RATING")
public class ReviewRatingEntity extends BookStatusEntity {
}
