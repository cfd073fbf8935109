package org.bookshelf.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.apache.commons.lang3.StringUtils;
import org.bookshelf.convertor.ImportRowDataConverter;
import org.bookshelf.model.enums.ImportField;
import org.bookshelf.model.enums.ImportItemStatus;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@Entity
@Table(name = "import_item", uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "item_index"}))
public class ImportItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false)
    private ImportJobEntity job;

    @Column(name = "item_index", nullable = false)
    private int index;

    @Convert(converter = ImportRowDataConverter.class)
    @Column(name = "data", nullable = false, length = 20_000)
    @Builder.Default
    private Map<String, String> data = new LinkedHashMap<>();

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "book_id")
    private BookEntity book;

    @Column(name = "fail_reason", length = 1024)
    private String failReason;

    public String getField(ImportField field) {
        String value = data == null ? null : data.get(field.getKey());
        return StringUtils.isBlank(value) ? null : value.trim();
    }

    public String getTitle() {
        return getField(ImportField.TITLE);
    }

    public String getAuthor() {
        return getField(ImportField.AUTHOR);
    }

    public String getIsbn13() {
        return getField(ImportField.ISBN13);
    }

    public String getReview() {
        return getField(ImportField.REVIEW);
    }

    public String getShelf() {
        return getField(ImportField.SHELF);
    }

    /**
     * Rating on the source's 1-5 scale. Zero and unparseable values mean the row carries no rating.
     */
    public Double getRating() {
        String raw = getField(ImportField.RATING);
        if (raw == null) {
            return null;
        }
        try {
            double rating = Double.parseDouble(raw);
            return rating > 0 ? rating : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public LocalDate getDateAdded() {
        return parseDate(getField(ImportField.DATE_ADDED));
    }

    public LocalDate getDateRead() {
        return parseDate(getField(ImportField.DATE_READ));
    }

    public ImportItemStatus getStatus() {
        if (failReason != null) {
            return ImportItemStatus.FAILED;
        }
        return book != null ? ImportItemStatus.RESOLVED : ImportItemStatus.PENDING;
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
