package org.bookshelf.service.importer.normalizer;

import org.bookshelf.model.enums.ImportField;
import org.bookshelf.model.enums.ImportSource;
import org.bookshelf.util.ImportDateUtils;
import org.bookshelf.util.IsbnUtils;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

@Component
public class GoodreadsNormalizer extends AbstractImportNormalizer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT);

    @Override
    public ImportSource getSource() {
        return ImportSource.GOODREADS;
    }

    @Override
    public Map<String, String> normalize(Map<String, String> rawRow) {
        Map<String, String> row = emptyRow();
        put(row, ImportField.ID, column(rawRow, "Book Id"));
        put(row, ImportField.TITLE, column(rawRow, "Title"));
        put(row, ImportField.AUTHOR, column(rawRow, "Author"));

        String isbn = IsbnUtils.toIsbn13(column(rawRow, "ISBN13"));
        if (isbn == null) {
            isbn = IsbnUtils.toIsbn13(column(rawRow, "ISBN"));
        }
        put(row, ImportField.ISBN13, isbn);

        put(row, ImportField.RATING, rating(column(rawRow, "My Rating")));
        put(row, ImportField.REVIEW, reviewText(column(rawRow, "My Review")));
        put(row, ImportField.SHELF, column(rawRow, "Exclusive Shelf"));
        put(row, ImportField.DATE_ADDED, ImportDateUtils.toIsoDate(column(rawRow, "Date Added"), DATE_FORMAT));
        put(row, ImportField.DATE_READ, ImportDateUtils.toIsoDate(column(rawRow, "Date Read"), DATE_FORMAT));
        return row;
    }
}
