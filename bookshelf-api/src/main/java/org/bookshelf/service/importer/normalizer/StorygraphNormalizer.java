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
public class StorygraphNormalizer extends AbstractImportNormalizer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT);

    @Override
    public ImportSource getSource() {
        return ImportSource.STORYGRAPH;
    }

    @Override
    public Map<String, String> normalize(Map<String, String> rawRow) {
        Map<String, String> row = emptyRow();
        String identifier = column(rawRow, "ISBN/UID");
        put(row, ImportField.ID, identifier);
        put(row, ImportField.TITLE, column(rawRow, "Title"));
        put(row, ImportField.AUTHOR, column(rawRow, "Authors", "Author"));
        // Books without an ISBN carry a StoryGraph UID in the same column
        put(row, ImportField.ISBN13, IsbnUtils.toIsbn13(identifier));
        put(row, ImportField.RATING, rating(column(rawRow, "Star Rating")));
        put(row, ImportField.REVIEW, reviewText(column(rawRow, "Review")));
        put(row, ImportField.SHELF, column(rawRow, "Read Status"));
        put(row, ImportField.DATE_ADDED, ImportDateUtils.toIsoDate(column(rawRow, "Date Added"), DATE_FORMAT));
        put(row, ImportField.DATE_READ, ImportDateUtils.toIsoDate(column(rawRow, "Last Date Read"), DATE_FORMAT));
        return row;
    }
}
