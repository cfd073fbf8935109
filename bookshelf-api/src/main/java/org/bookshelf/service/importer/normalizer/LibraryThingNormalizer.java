package org.bookshelf.service.importer.normalizer;

import org.bookshelf.model.enums.ImportField;
import org.bookshelf.model.enums.ImportSource;
import org.bookshelf.model.enums.ShelfType;
import org.bookshelf.util.ImportDateUtils;
import org.bookshelf.util.IsbnUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * LibraryThing exports tab separated, unquoted, Latin-1 text and has no shelf column.
 */
@Component
public class LibraryThingNormalizer extends AbstractImportNormalizer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    @Override
    public ImportSource getSource() {
        return ImportSource.LIBRARYTHING;
    }

    @Override
    public Charset getEncoding() {
        return StandardCharsets.ISO_8859_1;
    }

    @Override
    public char getDelimiter() {
        return '\t';
    }

    @Override
    public Character getQuoteCharacter() {
        return null;
    }

    @Override
    public Map<String, String> normalize(Map<String, String> rawRow) {
        Map<String, String> row = emptyRow();
        put(row, ImportField.ID, column(rawRow, "Book Id"));
        put(row, ImportField.TITLE, column(rawRow, "Title"));
        put(row, ImportField.AUTHOR, column(rawRow, "Primary Author"));
        put(row, ImportField.ISBN13, IsbnUtils.toIsbn13(column(rawRow, "ISBN")));
        put(row, ImportField.RATING, rating(column(rawRow, "Rating")));
        put(row, ImportField.REVIEW, reviewText(column(rawRow, "Review")));

        String dateRead = ImportDateUtils.toIsoDate(column(rawRow, "Date Read"), DATE_FORMAT);
        String dateStarted = ImportDateUtils.toIsoDate(column(rawRow, "Date Started"), DATE_FORMAT);
        put(row, ImportField.DATE_ADDED, ImportDateUtils.toIsoDate(column(rawRow, "Entry Date", "Date Entered"), DATE_FORMAT));
        put(row, ImportField.DATE_READ, dateRead);
        put(row, ImportField.SHELF, shelfFor(dateRead, dateStarted));
        return row;
    }

    private String shelfFor(String dateRead, String dateStarted) {
        if (dateRead != null) {
            return ShelfType.READ.getIdentifier();
        }
        if (dateStarted != null) {
            return "currently-reading";
        }
        return ShelfType.TO_READ.getIdentifier();
    }
}
