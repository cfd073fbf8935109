package org.bookshelf.service.importer.normalizer;

import org.bookshelf.model.enums.ImportField;
import org.bookshelf.model.enums.ImportSource;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps one row of an external export onto the canonical import columns described by {@link ImportField}.
 * Implementations are stateless; {@link #normalize(Map)} must not touch anything but its argument.
 */
public interface ImportNormalizer {

    ImportSource getSource();

    /**
     * Maps a raw row (header name to cell value) to a map keyed by {@link ImportField#getKey()}.
     * Every canonical key is present in the result; missing values are {@code null}.
     */
    Map<String, String> normalize(Map<String, String> rawRow);

    default Set<ImportField> getMandatoryFields() {
        return EnumSet.of(ImportField.TITLE, ImportField.AUTHOR);
    }

    default Charset getEncoding() {
        return StandardCharsets.UTF_8;
    }

    default char getDelimiter() {
        return ',';
    }

    /**
     * Quote character of the export, or {@code null} when the format does not quote cells.
     */
    default Character getQuoteCharacter() {
        return '"';
    }

    default List<ImportField> findMissingMandatoryFields(Map<String, String> normalizedRow) {
        return getMandatoryFields().stream()
                .filter(field -> {
                    String value = normalizedRow.get(field.getKey());
                    return value == null || value.isBlank();
                })
                .toList();
    }
}
