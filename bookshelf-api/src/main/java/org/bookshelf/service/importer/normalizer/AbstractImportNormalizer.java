package org.bookshelf.service.importer.normalizer;

import org.apache.commons.lang3.StringUtils;
import org.bookshelf.model.enums.ImportField;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

public abstract class AbstractImportNormalizer implements ImportNormalizer {

    private static final Pattern HTML_LINE_BREAK = Pattern.compile("(?i)<br\\s*/?>|\\[br]");

    protected Map<String, String> emptyRow() {
        Map<String, String> row = new LinkedHashMap<>();
        for (ImportField field : ImportField.values()) {
            row.put(field.getKey(), null);
        }
        return row;
    }

    protected void put(Map<String, String> row, ImportField field, String value) {
        row.put(field.getKey(), StringUtils.isBlank(value) ? null : value.trim());
    }

    /**
     * Looks a column up by any of its known header names, ignoring case and surrounding whitespace.
     */
    protected String column(Map<String, String> rawRow, String... names) {
        for (String name : names) {
            for (Map.Entry<String, String> entry : rawRow.entrySet()) {
                if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(name)) {
                    String value = entry.getValue();
                    return StringUtils.isBlank(value) ? null : value.trim();
                }
            }
        }
        return null;
    }

    /**
     * Ratings are kept as decimal strings; zero means unrated in every supported export.
     */
    protected String rating(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        try {
            double rating = Double.parseDouble(raw.trim());
            return rating > 0 ? String.valueOf(rating) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected String reviewText(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        return HTML_LINE_BREAK.matcher(raw).replaceAll("\n").trim();
    }
}
