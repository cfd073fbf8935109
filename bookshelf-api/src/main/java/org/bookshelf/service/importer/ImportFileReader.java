package org.bookshelf.service.importer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.bookshelf.exception.ApiError;
import org.bookshelf.service.importer.normalizer.ImportNormalizer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an export file into raw rows (header to cell value) in file order, using the encoding and
 * dialect declared by the source's normalizer.
 */
@Slf4j
@Component
public class ImportFileReader {

    public List<Map<String, String>> readRows(InputStream file, ImportNormalizer normalizer) {
        List<Map<String, String>> rows = new ArrayList<>();
        try (InputStream input = BOMInputStream.builder().setInputStream(file).get();
             Reader reader = new InputStreamReader(input, normalizer.getEncoding());
             CSVParser parser = csvFormat(normalizer).parse(reader)) {
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>(record.toMap());
                if (row.values().stream().allMatch(value -> value == null || value.isBlank())) {
                    continue;
                }
                rows.add(row);
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            log.warn("Failed to parse {} import file: {}", normalizer.getSource(), e.getMessage());
            throw ApiError.UNREADABLE_IMPORT_FILE.createException(e, e.getMessage());
        }
        log.debug("Read {} rows from {} import file", rows.size(), normalizer.getSource());
        return rows;
    }

    private CSVFormat csvFormat(ImportNormalizer normalizer) {
        return CSVFormat.DEFAULT.builder()
                .setDelimiter(normalizer.getDelimiter())
                .setQuote(normalizer.getQuoteCharacter())
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setIgnoreSurroundingSpaces(true)
                .setTrim(true)
                .build();
    }
}
