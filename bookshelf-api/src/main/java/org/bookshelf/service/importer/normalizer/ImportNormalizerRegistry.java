package org.bookshelf.service.importer.normalizer;

import lombok.extern.slf4j.Slf4j;
import org.bookshelf.config.AppProperties;
import org.bookshelf.exception.ApiError;
import org.bookshelf.model.enums.ImportSource;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ImportNormalizerRegistry {

    private final Map<ImportSource, ImportNormalizer> normalizers = new EnumMap<>(ImportSource.class);
    private final AppProperties appProperties;

    public ImportNormalizerRegistry(List<ImportNormalizer> normalizers, AppProperties appProperties) {
        this.appProperties = appProperties;
        for (ImportNormalizer normalizer : normalizers) {
            ImportNormalizer previous = this.normalizers.put(normalizer.getSource(), normalizer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate normalizers for source " + normalizer.getSource()
                        + ": " + previous.getClass().getSimpleName() + ", " + normalizer.getClass().getSimpleName());
            }
        }
        log.info("Registered import normalizers for sources {}", this.normalizers.keySet());
    }

    public ImportNormalizer getNormalizer(ImportSource source) {
        ImportSource effective = source != null ? source : appProperties.getImporter().getDefaultSource();
        ImportNormalizer normalizer = normalizers.get(effective);
        if (normalizer == null) {
            throw ApiError.UNSUPPORTED_IMPORT_SOURCE.createException(effective);
        }
        return normalizer;
    }
}
