package org.bookshelf.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.bookshelf.model.enums.ImportSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app")
@Validated
@Getter
@Setter
public class AppProperties {
    private String version;

    @Valid
    private Importer importer = new Importer();

    @Getter
    @Setter
    public static class Importer {
        /**
         * Source format assumed when the caller does not name one explicitly.
         */
        @NotNull(message = "Default import source must be set.")
        private ImportSource defaultSource = ImportSource.GOODREADS;

        /**
         * Reported as the {@code software} field on every broadcast created by an import.
         */
        @NotBlank(message = "Software name must not be empty.")
        private String softwareName = "bookshelf";

        @Valid
        private Executor executor = new Executor();
    }

    @Getter
    @Setter
    public static class Executor {
        @Min(value = 1, message = "Core pool size must be at least 1")
        private int corePoolSize = 2;
        @Min(value = 1, message = "Max pool size must be at least 1")
        private int maxPoolSize = 4;
        @Min(value = 0, message = "Queue capacity must not be negative")
        private int queueCapacity = 10_000;
    }
}
