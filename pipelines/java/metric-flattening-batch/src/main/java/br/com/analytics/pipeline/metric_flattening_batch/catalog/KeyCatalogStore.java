package br.com.analytics.pipeline.metric_flattening_batch.catalog;

import br.com.analytics.pipeline.metric_flattening_batch.exception.InvalidCatalogException;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Persists a {@link KeyCatalog} as a versioned JSON document so a transformation can resume
 * across process restarts with the same key to column mapping.
 */
@Slf4j
public class KeyCatalogStore {

    private final Path catalogFile;
    private final ObjectMapper objectMapper;

    public KeyCatalogStore(Path catalogFile) {
        this.catalogFile = catalogFile;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getCatalogFile() {
        return catalogFile;
    }

    public boolean exists() {
        return Files.exists(catalogFile);
    }

    public void save(KeyCatalog catalog) {
        log.info("Saving key catalog to {}", catalogFile);
        DiscoveryScope scope = catalog.scope();
        CatalogDocument document = new CatalogDocument(
                KeyCatalog.FORMAT_VERSION,
                catalog.generatedAt(),
                new ScopeDocument(scope.sourceTable(), scope.window().start(), scope.window().end(), scope.customerIds()),
                toEntries(catalog, MetricKind.INT),
                toEntries(catalog, MetricKind.FLOAT)
        );
        try {
            Path parent = catalogFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temporary = catalogFile.resolveSibling(catalogFile.getFileName() + ".tmp");
            objectMapper.writeValue(temporary.toFile(), document);
            Files.move(temporary, catalogFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save key catalog to {}", catalogFile, e);
            throw new UncheckedIOException("Failed to save key catalog to " + catalogFile, e);
        }
        log.info("Key catalog saved: {} int columns, {} float columns",
                catalog.size(MetricKind.INT), catalog.size(MetricKind.FLOAT));
    }

    /**
     * Loads the catalog and checks it was discovered for a scope covering {@code required}.
     */
    public KeyCatalog load(DiscoveryScope required) {
        KeyCatalog catalog = load();
        catalog.scope().requireCovers(required);
        return catalog;
    }

    public KeyCatalog load() {
        log.info("Loading key catalog from {}", catalogFile);
        CatalogDocument document;
        try {
            document = objectMapper.readValue(catalogFile.toFile(), CatalogDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException("Key catalog " + catalogFile + " is not a valid catalog document", e);
        } catch (IOException e) {
            if (e instanceof NoSuchFileException || !Files.exists(catalogFile)) {
                throw new InvalidCatalogException("No key catalog at " + catalogFile + "; run key discovery first", e);
            }
            throw new UncheckedIOException("Failed to read key catalog " + catalogFile, e);
        }

        if (document.formatVersion() != KeyCatalog.FORMAT_VERSION) {
            throw new InvalidCatalogException("Unsupported key catalog format version " + document.formatVersion()
                    + " (expected " + KeyCatalog.FORMAT_VERSION + ")");
        }
        ScopeDocument scope = document.scope();
        if (scope == null || scope.sourceTable() == null || scope.windowStart() == null || scope.windowEnd() == null) {
            throw new InvalidCatalogException("Key catalog " + catalogFile + " has no discovery scope");
        }
        if (document.generatedAt() == null) {
            throw new InvalidCatalogException("Key catalog " + catalogFile + " has no generation time");
        }

        KeyCatalog catalog = new KeyCatalog(
                new DiscoveryScope(scope.sourceTable(), new TimeWindow(scope.windowStart(), scope.windowEnd()), scope.customerIds()),
                document.generatedAt(),
                fromEntries(document.intColumns(), MetricKind.INT),
                fromEntries(document.floatColumns(), MetricKind.FLOAT)
        );
        log.info("Loaded key catalog with {} int columns and {} float columns",
                catalog.size(MetricKind.INT), catalog.size(MetricKind.FLOAT));
        return catalog;
    }

    private static List<ColumnEntry> toEntries(KeyCatalog catalog, MetricKind kind) {
        List<String> keys = catalog.keys(kind);
        List<ColumnEntry> entries = new ArrayList<>(keys.size());
        for (int slot = 0; slot < keys.size(); slot++) {
            entries.add(new ColumnEntry(keys.get(slot), slot, kind.columnName(slot)));
        }
        return entries;
    }

    private static List<String> fromEntries(List<ColumnEntry> entries, MetricKind kind) {
        if (entries == null) {
            return List.of();
        }
        List<ColumnEntry> ordered = new ArrayList<>(entries);
        ordered.sort(Comparator.comparingInt(ColumnEntry::slot));
        List<String> keys = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ColumnEntry entry = ordered.get(i);
            if (entry.key() == null) {
                throw new InvalidCatalogException("Null " + kind + " key at slot " + entry.slot());
            }
            if (entry.slot() != i) {
                throw new InvalidCatalogException(kind + " slots must be contiguous from 0, found slot "
                        + entry.slot() + " at position " + i);
            }
            if (entry.column() != null && !entry.column().equals(kind.columnName(i))) {
                throw new InvalidCatalogException(kind + " key '" + entry.key() + "' at slot " + i
                        + " names column " + entry.column() + " instead of " + kind.columnName(i));
            }
            keys.add(entry.key());
        }
        return keys;
    }

    record CatalogDocument(
            int formatVersion,
            Instant generatedAt,
            ScopeDocument scope,
            List<ColumnEntry> intColumns,
            List<ColumnEntry> floatColumns
    ) {
    }

    record ScopeDocument(
            String sourceTable,
            Instant windowStart,
            Instant windowEnd,
            List<Integer> customerIds
    ) {
    }

    record ColumnEntry(
            String key,
            int slot,
            String column
    ) {
    }
}
