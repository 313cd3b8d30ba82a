package br.com.analytics.pipeline.metric_flattening_batch.catalog;

import br.com.analytics.pipeline.metric_flattening_batch.exception.CatalogMismatchException;
import br.com.analytics.pipeline.metric_flattening_batch.exception.InvalidCatalogException;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyCatalogStoreTest {

    private static final TimeWindow DAY = new TimeWindow(
            Instant.parse("2025-10-08T00:00:00Z"), Instant.parse("2025-10-09T00:00:00Z"));
    private static final DiscoveryScope SCOPE = new DiscoveryScope("metrics_map", DAY, List.of(1, 2));

    @TempDir
    Path tempDir;

    private KeyCatalog catalog() {
        return KeyCatalog.fromDiscoveredKeys(SCOPE, Instant.parse("2025-10-10T08:00:00Z"),
                Set.of("views", "clicks"), Set.of("ttfb"));
    }

    @Test
    void savedCatalogLoadsBackUnchanged() {
        KeyCatalogStore store = new KeyCatalogStore(tempDir.resolve("mappings/key_catalog.json"));

        store.save(catalog());

        assertThat(store.exists()).isTrue();
        assertThat(store.load()).isEqualTo(catalog());
        assertThat(store.load(new DiscoveryScope("metrics_map", DAY, List.of(2)))).isEqualTo(catalog());
    }

    @Test
    void documentListsKeySlotAndColumn() throws Exception {
        Path file = tempDir.resolve("key_catalog.json");
        new KeyCatalogStore(file).save(catalog());

        String json = Files.readString(file);

        assertThat(json).contains("\"formatVersion\" : 1");
        assertThat(json).contains("\"key\" : \"clicks\"", "\"column\" : \"int1\"", "\"column\" : \"float1\"");
    }

    @Test
    void loadFailsForMissingFile() {
        KeyCatalogStore store = new KeyCatalogStore(tempDir.resolve("absent.json"));

        assertThatThrownBy(store::load)
                .isInstanceOf(InvalidCatalogException.class)
                .hasMessageContaining("run key discovery first");
    }

    @Test
    void loadRejectsScopeThatDoesNotCoverRun() {
        KeyCatalogStore store = new KeyCatalogStore(tempDir.resolve("key_catalog.json"));
        store.save(catalog());

        assertThatThrownBy(() -> store.load(new DiscoveryScope("metrics_map", DAY, List.of(3))))
                .isInstanceOf(CatalogMismatchException.class);
    }

    @Test
    void loadRejectsUnsupportedVersion() throws Exception {
        Path file = tempDir.resolve("key_catalog.json");
        KeyCatalogStore store = new KeyCatalogStore(file);
        store.save(catalog());
        Files.writeString(file, Files.readString(file).replace("\"formatVersion\" : 1", "\"formatVersion\" : 2"));

        assertThatThrownBy(store::load)
                .isInstanceOf(InvalidCatalogException.class)
                .hasMessageContaining("format version 2");
    }

    @Test
    void loadRejectsDuplicateKeys() throws Exception {
        Path file = tempDir.resolve("key_catalog.json");
        Files.writeString(file, """
                {
                  "formatVersion" : 1,
                  "generatedAt" : "2025-10-10T08:00:00Z",
                  "scope" : {
                    "sourceTable" : "metrics_map",
                    "windowStart" : "2025-10-08T00:00:00Z",
                    "windowEnd" : "2025-10-09T00:00:00Z",
                    "customerIds" : [ ]
                  },
                  "intColumns" : [
                    { "key" : "views", "slot" : 0, "column" : "int1" },
                    { "key" : "views", "slot" : 1, "column" : "int2" }
                  ],
                  "floatColumns" : [ ]
                }
                """);

        assertThatThrownBy(() -> new KeyCatalogStore(file).load())
                .isInstanceOf(InvalidCatalogException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void loadRejectsGapInSlots() throws Exception {
        Path file = tempDir.resolve("key_catalog.json");
        Files.writeString(file, """
                {
                  "formatVersion" : 1,
                  "generatedAt" : "2025-10-10T08:00:00Z",
                  "scope" : {
                    "sourceTable" : "metrics_map",
                    "windowStart" : "2025-10-08T00:00:00Z",
                    "windowEnd" : "2025-10-09T00:00:00Z"
                  },
                  "intColumns" : [ { "key" : "views", "slot" : 1, "column" : "int2" } ],
                  "floatColumns" : [ ]
                }
                """);

        assertThatThrownBy(() -> new KeyCatalogStore(file).load())
                .isInstanceOf(InvalidCatalogException.class)
                .hasMessageContaining("contiguous");
    }

    @Test
    void loadRejectsGarbage() throws Exception {
        Path file = tempDir.resolve("key_catalog.json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> new KeyCatalogStore(file).load())
                .isInstanceOf(InvalidCatalogException.class);
    }

    @Test
    void emptyCatalogRoundTrips() {
        KeyCatalogStore store = new KeyCatalogStore(tempDir.resolve("key_catalog.json"));
        KeyCatalog empty = KeyCatalog.fromDiscoveredKeys(SCOPE, Instant.EPOCH, Set.of(), Set.of());

        store.save(empty);

        assertThat(store.load().size(MetricKind.INT)).isZero();
    }
}
