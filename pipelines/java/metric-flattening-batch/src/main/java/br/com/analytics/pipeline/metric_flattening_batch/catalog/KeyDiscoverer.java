package br.com.analytics.pipeline.metric_flattening_batch.catalog;

import br.com.analytics.pipeline.metric_flattening_batch.exception.MalformedRowException;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceQuery;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceRowCallback;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceRowReader;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scans the discovery window and collects every metric key of every group, per kind.
 * Rows with malformed metric maps are skipped in full and counted.
 */
@Slf4j
public class KeyDiscoverer {

    private final SourceRowReader reader;
    private final Clock clock;

    public KeyDiscoverer(SourceRowReader reader, Clock clock) {
        this.reader = reader;
        this.clock = clock;
    }

    public DiscoveryResult discover(DiscoveryScope scope) {
        log.info("Starting key discovery on {} for window {}", scope.sourceTable(), scope.window());

        KeyCollector collector = new KeyCollector();
        if (scope.coversAllCustomers()) {
            reader.read(SourceQuery.allCustomers(scope.window()), collector);
        } else {
            for (Integer customerId : scope.customerIds()) {
                int intBefore = collector.intKeys.size();
                int floatBefore = collector.floatKeys.size();
                reader.read(SourceQuery.forCustomer(scope.window(), customerId), collector);
                log.info("Customer {}: +{} int keys, +{} float keys (total so far: {} int, {} float)",
                        customerId,
                        collector.intKeys.size() - intBefore,
                        collector.floatKeys.size() - floatBefore,
                        collector.intKeys.size(),
                        collector.floatKeys.size());
            }
        }

        KeyCatalog catalog = KeyCatalog.fromDiscoveredKeys(scope, clock.instant(), collector.intKeys, collector.floatKeys);
        if (collector.malformedRows > 0) {
            log.warn("Skipped {} malformed rows out of {} scanned", collector.malformedRows, collector.rowsScanned);
        }
        log.info("Discovered {} unique integer keys and {} unique float keys from {} rows",
                catalog.size(MetricKind.INT), catalog.size(MetricKind.FLOAT), collector.rowsScanned);
        return new DiscoveryResult(catalog, collector.rowsScanned, collector.malformedRows);
    }

    /**
     * @return why the row's metric maps cannot be trusted, or null when they are well formed
     */
    static String findDefect(SourceRow row) {
        for (MetricKind kind : MetricKind.values()) {
            List<Map<String, Number>> groups = row.groups(kind);
            if (groups == null || groups.size() != SourceRow.GROUP_COUNT) {
                return "expected " + SourceRow.GROUP_COUNT + " " + kind + " groups";
            }
            for (Map<String, Number> group : groups) {
                if (group == null) {
                    continue;
                }
                for (Map.Entry<String, Number> entry : group.entrySet()) {
                    if (entry.getKey() == null || entry.getKey().isBlank()) {
                        return "blank " + kind + " key";
                    }
                    if (entry.getValue() == null) {
                        return "null value for " + kind + " key '" + entry.getKey() + "'";
                    }
                }
            }
        }
        return null;
    }

    private static final class KeyCollector implements SourceRowCallback {

        private final Set<String> intKeys = new HashSet<>();
        private final Set<String> floatKeys = new HashSet<>();
        private long rowsScanned;
        private long malformedRows;

        @Override
        public void onRow(SourceRow row) {
            rowsScanned++;
            String defect = findDefect(row);
            if (defect != null) {
                malformedRows++;
                log.debug("Skipping row of customer {} client {} at {}: {}",
                        row.customerId(), row.clientId(), row.timestamp(), defect);
                return;
            }
            collect(row.intGroups(), intKeys);
            collect(row.floatGroups(), floatKeys);
        }

        @Override
        public void onMalformedRow(MalformedRowException exception) {
            rowsScanned++;
            malformedRows++;
            log.debug("Skipping undecodable row: {}", exception.getMessage());
        }

        private static void collect(List<Map<String, Number>> groups, Set<String> keys) {
            for (Map<String, Number> group : groups) {
                if (group != null) {
                    keys.addAll(group.keySet());
                }
            }
        }
    }
}
