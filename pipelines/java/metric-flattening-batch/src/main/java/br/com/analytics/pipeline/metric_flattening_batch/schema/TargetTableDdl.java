package br.com.analytics.pipeline.metric_flattening_batch.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * ClickHouse DDL for the flattened table. Descriptive column types mirror the map-column source table.
 */
public final class TargetTableDdl {

    private static final String CODEC = " CODEC(ZSTD(1))";

    private static final List<String> BASE_COLUMNS = List.of(
            "timestampMs DateTime64(3)",
            "customerId Int32",
            "clientId String",
            "sessionId UInt256",
            "inSession UInt8",
            "userSessionId Int64",
            "inUserSession UInt8",
            "platform LowCardinality(String)",
            "platformSubcategory LowCardinality(String)",
            "appName LowCardinality(String)",
            "appBuild LowCardinality(String)",
            "appVersion LowCardinality(String)",
            "browserName LowCardinality(String) DEFAULT ''",
            "browserVersion LowCardinality(String) DEFAULT ''",
            "userId String DEFAULT ''",
            "deviceManufacturer LowCardinality(String) DEFAULT ''",
            "deviceMarketingName LowCardinality(String) DEFAULT ''",
            "deviceModel LowCardinality(String) DEFAULT ''",
            "deviceHardwareType LowCardinality(String) DEFAULT ''",
            "deviceName LowCardinality(String) DEFAULT ''",
            "deviceCategory LowCardinality(String) DEFAULT ''",
            "deviceOperatingSystem LowCardinality(String) DEFAULT ''",
            "deviceOperatingSystemVersion LowCardinality(String) DEFAULT ''",
            "deviceOperatingSystemFamily LowCardinality(String) DEFAULT ''",
            "country Int64 DEFAULT 0",
            "state Int64 DEFAULT 0",
            "city Int64 DEFAULT 0",
            "countryIso LowCardinality(String)",
            "sub1Iso LowCardinality(String)",
            "sub2Iso String",
            "cityGid Int32",
            "dma Int16",
            "postalCode String DEFAULT ''",
            "isp Int32 DEFAULT 0",
            "netSpeed LowCardinality(String) DEFAULT ''",
            "sensorVersion LowCardinality(String)",
            "appType LowCardinality(String)",
            "asn Int32 DEFAULT 0",
            "timezoneOffsetMins Int32 DEFAULT 0",
            "connType Int32 DEFAULT 0",
            "watermarkMs DateTime64(3)",
            "partitionId Int32",
            "retentionDate Date"
    );

    private TargetTableDdl() {
    }

    public static String createTable(String table, SchemaPlan plan) {
        List<String> definitions = new ArrayList<>();
        for (String column : BASE_COLUMNS) {
            definitions.add(column + CODEC);
        }
        for (String column : plan.intColumns()) {
            definitions.add(column + " Int32 DEFAULT 0" + CODEC);
        }
        for (String column : plan.floatColumns()) {
            definitions.add(column + " Float32 DEFAULT 0" + CODEC);
        }

        return "CREATE TABLE IF NOT EXISTS " + table + " (\n    "
                + String.join(",\n    ", definitions)
                + "\n) ENGINE = MergeTree()"
                + "\nPARTITION BY toYYYYMM(timestampMs)"
                + "\nORDER BY (customerId, clientId, sessionId, timestampMs)"
                + "\nSETTINGS index_granularity = 8192";
    }

    public static String dropTable(String table) {
        return "DROP TABLE IF EXISTS " + table;
    }
}
