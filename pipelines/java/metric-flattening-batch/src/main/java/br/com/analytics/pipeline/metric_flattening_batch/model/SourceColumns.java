package br.com.analytics.pipeline.metric_flattening_batch.model;

import java.util.List;

/**
 * Column layout shared by the map-column source table and the flattened target table.
 */
public final class SourceColumns {

    public static final String TIMESTAMP = "timestampMs";
    public static final String CUSTOMER_ID = "customerId";
    public static final String CLIENT_ID = "clientId";
    public static final String SESSION_ID = "sessionId";
    public static final String FLOW_ID = "flowId";

    /**
     * Descriptive columns copied verbatim from the first source row of every aggregation group.
     * Identity columns are not part of this list.
     */
    public static final List<String> DESCRIPTIVE = List.of(
            "inSession", "userSessionId", "inUserSession", "platform", "platformSubcategory",
            "appName", "appBuild", "appVersion", "browserName", "browserVersion",
            "userId", "deviceManufacturer", "deviceMarketingName", "deviceModel",
            "deviceHardwareType", "deviceName", "deviceCategory", "deviceOperatingSystem",
            "deviceOperatingSystemVersion", "deviceOperatingSystemFamily", "country",
            "state", "city", "countryIso", "sub1Iso", "sub2Iso", "cityGid", "dma",
            "postalCode", "isp", "netSpeed", "sensorVersion", "appType", "asn",
            "timezoneOffsetMins", "connType", "watermarkMs", "partitionId", "retentionDate"
    );

    private SourceColumns() {
    }
}
