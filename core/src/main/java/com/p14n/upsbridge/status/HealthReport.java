package com.p14n.upsbridge.status;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Point-in-time health of the service and its components.
 *
 * @param service          service name
 * @param version          service version
 * @param status           {@code healthy} or {@code degraded}
 * @param components       component name to state
 * @param lastNutPoll      ISO-8601 UTC time of the latest poll, if any
 * @param lastDbSave       ISO-8601 UTC time of the latest save, if any
 * @param devicesMonitored devices the collector holds records for
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "service", "version", "status", "components", "last_nut_poll", "last_db_save",
        "devices_monitored" })
public record HealthReport(String service,
        String version,
        String status,
        Map<String, String> components,
        @JsonProperty("last_nut_poll") String lastNutPoll,
        @JsonProperty("last_db_save") String lastDbSave,
        @JsonProperty("devices_monitored") Integer devicesMonitored) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
