package com.example.tenantstore.registry;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class HealthReport {

    public static final String UP = "UP";
    public static final String DOWN = "DOWN";

    String status;
    Instant checkedAt;
    Map<String, FamilyHealth> families;

    public boolean isUp() {
        return UP.equals(status);
    }

    @Value
    public static class FamilyHealth {
        String container;
        String status;
        long latencyMs;
        String error;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status);
        map.put("checkedAt", checkedAt.toString());
        Map<String, Object> details = new LinkedHashMap<>();
        families.forEach((family, health) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("container", health.getContainer());
            entry.put("status", health.getStatus());
            entry.put("latencyMs", health.getLatencyMs());
            if (health.getError() != null) {
                entry.put("error", health.getError());
            }
            details.put(family, entry);
        });
        map.put("families", details);
        return map;
    }
}
