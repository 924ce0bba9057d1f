package com.wardroute.router.service;

import lombok.Getter;

import java.util.Locale;

/**
 * Field names of a fleet API payload version. Resolved once from configuration.
 */
@Getter
public enum FleetSchema {

    V1("v1", "content", "vehicleNo", "vehicleId", "status", "capacity", "vehicleType", "wardNo"),
    V2("v2", "data", "vehicle_id", "id", "status", "capacity_per_trip", "vehicle_type", "ward_no");

    private final String version;
    private final String envelopeField;
    private final String idField;
    private final String fallbackIdField;
    private final String statusField;
    private final String capacityField;
    private final String typeField;
    private final String wardField;

    FleetSchema(String version, String envelopeField, String idField, String fallbackIdField,
                String statusField, String capacityField, String typeField, String wardField) {
        this.version = version;
        this.envelopeField = envelopeField;
        this.idField = idField;
        this.fallbackIdField = fallbackIdField;
        this.statusField = statusField;
        this.capacityField = capacityField;
        this.typeField = typeField;
        this.wardField = wardField;
    }

    public static FleetSchema forVersion(String version) {
        String normalized = version == null ? "" : version.trim().toLowerCase(Locale.ROOT);
        for (FleetSchema schema : values()) {
            if (schema.version.equals(normalized)) {
                return schema;
            }
        }
        throw new IllegalArgumentException("Unsupported fleet schema version: " + version);
    }
}
