package com.wardroute.router.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wardroute.router.config.FleetProperties;
import com.wardroute.router.exception.FleetClientException;
import com.wardroute.router.model.Vehicle;
import com.wardroute.router.model.VehicleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches vehicles from the fleet management API and maps them through the configured
 * {@link FleetSchema}.
 */
@Service
public class FleetClient {

    private static final Logger logger = LoggerFactory.getLogger(FleetClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final FleetProperties properties;
    private final FleetSchema schema;

    @Autowired
    public FleetClient(FleetProperties properties) {
        this(WebClient.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024)) // 10MB limit
                        .build(),
                new ObjectMapper(),
                properties);
    }

    FleetClient(WebClient webClient, ObjectMapper objectMapper, FleetProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.schema = FleetSchema.forVersion(properties.getSchemaVersion());
        logger.info("FleetClient initialized with base URL {} and schema {}", properties.getBaseUrl(), schema.getVersion());
    }

    public List<Vehicle> fetchVehiclesByWard(String wardNo) {
        if (wardNo == null || wardNo.isBlank()) {
            throw new FleetClientException("Ward number is required to fetch vehicles");
        }

        String url = String.format("%s/api/vehicles/paginated?date=%s&size=%d&sortBy=vehicleNo",
                properties.getBaseUrl(), LocalDate.now(), properties.getPageSize());
        logger.info("Fetching vehicles for ward {} from {}", wardNo, url);

        String body;
        try {
            body = webClient.get()
                    .uri(url)
                    .headers(headers -> headers.setBearerAuth(properties.getApiToken()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (Exception e) {
            logger.error("Fleet API call failed for ward {}: {}", wardNo, e.getMessage());
            throw new FleetClientException("Failed to fetch vehicles: " + e.getMessage(), e);
        }

        List<Vehicle> vehicles = parseVehicles(body, wardNo.trim());
        logger.info("Loaded {} vehicles for ward {}", vehicles.size(), wardNo);
        return vehicles;
    }

    List<Vehicle> parseVehicles(String body, String wardNo) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            throw new FleetClientException("Fleet API returned an unreadable payload", e);
        }

        JsonNode records = root.isArray() ? root : root.get(schema.getEnvelopeField());
        if (records == null || !records.isArray()) {
            throw new FleetClientException("Fleet API payload has no '" + schema.getEnvelopeField() + "' array");
        }

        List<Vehicle> vehicles = new ArrayList<>();
        for (JsonNode record : records) {
            if (!wardNo.equals(text(record, schema.getWardField()))) {
                continue;
            }
            String id = text(record, schema.getIdField());
            if (id == null) {
                id = text(record, schema.getFallbackIdField());
            }
            if (id == null) {
                logger.warn("Skipping fleet record without '{}' or '{}'", schema.getIdField(), schema.getFallbackIdField());
                continue;
            }

            String type = text(record, schema.getTypeField());
            JsonNode capacity = record.get(schema.getCapacityField());
            int capacityPerTrip = capacity != null && capacity.isNumber() && capacity.canConvertToInt()
                    ? capacity.asInt()
                    : properties.getDefaultCapacityPerTrip();

            vehicles.add(new Vehicle(
                    id,
                    type != null ? type : Vehicle.DEFAULT_TYPE,
                    capacityPerTrip,
                    VehicleStatus.fromLabel(text(record, schema.getStatusField()))
            ));
        }
        return vehicles;
    }

    private static String text(JsonNode record, String field) {
        JsonNode value = record.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
