package com.wardroute.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "fleet")
public class FleetProperties {

    private String baseUrl = "http://localhost:8090";

    private String apiToken = "";

    private String schemaVersion = "v1";

    private int pageSize = 542;

    private int timeoutSeconds = 30;

    private int defaultCapacityPerTrip = 50;
}
