package com.wardroute.router.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteOptimizationMessage {
    private String jobId;
    private RouteRequest request;
    private long submittedAt;
}
