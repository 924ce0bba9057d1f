package com.wardroute.router.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllClustersRoadsResponse {

    private int totalClusters;
    private List<ClusterRoadsResponse> clusters;
}
